// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.linmodel.lp;

import io.linmodel.modelbuilder.Constraint;
import io.linmodel.modelbuilder.Direction;
import io.linmodel.modelbuilder.Model;
import io.linmodel.modelbuilder.Monomial;
import io.linmodel.modelbuilder.Polynomial;
import io.linmodel.modelbuilder.VariableDefinition;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Writes a {@link Model} in the LP file format read by HiGHS.
 *
 * <pre>
 * Minimize
 *   2 x + y
 * Subject To
 *   capacity: x + y &lt;= 10
 * Bounds
 *   0 &lt;= x &lt;= 10
 *   y free
 * General
 * End
 * </pre>
 *
 * <p>The output only depends on the model: constraints are written in id order, variables in
 * declaration order and terms in insertion order.
 */
public final class LpWriter {
  private static final Logger logger = Logger.getLogger(LpWriter.class.getName());

  /** How an unbounded right side is written. */
  public static final String INFINITY = "1e+30";

  private LpWriter() {}

  /** Returns the LP text of {@code model}, UTF-8 encoded. */
  public static byte[] serialize(Model model) {
    return exportToLpString(model).getBytes(StandardCharsets.UTF_8);
  }

  /** Returns the LP text of {@code model}. */
  public static String exportToLpString(Model model) {
    StringBuilder lp = new StringBuilder();
    lp.append(model.getDirection() == Direction.MAXIMIZE ? "Maximize" : "Minimize").append('\n');
    lp.append("  ").append(terms(model.getObjective())).append('\n');

    lp.append("Subject To\n");
    Set<String> usedNames = new HashSet<>();
    for (Map.Entry<String, Constraint> entry : model.getConstraints().entrySet()) {
      String id = entry.getKey();
      Constraint constraint = entry.getValue();
      if (constraint.getLeft().isZero()) {
        logger.warning("Skipping constraint " + id + " without variables: " + constraint);
        continue;
      }
      lp.append("  ");
      String name = constraint.getName();
      if (name != null && !name.isEmpty()) {
        if (!usedNames.add(name)) {
          name = name + "_" + id;
          usedNames.add(name);
        }
        lp.append(name).append(": ");
      }
      lp.append(terms(constraint.getLeft()))
          .append(' ')
          .append(operator(constraint))
          .append(' ')
          .append(constraint.isUnbounded() ? INFINITY : number(constraint.getRightValue()))
          .append('\n');
    }

    lp.append("Bounds\n");
    for (VariableDefinition variable : model.getVariables().values()) {
      lp.append("  ").append(bounds(variable)).append('\n');
    }

    lp.append("General\n");
    for (VariableDefinition variable : model.getVariables().values()) {
      if (variable.getIntegrality()) {
        lp.append("  ").append(variable.getName()).append('\n');
      }
    }
    lp.append("End\n");
    return lp.toString();
  }

  /** Writes the LP text of {@code model} to {@code file}. */
  public static void writeToLpFile(Model model, Path file) throws IOException {
    Files.write(file, serialize(model));
  }

  private static String operator(Constraint constraint) {
    switch (constraint.getOperator()) {
      case EQ:
        return "=";
      case LE:
        return "<=";
      case GE:
        return ">=";
      default:
        throw new IllegalStateException("not a constraint operator: " + constraint.getOperator());
    }
  }

  private static String bounds(VariableDefinition variable) {
    String name = variable.getName();
    if (variable.hasLowerBound() && variable.hasUpperBound()) {
      return number(variable.getLowerBound())
          + " <= "
          + name
          + " <= "
          + number(variable.getUpperBound());
    }
    if (variable.hasLowerBound()) {
      return number(variable.getLowerBound()) + " <= " + name;
    }
    if (variable.hasUpperBound()) {
      return "-inf <= " + name + " <= " + number(variable.getUpperBound());
    }
    return name + " free";
  }

  /**
   * Returns the terms of {@code p} with their signs folded: {@code 2 x - y + 3}. The zero
   * polynomial is written {@code 0}.
   */
  static String terms(Polynomial p) {
    if (p.isZero()) {
      return "0";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Monomial, Double> term : p.getTerms().entrySet()) {
      double coefficient = term.getValue();
      Monomial monomial = term.getKey();
      boolean negative = coefficient < 0;
      double magnitude = Math.abs(coefficient);
      if (sb.length() == 0) {
        if (negative) {
          sb.append('-');
        }
      } else {
        sb.append(negative ? " - " : " + ");
      }
      if (monomial.isConstant()) {
        sb.append(number(magnitude));
      } else {
        if (magnitude != 1.0) {
          sb.append(number(magnitude)).append(' ');
        }
        sb.append(monomial.getVariable());
      }
    }
    return sb.toString();
  }

  /** Writes integral values without a fraction and others in plain decimal notation. */
  static String number(double value) {
    if (Double.isInfinite(value)) {
      return value > 0 ? INFINITY : "-" + INFINITY;
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
