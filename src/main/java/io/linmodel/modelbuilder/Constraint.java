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

package io.linmodel.modelbuilder;

import static com.google.common.base.Preconditions.checkNotNull;

import io.linmodel.expr.ComparisonOperator;
import java.util.Objects;

/**
 * A linear constraint {@code left op right}.
 *
 * <p>Constraints are normalized on creation: the variable terms of both sides are moved to the
 * left and the constants to the right, so {@code x + 2 <= y + 5} is stored as {@code x - y <= 3}.
 * A right side may instead be unbounded, in which case the left side keeps only its variable terms.
 */
public final class Constraint {
  private final Polynomial left;
  private final ComparisonOperator operator;
  private final Polynomial right;
  private final String name;
  private final String description;

  private Constraint(
      Polynomial left,
      ComparisonOperator operator,
      Polynomial right,
      String name,
      String description) {
    this.left = left;
    this.operator = operator;
    this.right = right;
    this.name = name;
    this.description = description;
  }

  /**
   * Creates {@code left op right}.
   *
   * @throws ModelException.UnsupportedOperator if {@code op} is not one of {@code ==, <=, >=}
   * @throws ModelException.NonlinearExpression if a side has a term of arity above one
   */
  public static Constraint create(Polynomial left, ComparisonOperator op, Polynomial right) {
    checkOperator(op);
    checkLinear(left, op, right);
    checkLinear(right, op, left);
    Polynomial difference = left.subtract(right);
    Polynomial.ConstantSplit split = difference.splitConstant();
    return new Constraint(
        split.getNonConstant(), op, Polynomial.constant(-split.getConstant()), null, null);
  }

  /**
   * Creates {@code left op unbounded}.
   *
   * @throws ModelException.UnsupportedOperator if {@code op} is not {@code <=} or {@code >=}
   */
  public static Constraint createUnbounded(Polynomial left, ComparisonOperator op) {
    checkOperator(op);
    checkLinear(left, op, "unbounded");
    if (op == ComparisonOperator.EQ) {
      throw new ModelException.UnsupportedOperator(
          "Constraint.createUnbounded", op.symbol(), "an equality cannot have an unbounded side");
    }
    return new Constraint(left.splitConstant().getNonConstant(), op, null, null, null);
  }

  private static void checkOperator(ComparisonOperator op) {
    checkNotNull(op);
    if (!op.isConstraintOperator()) {
      throw new ModelException.UnsupportedOperator(
          "Constraint.create", op.symbol(), "constraints only accept ==, <= and >=");
    }
  }

  private static void checkLinear(Polynomial p, ComparisonOperator op, Object other) {
    if (!p.isLinear()) {
      throw new ModelException.NonlinearExpression("Constraint.create", op.symbol(), p, other);
    }
  }

  /** Returns the variable terms. */
  public Polynomial getLeft() {
    return left;
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  /** Returns true if the right side is unbounded. */
  public boolean isUnbounded() {
    return right == null;
  }

  /** Returns the constant right side; must not be called on an unbounded constraint. */
  public Polynomial getRight() {
    if (right == null) {
      throw new IllegalStateException("the right side of " + this + " is unbounded");
    }
    return right;
  }

  /** Returns the right side value, {@code +inf} when unbounded. */
  public double getRightValue() {
    return right == null ? Double.POSITIVE_INFINITY : right.constantValue();
  }

  /** Returns the name of the constraint given upon creation, or null. */
  public String getName() {
    return name;
  }

  /** Returns the description, or null. */
  public String getDescription() {
    return description;
  }

  /** Inline setter */
  public Constraint withName(String name) {
    return new Constraint(left, operator, right, name, description);
  }

  /** Inline setter */
  public Constraint withDescription(String description) {
    return new Constraint(left, operator, right, name, description);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Constraint)) {
      return false;
    }
    Constraint other = (Constraint) o;
    return other.left.equals(left)
        && other.operator == operator
        && Objects.equals(other.right, right)
        && Objects.equals(other.name, name)
        && Objects.equals(other.description, description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, operator, right, name, description);
  }

  @Override
  public String toString() {
    String body =
        left + " " + operator.symbol() + " " + (right == null ? "unbounded" : right.toString());
    return name == null ? body : name + ": " + body;
  }
}
