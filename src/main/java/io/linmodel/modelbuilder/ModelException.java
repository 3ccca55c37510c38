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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Collection;

/**
 * Base class of the errors raised while compiling a model.
 *
 * <p>Errors are raised where they are detected and are never retried. The operation that raised
 * one returns no model, so the model passed in stays as it was.
 */
public class ModelException extends RuntimeException {
  public ModelException(String methodName, String msg) {
    // Call constructor of parent Exception
    super(methodName + ": " + msg);
  }

  private static String names(Collection<String> names) {
    return names.isEmpty() ? "(none)" : Joiner.on(", ").join(names);
  }

  /** Exception thrown when a symbol is neither bound by a generator nor a model parameter. */
  public static class UndefinedSymbol extends ModelException {
    private final String symbol;
    private final ImmutableList<String> bindingNames;
    private final ImmutableList<String> parameterNames;

    public UndefinedSymbol(
        String methodName,
        String symbol,
        Collection<String> bindingNames,
        Collection<String> parameterNames) {
      super(
          methodName,
          "undefined symbol '"
              + symbol
              + "'; bound symbols: "
              + names(bindingNames)
              + "; parameters: "
              + names(parameterNames));
      this.symbol = symbol;
      this.bindingNames = ImmutableList.copyOf(bindingNames);
      this.parameterNames = ImmutableList.copyOf(parameterNames);
    }

    public String getSymbol() {
      return symbol;
    }

    public ImmutableList<String> getBindingNames() {
      return bindingNames;
    }

    public ImmutableList<String> getParameterNames() {
      return parameterNames;
    }
  }

  /** Exception thrown when an expression references a variable that was never declared. */
  public static class UndefinedVariable extends ModelException {
    private final String variable;
    private final ImmutableList<String> knownNames;

    public UndefinedVariable(String methodName, String variable, Collection<String> knownNames) {
      super(
          methodName,
          "undefined variable '"
              + variable
              + "'; declared variables and families: "
              + names(knownNames));
      this.variable = variable;
      this.knownNames = ImmutableList.copyOf(knownNames);
    }

    public UndefinedVariable(String methodName, String variable, String msg) {
      super(methodName, "undefined variable '" + variable + "'; " + msg);
      this.variable = variable;
      this.knownNames = ImmutableList.of();
    }

    public String getVariable() {
      return variable;
    }

    public ImmutableList<String> getKnownNames() {
      return knownNames;
    }
  }

  /** Exception thrown when a product or a quotient would not be linear. */
  public static class NonlinearExpression extends ModelException {
    private final String operator;
    private final String left;
    private final String right;

    public NonlinearExpression(String methodName, String operator, Object left, Object right) {
      super(
          methodName,
          "operator '"
              + operator
              + "' needs a constant operand, got "
              + left
              + " and "
              + right);
      this.operator = operator;
      this.left = String.valueOf(left);
      this.right = String.valueOf(right);
    }

    public String getOperator() {
      return operator;
    }

    public String getLeft() {
      return left;
    }

    public String getRight() {
      return right;
    }
  }

  /** Exception thrown when an operator is not allowed where it appears. */
  public static class UnsupportedOperator extends ModelException {
    private final String operator;

    public UnsupportedOperator(String methodName, String operator, String msg) {
      super(methodName, "unsupported operator '" + operator + "': " + msg);
      this.operator = operator;
    }

    public String getOperator() {
      return operator;
    }
  }

  /** Exception thrown when a generator domain is not a sequence, a range or a mapping. */
  public static class NotEnumerable extends ModelException {
    public NotEnumerable(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  /** Exception thrown on an invalid container access. */
  public static class InvalidAccess extends ModelException {
    private final String container;
    private final String key;

    public InvalidAccess(String methodName, String container, String key, String msg) {
      super(methodName, "cannot access " + container + " with key " + key + ": " + msg);
      this.container = container;
      this.key = key;
    }

    /** Returns the description of the accessed container. */
    public String getContainer() {
      return container;
    }

    public String getKey() {
      return key;
    }
  }

  /** Exception thrown when a concrete variable name or a family is declared twice. */
  public static class DuplicateVariable extends ModelException {
    private final String variable;

    public DuplicateVariable(String methodName, String variable, String msg) {
      super(methodName, "'" + variable + "' " + msg);
      this.variable = variable;
    }

    public String getVariable() {
      return variable;
    }
  }

  /** Exception thrown when a family reference has the wrong number of indices. */
  public static class ArityMismatch extends ModelException {
    private final String family;
    private final int expected;
    private final int actual;

    public ArityMismatch(String methodName, String family, int expected, int actual) {
      super(
          methodName,
          "family '"
              + family
              + "' has "
              + expected
              + " indices, referenced with "
              + actual);
      this.family = family;
      this.expected = expected;
      this.actual = actual;
    }

    public String getFamily() {
      return family;
    }

    public int getExpected() {
      return expected;
    }

    public int getActual() {
      return actual;
    }
  }

  /** Exception thrown on an invalid variable bound. */
  public static class InvalidBound extends ModelException {
    public InvalidBound(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  /** Exception thrown when the objective direction is neither minimize nor maximize. */
  public static class InvalidDirection extends ModelException {
    public InvalidDirection(String methodName, String direction) {
      super(
          methodName,
          "objective direction must be 'minimize' or 'maximize', got '" + direction + "'");
    }
  }

  /** Exception thrown when arithmetic gets a non-numeric operand, unbounded included. */
  public static class NonNumericOperand extends ModelException {
    public NonNumericOperand(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  /** Exception thrown on division by a zero constant. */
  public static class DivisionByZero extends ModelException {
    public DivisionByZero(String methodName, Object expression) {
      super(methodName, "division by zero in " + expression);
    }
  }
}
