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

import java.util.Objects;

/**
 * A scalar variable of the model.
 *
 * <p>A missing bound is stored as an infinity: {@code -inf} for the lower bound, {@code +inf} for
 * the upper one. A binary variable gets 0 and 1 for the sides left unset.
 */
public final class VariableDefinition {
  private final String name;
  private final VariableType type;
  private final double lowerBound;
  private final double upperBound;
  private final String description;

  private VariableDefinition(
      String name, VariableType type, double lowerBound, double upperBound, String description) {
    this.name = name;
    this.type = type;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.description = description;
  }

  /**
   * Creates a variable.
   *
   * @param lowerBound the lower bound, or null for none
   * @param upperBound the upper bound, or null for none
   * @param description free text, may be null
   * @throws ModelException.InvalidBound if a bound of an integral variable is fractional, or if the
   *     bounds are crossed
   */
  public static VariableDefinition create(
      String name, VariableType type, Double lowerBound, Double upperBound, String description) {
    checkNotNull(name);
    checkNotNull(type);
    double lb = lowerBound == null ? Double.NEGATIVE_INFINITY : lowerBound;
    double ub = upperBound == null ? Double.POSITIVE_INFINITY : upperBound;
    if (type == VariableType.BINARY) {
      if (lowerBound == null) {
        lb = 0.0;
      }
      if (upperBound == null) {
        ub = 1.0;
      }
    }
    if (Double.isNaN(lb) || Double.isNaN(ub)) {
      throw new ModelException.InvalidBound(
          "VariableDefinition.create", "bounds of '" + name + "' must be numbers");
    }
    if (type.isIntegral()) {
      if (isFractional(lb) || isFractional(ub)) {
        throw new ModelException.InvalidBound(
            "VariableDefinition.create",
            "integer variable '"
                + name
                + "' cannot have fractional bounds ["
                + lb
                + ", "
                + ub
                + "]");
      }
    }
    if (lb > ub) {
      throw new ModelException.InvalidBound(
          "VariableDefinition.create",
          "lower bound " + lb + " of '" + name + "' is greater than upper bound " + ub);
    }
    return new VariableDefinition(name, type, lb, ub, description);
  }

  /** Shortcut for a variable without bounds and description. */
  public static VariableDefinition create(String name, VariableType type) {
    return create(name, type, null, null, null);
  }

  private static boolean isFractional(double value) {
    return !Double.isInfinite(value) && value != Math.rint(value);
  }

  /** Returns the name of the variable, as written to the LP file. */
  public String getName() {
    return name;
  }

  public VariableType getType() {
    return type;
  }

  /** Returns whether the variable is integral. */
  public boolean getIntegrality() {
    return type.isIntegral();
  }

  /** Returns the lower bound of the variable, {@code -inf} when unset. */
  public double getLowerBound() {
    return lowerBound;
  }

  /** Returns the upper bound of the variable, {@code +inf} when unset. */
  public double getUpperBound() {
    return upperBound;
  }

  public boolean hasLowerBound() {
    return lowerBound != Double.NEGATIVE_INFINITY;
  }

  public boolean hasUpperBound() {
    return upperBound != Double.POSITIVE_INFINITY;
  }

  /** Returns the description, or null. */
  public String getDescription() {
    return description;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VariableDefinition)) {
      return false;
    }
    VariableDefinition other = (VariableDefinition) o;
    return other.name.equals(name)
        && other.type == type
        && Double.compare(other.lowerBound, lowerBound) == 0
        && Double.compare(other.upperBound, upperBound) == 0
        && Objects.equals(other.description, description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, lowerBound, upperBound, description);
  }

  @Override
  public String toString() {
    return String.format("%s(%s, %f, %f)", name, type, lowerBound, upperBound);
  }
}
