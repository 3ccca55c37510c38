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

package io.linmodel.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * The result of a solve: status, objective and the values of the primal and, when the solver
 * reports them, dual solutions.
 */
public final class Solution {
  private final SolveStatus status;
  private final String modelStatus;
  private final String primalFeasibility;
  private final Double objectiveValue;
  private final ImmutableMap<String, Double> variableValues;
  private final ImmutableMap<String, Double> activities;
  private final ImmutableMap<String, Double> reducedCosts;
  private final ImmutableMap<String, Double> dualValues;

  private Solution(Builder builder) {
    this.status = SolveStatus.fromHighs(builder.modelStatus);
    this.modelStatus = builder.modelStatus;
    this.primalFeasibility = builder.primalFeasibility;
    this.objectiveValue = builder.objectiveValue;
    this.variableValues = builder.variableValues;
    this.activities = builder.activities;
    this.reducedCosts = builder.reducedCosts;
    this.dualValues = builder.dualValues;
  }

  static Builder newBuilder(String modelStatus) {
    return new Builder(modelStatus);
  }

  public SolveStatus getStatus() {
    return status;
  }

  /** Returns the status line as written by the solver. */
  public String getModelStatus() {
    return modelStatus;
  }

  /** Returns the feasibility line of the primal solution, for instance {@code Feasible}. */
  public String getPrimalFeasibility() {
    return primalFeasibility;
  }

  /** Returns true if the primal solution is reported feasible. */
  public boolean isFeasible() {
    return "Feasible".equals(primalFeasibility);
  }

  public boolean hasObjectiveValue() {
    return objectiveValue != null;
  }

  /** Returns the objective value. */
  public double getObjectiveValue() {
    if (objectiveValue == null) {
      throw new IllegalStateException("the solver reported no objective value");
    }
    return objectiveValue;
  }

  /** Returns the values of the variables, by name, in the solver's order. */
  public ImmutableMap<String, Double> getVariableValues() {
    return variableValues;
  }

  /** Returns the value of the variable called {@code name}. */
  public double getValue(String name) {
    return lookup(variableValues, name, "variable");
  }

  /** Returns the activities of the constraints, by row name. */
  public ImmutableMap<String, Double> getActivities() {
    return activities;
  }

  public double getActivity(String rowName) {
    return lookup(activities, rowName, "row");
  }

  /** Returns true if the solver wrote a dual solution. */
  public boolean hasDualSolution() {
    return !dualValues.isEmpty() || !reducedCosts.isEmpty();
  }

  public ImmutableMap<String, Double> getReducedCosts() {
    return reducedCosts;
  }

  public double getReducedCost(String name) {
    return lookup(reducedCosts, name, "variable");
  }

  public ImmutableMap<String, Double> getDualValues() {
    return dualValues;
  }

  public double getDualValue(String rowName) {
    return lookup(dualValues, rowName, "row");
  }

  private static double lookup(ImmutableMap<String, Double> values, String name, String what) {
    Double value = values.get(checkNotNull(name));
    if (value == null) {
      throw new IllegalArgumentException("the solution has no " + what + " called " + name);
    }
    return value;
  }

  @Override
  public String toString() {
    return String.format(
        "Solution[%s, objective=%s, %d variables]",
        modelStatus, objectiveValue, variableValues.size());
  }

  /** Accumulates the sections of a solution file. */
  static final class Builder {
    private final String modelStatus;
    private String primalFeasibility;
    private Double objectiveValue;
    private ImmutableMap<String, Double> variableValues = ImmutableMap.of();
    private ImmutableMap<String, Double> activities = ImmutableMap.of();
    private ImmutableMap<String, Double> reducedCosts = ImmutableMap.of();
    private ImmutableMap<String, Double> dualValues = ImmutableMap.of();

    Builder(String modelStatus) {
      this.modelStatus = checkNotNull(modelStatus);
    }

    Builder setPrimalFeasibility(String primalFeasibility) {
      this.primalFeasibility = primalFeasibility;
      return this;
    }

    Builder setObjectiveValue(double objectiveValue) {
      this.objectiveValue = objectiveValue;
      return this;
    }

    Builder setVariableValues(Map<String, Double> values) {
      this.variableValues = ImmutableMap.copyOf(values);
      return this;
    }

    Builder setActivities(Map<String, Double> values) {
      this.activities = ImmutableMap.copyOf(values);
      return this;
    }

    Builder setReducedCosts(Map<String, Double> values) {
      this.reducedCosts = ImmutableMap.copyOf(values);
      return this;
    }

    Builder setDualValues(Map<String, Double> values) {
      this.dualValues = ImmutableMap.copyOf(values);
      return this;
    }

    Solution build() {
      return new Solution(this);
    }
  }
}
