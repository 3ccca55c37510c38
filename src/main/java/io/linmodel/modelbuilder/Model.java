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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable optimization model: variables, variable families, constraints and objective.
 *
 * <p>Models are persistent values. Every operation of {@link ModelBuilder} returns a new model and
 * leaves its input untouched, so a model can be extended any number of times.
 */
public final class Model {
  private static final Model EMPTY =
      new Model(
          null,
          null,
          ImmutableMap.of(),
          ImmutableMap.of(),
          ImmutableMap.of(),
          Polynomial.zero(),
          Direction.MINIMIZE,
          0,
          0);

  private final String name;
  private final String description;
  private final ImmutableMap<String, VariableDefinition> variables;
  private final ImmutableMap<String, VariableFamily> families;
  private final ImmutableMap<String, Constraint> constraints;
  private final Polynomial objective;
  private final Direction direction;
  private final int variableCounter;
  private final int constraintCounter;

  private Model(
      String name,
      String description,
      ImmutableMap<String, VariableDefinition> variables,
      ImmutableMap<String, VariableFamily> families,
      ImmutableMap<String, Constraint> constraints,
      Polynomial objective,
      Direction direction,
      int variableCounter,
      int constraintCounter) {
    this.name = name;
    this.description = description;
    this.variables = variables;
    this.families = families;
    this.constraints = constraints;
    this.objective = objective;
    this.direction = direction;
    this.variableCounter = variableCounter;
    this.constraintCounter = constraintCounter;
  }

  /** Returns the empty model: no variable, no constraint, minimize 0. */
  public static Model empty() {
    return EMPTY;
  }

  /** Returns an empty model with a name and an optional description. */
  public static Model named(String name, String description) {
    return EMPTY.withName(name, description);
  }

  /** Returns the identifier given to the constraint created with the given counter value. */
  static String constraintId(int counter) {
    return String.format("c%08d", counter);
  }

  // Getters.

  /** Returns the name of the model, or null. */
  public String getName() {
    return name;
  }

  /** Returns the description of the model, or null. */
  public String getDescription() {
    return description;
  }

  /** Returns the scalar variables by name, in declaration order. */
  public ImmutableMap<String, VariableDefinition> getVariables() {
    return variables;
  }

  /** Returns the variable families by name, in declaration order. */
  public ImmutableMap<String, VariableFamily> getFamilies() {
    return families;
  }

  /** Returns the constraints by generated id, in creation order. */
  public ImmutableMap<String, Constraint> getConstraints() {
    return constraints;
  }

  public Polynomial getObjective() {
    return objective;
  }

  public Direction getDirection() {
    return direction;
  }

  /** Returns the variable called {@code name}, or null. */
  public VariableDefinition getVariable(String name) {
    return variables.get(name);
  }

  /** Returns the family called {@code name}, or null. */
  public VariableFamily getFamily(String name) {
    return families.get(name);
  }

  /** Returns the constraint with the given id, or null. */
  public Constraint getConstraint(String id) {
    return constraints.get(id);
  }

  /** Returns the number of variables in the model. */
  public int numVariables() {
    return variables.size();
  }

  /** Returns the number of constraints in the model. */
  public int numConstraints() {
    return constraints.size();
  }

  /** Returns the number of variables ever created in this model's history. */
  public int getVariableCounter() {
    return variableCounter;
  }

  /** Returns the counter used to generate the next constraint id. */
  public int getConstraintCounter() {
    return constraintCounter;
  }

  // Persistent updates, used by ModelBuilder.

  /** Returns a copy with another name and description. */
  public Model withName(String name, String description) {
    return new Model(
        name,
        description,
        variables,
        families,
        constraints,
        objective,
        direction,
        variableCounter,
        constraintCounter);
  }

  Model withVariables(VariableFamily family, Map<String, VariableDefinition> added) {
    checkNotNull(family);
    ImmutableMap.Builder<String, VariableFamily> newFamilies = ImmutableMap.builder();
    boolean replaced = false;
    for (Map.Entry<String, VariableFamily> entry : families.entrySet()) {
      if (entry.getKey().equals(family.getName())) {
        newFamilies.put(family.getName(), family);
        replaced = true;
      } else {
        newFamilies.put(entry);
      }
    }
    if (!replaced) {
      newFamilies.put(family.getName(), family);
    }
    return new Model(
        name,
        description,
        ImmutableMap.<String, VariableDefinition>builder()
            .putAll(variables)
            .putAll(added)
            .buildOrThrow(),
        newFamilies.buildOrThrow(),
        constraints,
        objective,
        direction,
        variableCounter + added.size(),
        constraintCounter);
  }

  Model withConstraints(List<Constraint> added) {
    ImmutableMap.Builder<String, Constraint> newConstraints = ImmutableMap.builder();
    newConstraints.putAll(constraints);
    int counter = constraintCounter;
    for (Constraint constraint : added) {
      newConstraints.put(constraintId(counter), constraint);
      counter++;
    }
    return new Model(
        name,
        description,
        variables,
        families,
        newConstraints.buildOrThrow(),
        objective,
        direction,
        variableCounter,
        counter);
  }

  Model withObjective(Polynomial objective, Direction direction) {
    return new Model(
        name,
        description,
        variables,
        families,
        constraints,
        checkNotNull(objective),
        checkNotNull(direction),
        variableCounter,
        constraintCounter);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Model)) {
      return false;
    }
    Model other = (Model) o;
    return Objects.equals(other.name, name)
        && Objects.equals(other.description, description)
        && other.variables.equals(variables)
        && other.families.equals(families)
        && other.constraints.equals(constraints)
        && other.objective.equals(objective)
        && other.direction == direction
        && other.variableCounter == variableCounter
        && other.constraintCounter == constraintCounter;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, variables, families, constraints, objective, direction);
  }

  @Override
  public String toString() {
    return String.format(
        "Model[%s, %d variables, %d constraints, %s %s]",
        name == null ? "unnamed" : name,
        variables.size(),
        constraints.size(),
        direction,
        objective);
  }
}
