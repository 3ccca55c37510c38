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

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.Clause;
import io.linmodel.expr.CompareExpr;
import io.linmodel.expr.Expr;
import java.util.List;

/**
 * One step of a model definition, applied by {@link ModelBuilder#modify}.
 *
 * <p>The static methods mirror the operations of {@link ModelBuilder}.
 */
@FunctionalInterface
public interface ModelOperation {
  /** Returns the model obtained by applying this step to {@code model}. */
  Model apply(ModelBuilder builder, Model model);

  static ModelOperation declareFamily(FamilyDeclaration declaration) {
    return (builder, model) -> builder.declareFamily(model, declaration);
  }

  /** Shortcut for an unbounded family without name template. */
  static ModelOperation declareFamily(String name, List<Clause> clauses, VariableType type) {
    return (builder, model) -> builder.declareFamily(model, name, clauses, type);
  }

  /** Shortcut for a scalar variable; null bounds mean no bound. */
  static ModelOperation declareVariable(
      String name, VariableType type, Double lowerBound, Double upperBound) {
    return (builder, model) -> builder.declareVariable(model, name, type, lowerBound, upperBound);
  }

  static ModelOperation declareConstraints(
      List<Clause> clauses, CompareExpr constraint, String descriptionTemplate) {
    ImmutableList<Clause> copy = ImmutableList.copyOf(clauses);
    return (builder, model) ->
        builder.declareConstraints(model, copy, constraint, descriptionTemplate);
  }

  static ModelOperation declareConstraint(CompareExpr constraint, String description) {
    return (builder, model) -> builder.declareConstraint(model, constraint, description);
  }

  static ModelOperation setObjective(Expr objective, Direction direction) {
    return (builder, model) -> builder.setObjective(model, objective, direction);
  }

  static ModelOperation addToObjective(Expr increment) {
    return (builder, model) -> builder.addToObjective(model, increment);
  }
}
