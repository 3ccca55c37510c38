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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.linmodel.compiler.Bindings;
import io.linmodel.compiler.CompileContext;
import io.linmodel.compiler.ConstantEvaluator;
import io.linmodel.compiler.ExpressionCompiler;
import io.linmodel.compiler.Generators;
import io.linmodel.compiler.NameSanitizer;
import io.linmodel.compiler.Templates;
import io.linmodel.expr.Clause;
import io.linmodel.expr.CompareExpr;
import io.linmodel.expr.Expr;
import io.linmodel.value.Value;
import io.linmodel.value.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Main modeling class.
 *
 * <p>A builder compiles declarations against one set of model parameters. It holds no model: each
 * operation takes a {@link Model} and returns a new one, and a failing operation throws a {@link
 * ModelException} without touching its input.
 *
 * <pre>{@code
 * ModelBuilder builder = new ModelBuilder();
 * Model model = builder.define("assignment", ImmutableList.of(
 *     ModelOperation.declareFamily(
 *         "q",
 *         ImmutableList.of(Clause.generator("i", 1, 2), Clause.generator("j", 1, 2)),
 *         VariableType.BINARY),
 *     ModelOperation.declareConstraints(
 *         ImmutableList.of(Clause.generator("i", 1, 2)),
 *         Expr.eq(Expr.index("q", Expr.ref("i"), Expr.wildcard()), Expr.constant(1)),
 *         "row {i}")));
 * }</pre>
 */
public final class ModelBuilder {
  private static final Logger logger = Logger.getLogger(ModelBuilder.class.getName());

  private final ImmutableMap<String, Value> parameters;

  /** Creates a builder without model parameters. */
  public ModelBuilder() {
    this(ImmutableMap.of());
  }

  /** Creates a builder resolving symbols against {@code parameters}. */
  public ModelBuilder(ImmutableMap<String, Value> parameters) {
    this.parameters = checkNotNull(parameters);
  }

  /** Creates a builder from plain Java data, converted with {@link Values#of(Object)}. */
  public static ModelBuilder withParameters(Map<String, ?> parameters) {
    return new ModelBuilder(Values.parameters(parameters));
  }

  public ImmutableMap<String, Value> getParameters() {
    return parameters;
  }

  private CompileContext context() {
    return CompileContext.of(parameters);
  }

  // Variables.

  /**
   * Declares a variable family: one variable per binding of the clauses, keyed by the values of
   * the generator symbols in declaration order.
   *
   * <p>Redeclaring an existing family with the same number of generators adds members to it.
   *
   * @throws ModelException.DuplicateVariable if a concrete name or an index is already declared,
   *     or if an existing family of the same name has another arity
   * @throws ModelException.InvalidBound if a bound is not a number or is invalid for the type
   */
  public Model declareFamily(Model model, FamilyDeclaration declaration) {
    String name = declaration.getName();
    ImmutableList<String> symbols = Generators.symbols(declaration.getClauses());
    VariableFamily family = model.getFamily(name);
    if (family == null) {
      family = VariableFamily.create(name, symbols.size());
    } else if (family.getArity() != symbols.size()) {
      throw new ModelException.DuplicateVariable(
          "ModelBuilder.declareFamily",
          name,
          "is already declared with "
              + family.getArity()
              + " indices, cannot redeclare it with "
              + symbols.size());
    }

    Map<ImmutableList<Value>, Polynomial> members = new LinkedHashMap<>();
    Map<String, VariableDefinition> definitions = new LinkedHashMap<>();
    for (Bindings bindings : Generators.expand(declaration.getClauses(), context())) {
      CompileContext context = CompileContext.of(bindings, parameters);
      ImmutableList<Value> key = bindings.valuesOf(symbols);
      String rendered =
          declaration.getNameTemplate() == null
              ? Templates.defaultName(name, key)
              : Templates.interpolate(declaration.getNameTemplate(), context);
      String concreteName = NameSanitizer.sanitize(rendered);
      if (family.containsKey(key) || members.containsKey(key)) {
        throw new ModelException.DuplicateVariable(
            "ModelBuilder.declareFamily",
            concreteName,
            "has an index already declared in " + name);
      }
      if (model.getVariable(concreteName) != null || definitions.containsKey(concreteName)) {
        throw new ModelException.DuplicateVariable(
            "ModelBuilder.declareFamily", concreteName, "is already declared");
      }
      String description =
          declaration.getDescription() == null
              ? null
              : Templates.interpolate(declaration.getDescription(), context);
      VariableDefinition definition =
          VariableDefinition.create(
              concreteName,
              declaration.getType(),
              bound(declaration.getLowerBound(), context),
              bound(declaration.getUpperBound(), context),
              description);
      definitions.put(concreteName, definition);
      members.put(key, Polynomial.variable(concreteName));
    }
    logger.fine(
        String.format(
            "Declared %d %s variables in family %s",
            definitions.size(), declaration.getType(), name));
    return model.withVariables(family.withMembers(members), definitions);
  }

  /** Shortcut for a family without bounds, name template and description. */
  public Model declareFamily(Model model, String name, List<Clause> clauses, VariableType type) {
    return declareFamily(
        model, FamilyDeclaration.newBuilder(name).addClauses(clauses).setType(type).build());
  }

  /** Declares a scalar variable. Null bounds mean no bound. */
  public Model declareVariable(
      Model model, String name, VariableType type, Double lowerBound, Double upperBound) {
    FamilyDeclaration.Builder declaration = FamilyDeclaration.newBuilder(name).setType(type);
    if (lowerBound != null) {
      declaration.setLowerBound(lowerBound);
    }
    if (upperBound != null) {
      declaration.setUpperBound(upperBound);
    }
    return declareFamily(model, declaration.build());
  }

  private static Double bound(Expr expr, CompileContext context) {
    if (expr == null) {
      return null;
    }
    Value value = ConstantEvaluator.evaluate(expr, context);
    if (value.isUnbounded()) {
      return null;
    }
    if (!value.isNumber()) {
      throw new ModelException.InvalidBound(
          "ModelBuilder.declareFamily",
          "bound " + expr + " must be a number or unbounded, got " + value.describe());
    }
    double bound = value.asNumber().doubleValue();
    return Double.isInfinite(bound) ? null : bound;
  }

  // Constraints.

  /**
   * Declares one constraint per binding of the clauses. The description template is interpolated
   * with the binding; its sanitized form names the constraint.
   *
   * @throws ModelException.UnsupportedOperator if the comparison is not {@code ==, <=} or {@code
   *     >=}
   */
  public Model declareConstraints(
      Model model, List<Clause> clauses, CompareExpr constraint, String descriptionTemplate) {
    ExpressionCompiler compiler = new ExpressionCompiler(model, context());
    List<Constraint> constraints = new ArrayList<>();
    for (Bindings bindings : Generators.expand(clauses, context())) {
      Constraint compiled = compiler.withBindings(bindings).compileConstraint(constraint);
      if (descriptionTemplate != null) {
        String description =
            Templates.interpolate(descriptionTemplate, CompileContext.of(bindings, parameters));
        compiled =
            compiled.withName(NameSanitizer.sanitize(description)).withDescription(description);
      }
      constraints.add(compiled);
    }
    logger.fine(String.format("Declared %d constraints for %s", constraints.size(), constraint));
    return model.withConstraints(constraints);
  }

  /** Declares a single constraint. */
  public Model declareConstraint(Model model, CompareExpr constraint, String description) {
    return declareConstraints(model, ImmutableList.of(), constraint, description);
  }

  // Objective.

  /** Replaces the objective and its direction. */
  public Model setObjective(Model model, Expr objective, Direction direction) {
    checkNotNull(direction);
    Polynomial compiled = new ExpressionCompiler(model, context()).compile(objective);
    logger.fine(String.format("Objective set to %s %s", direction, compiled));
    return model.withObjective(compiled, direction);
  }

  /**
   * Replaces the objective, with the direction given as {@code "minimize"} or {@code "maximize"}.
   *
   * @throws ModelException.InvalidDirection for any other direction
   */
  public Model setObjective(Model model, Expr objective, String direction) {
    return setObjective(model, objective, Direction.parse(direction));
  }

  /** Adds {@code increment} to the objective, keeping its direction. */
  public Model addToObjective(Model model, Expr increment) {
    Polynomial compiled = new ExpressionCompiler(model, context()).compile(increment);
    return model.withObjective(model.getObjective().add(compiled), model.getDirection());
  }

  // Composition.

  /** Applies {@code operations} in order, starting from {@code model}. */
  public Model modify(Model model, List<ModelOperation> operations) {
    Model result = checkNotNull(model);
    for (ModelOperation operation : operations) {
      result = operation.apply(this, result);
    }
    return result;
  }

  /** Applies {@code operations} in order to a new empty model called {@code name}. */
  public Model define(String name, List<ModelOperation> operations) {
    return modify(Model.named(name, null), operations);
  }
}
