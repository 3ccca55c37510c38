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

package io.linmodel.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.AccessExpr;
import io.linmodel.expr.BinaryExpr;
import io.linmodel.expr.CompareExpr;
import io.linmodel.expr.ConstantExpr;
import io.linmodel.expr.Expr;
import io.linmodel.expr.ExprVisitor;
import io.linmodel.expr.IndexExpr;
import io.linmodel.expr.ListExpr;
import io.linmodel.expr.NegateExpr;
import io.linmodel.expr.RangeExpr;
import io.linmodel.expr.RefExpr;
import io.linmodel.expr.SumExpr;
import io.linmodel.expr.WildcardExpr;
import io.linmodel.expr.WildcardIndexExpr;
import io.linmodel.modelbuilder.Constraint;
import io.linmodel.modelbuilder.Model;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.modelbuilder.Polynomial;
import io.linmodel.modelbuilder.VariableFamily;
import io.linmodel.value.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles expressions into polynomials over the variables of a model.
 *
 * <p>A compiler is bound to one model and one context. Sums compile their body with a new
 * compiler per generated binding.
 */
public final class ExpressionCompiler {
  private final Model model;
  private final CompileContext context;

  public ExpressionCompiler(Model model, CompileContext context) {
    this.model = checkNotNull(model);
    this.context = checkNotNull(context);
  }

  /** Shortcut for {@code new ExpressionCompiler(model, context).compile(expr)}. */
  public static Polynomial compile(Expr expr, CompileContext context, Model model) {
    return new ExpressionCompiler(model, context).compile(expr);
  }

  public Model getModel() {
    return model;
  }

  public CompileContext getContext() {
    return context;
  }

  /** Returns a compiler for the same model with other bindings. */
  public ExpressionCompiler withBindings(Bindings bindings) {
    return new ExpressionCompiler(model, context.withBindings(bindings));
  }

  /**
   * Compiles {@code expr}.
   *
   * @throws ModelException if the expression references an unknown name, is not linear, or does
   *     not evaluate
   */
  public Polynomial compile(Expr expr) {
    return expr.accept(new Translator());
  }

  /**
   * Compiles a top level comparison into a constraint.
   *
   * <p>The right side may be the unbounded value, possibly through a parameter; the constraint is
   * then kept with an unbounded right side.
   *
   * @throws ModelException.UnsupportedOperator if the operator is not {@code ==, <=} or {@code >=}
   */
  public Constraint compileConstraint(CompareExpr compare) {
    if (!compare.getOperator().isConstraintOperator()) {
      throw new ModelException.UnsupportedOperator(
          "ExpressionCompiler.compileConstraint",
          compare.getOperator().symbol(),
          "constraints only accept ==, <= and >=, got " + compare);
    }
    Polynomial left = compile(compare.getLeft());
    if (isUnbounded(compare.getRight())) {
      return Constraint.createUnbounded(left, compare.getOperator());
    }
    Polynomial right = compile(compare.getRight());
    return Constraint.create(left, compare.getOperator(), right);
  }

  /** Returns true if {@code expr} is a constant that evaluates to the unbounded value. */
  private boolean isUnbounded(Expr expr) {
    if (expr instanceof ConstantExpr) {
      return ((ConstantExpr) expr).getValue().isUnbounded();
    }
    if (expr instanceof RefExpr) {
      String name = ((RefExpr) expr).getName();
      if (model.getVariable(name) != null || model.getFamily(name) != null) {
        return false;
      }
      Value value = context.lookup(name);
      return value != null && value.isUnbounded();
    }
    if (expr instanceof AccessExpr && !expr.containsWildcard()) {
      return ConstantEvaluator.evaluate(expr, context).isUnbounded();
    }
    return false;
  }

  private Polynomial sumWildcards(Expr body) {
    ImmutableList<Expr> instances = WildcardExpansion.expand(body, context, model);
    Polynomial.Builder sum = Polynomial.builder();
    for (Expr instance : instances) {
      sum.add(compile(instance));
    }
    return sum.build();
  }

  private VariableFamily family(String methodName, String name, int arity) {
    VariableFamily family = model.getFamily(name);
    if (family == null) {
      throw new ModelException.UndefinedVariable(methodName, name, model.getFamilies().keySet());
    }
    if (family.getArity() != arity) {
      throw new ModelException.ArityMismatch(methodName, name, family.getArity(), arity);
    }
    return family;
  }

  /** Evaluates the indices of a family reference; wildcard positions are null. */
  private List<Value> pattern(List<Expr> indices) {
    List<Value> pattern = new ArrayList<>(indices.size());
    for (Expr index : indices) {
      pattern.add(
          index instanceof WildcardExpr ? null : ConstantEvaluator.evaluate(index, context));
    }
    return pattern;
  }

  private static Polynomial constant(Value value, Expr expr) {
    switch (value.kind()) {
      case NUMBER:
        double number = value.asNumber().doubleValue();
        if (Double.isNaN(number)) {
          throw new ModelException.NonNumericOperand(
              "ExpressionCompiler.compile", expr + " is NaN, not a number");
        }
        return Polynomial.constant(number);
      case UNBOUNDED:
        throw new ModelException.NonNumericOperand(
            "ExpressionCompiler.compile",
            "unbounded can only be the right side of <= or >=, found in " + expr);
      case TEXT:
      case SEQUENCE:
      case MAPPING:
        break;
    }
    throw new ModelException.NonNumericOperand(
        "ExpressionCompiler.compile", expr + " is " + value.describe() + ", not a number");
  }

  private final class Translator implements ExprVisitor<Polynomial> {
    @Override
    public Polynomial visitConstant(ConstantExpr expr) {
      return constant(expr.getValue(), expr);
    }

    @Override
    public Polynomial visitRef(RefExpr expr) {
      String name = expr.getName();
      if (model.getVariable(name) != null) {
        return Polynomial.variable(name);
      }
      VariableFamily family = model.getFamily(name);
      if (family != null) {
        return family.sumAll();
      }
      Value value = context.lookup(name);
      if (value == null) {
        throw new ModelException.UndefinedVariable(
            "ExpressionCompiler.compile", name, model.getFamilies().keySet());
      }
      return constant(value, expr);
    }

    @Override
    public Polynomial visitIndex(IndexExpr expr) {
      VariableFamily family =
          family("ExpressionCompiler.compile", expr.getName(), expr.getIndices().size());
      List<Value> pattern = pattern(expr.getIndices());
      if (expr.hasWildcardIndex()) {
        return family.sumMatching(pattern);
      }
      Polynomial member = family.get(pattern);
      if (member == null) {
        throw new ModelException.UndefinedVariable(
            "ExpressionCompiler.compile",
            expr.getName() + pattern,
            "family '" + expr.getName() + "' has no member with this index");
      }
      return member;
    }

    @Override
    public Polynomial visitWildcardIndex(WildcardIndexExpr expr) {
      VariableFamily family =
          family("ExpressionCompiler.compile", expr.getName(), expr.getPattern().size());
      return family.sumMatching(pattern(expr.getPattern()));
    }

    @Override
    public Polynomial visitWildcard(WildcardExpr expr) {
      throw new ModelException.NotEnumerable(
          "ExpressionCompiler.compile",
          "the wildcard _ can only be a variable index or a container key inside sum(...)");
    }

    @Override
    public Polynomial visitBinary(BinaryExpr expr) {
      Polynomial left = expr.getLeft().accept(this);
      Polynomial right = expr.getRight().accept(this);
      switch (expr.getOperator()) {
        case ADD:
          return left.add(right);
        case SUBTRACT:
          return left.subtract(right);
        case MULTIPLY:
          if (left.isConstant()) {
            return right.scale(left.constantValue());
          }
          if (right.isConstant()) {
            return left.scale(right.constantValue());
          }
          throw new ModelException.NonlinearExpression(
              "ExpressionCompiler.compile", "*", expr.getLeft(), expr.getRight());
        case DIVIDE:
          if (!right.isConstant()) {
            throw new ModelException.NonlinearExpression(
                "ExpressionCompiler.compile", "/", expr.getLeft(), expr.getRight());
          }
          if (right.constantValue() == 0.0) {
            throw new ModelException.DivisionByZero("ExpressionCompiler.compile", expr);
          }
          return left.scale(1.0 / right.constantValue());
      }
      throw new AssertionError(expr.getOperator());
    }

    @Override
    public Polynomial visitNegate(NegateExpr expr) {
      return expr.getExpr().accept(this).negate();
    }

    @Override
    public Polynomial visitSum(SumExpr expr) {
      Expr body = expr.getBody();
      boolean expandWildcards = WildcardExpansion.hasContainerWildcard(body);
      if (expr.getClauses().isEmpty()) {
        return expandWildcards ? sumWildcards(body) : body.accept(this);
      }
      Polynomial.Builder sum = Polynomial.builder();
      for (Bindings bindings : Generators.expand(expr.getClauses(), context)) {
        ExpressionCompiler inner = withBindings(bindings);
        sum.add(expandWildcards ? inner.sumWildcards(body) : inner.compile(body));
      }
      return sum.build();
    }

    @Override
    public Polynomial visitAccess(AccessExpr expr) {
      if (expr.containsWildcard()) {
        throw new ModelException.NotEnumerable(
            "ExpressionCompiler.compile",
            "container access " + expr + " with a wildcard key must appear inside sum(...)");
      }
      return constant(ConstantEvaluator.evaluate(expr, context), expr);
    }

    @Override
    public Polynomial visitCompare(CompareExpr expr) {
      throw new ModelException.UnsupportedOperator(
          "ExpressionCompiler.compile",
          expr.getOperator().symbol(),
          "a comparison can only be the top of a constraint, found " + expr);
    }

    @Override
    public Polynomial visitRange(RangeExpr expr) {
      throw new ModelException.NonNumericOperand(
          "ExpressionCompiler.compile", "range " + expr + " is not a number");
    }

    @Override
    public Polynomial visitList(ListExpr expr) {
      throw new ModelException.NonNumericOperand(
          "ExpressionCompiler.compile", "list " + expr + " is not a number");
    }
  }
}
