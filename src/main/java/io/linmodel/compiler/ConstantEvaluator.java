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

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.AccessExpr;
import io.linmodel.expr.BinaryExpr;
import io.linmodel.expr.CompareExpr;
import io.linmodel.expr.ComparisonOperator;
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
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.value.MappingValue;
import io.linmodel.value.NumberValue;
import io.linmodel.value.SequenceValue;
import io.linmodel.value.TextValue;
import io.linmodel.value.Value;
import io.linmodel.value.Values;
import java.util.Map;

/**
 * Reduces expressions that do not involve model variables to a {@link Value}.
 *
 * <p>Symbols resolve against the generator bindings, then the model parameters. Container access
 * indexes sequences by position and mappings by key; a mapping key that is not found is retried by
 * its rendered text, so {@code costs[1]} finds the key {@code "1"} and the other way round. A bare
 * identifier used as a key that names no symbol is taken as a text key.
 *
 * <p>The unbounded value evaluates to itself. Any arithmetic on it is an error.
 */
public final class ConstantEvaluator {
  private ConstantEvaluator() {}

  /**
   * Evaluates {@code expr} in {@code context}.
   *
   * @throws ModelException.UndefinedSymbol if a symbol is neither bound nor a parameter
   * @throws ModelException.InvalidAccess if a container access fails
   * @throws ModelException.NonNumericOperand if arithmetic gets anything but two numbers
   * @throws ModelException.DivisionByZero on division by zero
   */
  public static Value evaluate(Expr expr, CompileContext context) {
    return expr.accept(new Evaluator(context));
  }

  /** Evaluates {@code expr} and requires a number. */
  public static NumberValue evaluateNumber(Expr expr, CompileContext context) {
    Value value = evaluate(expr, context);
    if (!value.isNumber()) {
      throw new ModelException.NonNumericOperand(
          "ConstantEvaluator.evaluateNumber",
          "expected a number for " + expr + ", got " + value.describe());
    }
    return value.asNumber();
  }

  /**
   * Evaluates a filter predicate. Comparisons are applied to their evaluated operands; any other
   * expression must evaluate to a number and holds when it is not zero.
   */
  public static boolean test(Expr predicate, CompileContext context) {
    if (predicate instanceof CompareExpr) {
      CompareExpr compare = (CompareExpr) predicate;
      Value left = evaluate(compare.getLeft(), context);
      Value right = evaluate(compare.getRight(), context);
      return compare(compare.getOperator(), left, right);
    }
    return evaluateNumber(predicate, context).doubleValue() != 0.0;
  }

  /** Applies {@code op} to two values. Only equality tests accept values of different kinds. */
  static boolean compare(ComparisonOperator op, Value left, Value right) {
    if (left.isNumber() && right.isNumber()) {
      return op.test(left.asNumber().compareTo(right.asNumber()));
    }
    if (op == ComparisonOperator.EQ) {
      return left.equals(right);
    }
    if (op == ComparisonOperator.NE) {
      return !left.equals(right);
    }
    if (left.kind() == Value.Kind.TEXT && right.kind() == Value.Kind.TEXT) {
      return op.test(left.asText().text().compareTo(right.asText().text()));
    }
    throw new ModelException.NonNumericOperand(
        "ConstantEvaluator.test",
        "cannot apply " + op.symbol() + " to " + left.describe() + " and " + right.describe());
  }

  /**
   * Looks {@code key} up in {@code container}.
   *
   * @throws ModelException.InvalidAccess if the container is not a sequence or a mapping, or if the
   *     key is not found
   */
  public static Value access(Value container, Value key) {
    switch (container.kind()) {
      case SEQUENCE:
        return accessSequence(container.asSequence(), key);
      case MAPPING:
        return accessMapping(container.asMapping(), key);
      case NUMBER:
      case TEXT:
      case UNBOUNDED:
        break;
    }
    throw new ModelException.InvalidAccess(
        "ConstantEvaluator.access",
        container.describe(),
        key.describe(),
        "only sequences and mappings can be accessed");
  }

  private static Value accessSequence(SequenceValue sequence, Value key) {
    if (!key.isNumber() || !key.asNumber().isWhole()) {
      throw new ModelException.InvalidAccess(
          "ConstantEvaluator.access",
          sequence.describe(),
          key.describe(),
          "a sequence index must be an integer");
    }
    long index = key.asNumber().longValue();
    if (index < 0 || index >= sequence.size()) {
      throw new ModelException.InvalidAccess(
          "ConstantEvaluator.access",
          sequence.describe(),
          key.describe(),
          "index out of range, the sequence has " + sequence.size() + " elements");
    }
    return sequence.elements().get((int) index);
  }

  private static Value accessMapping(MappingValue mapping, Value key) {
    Value value = mapping.get(key);
    if (value != null) {
      return value;
    }
    String rendered = key.render();
    for (Map.Entry<Value, Value> entry : mapping.entries().entrySet()) {
      if (entry.getKey().render().equals(rendered)) {
        return entry.getValue();
      }
    }
    throw new ModelException.InvalidAccess(
        "ConstantEvaluator.access",
        mapping.describe(),
        key.describe(),
        "no such key among " + mapping.size() + " keys");
  }

  private static NumberValue numericOperand(Value value, Object expr, String operator) {
    if (value.isUnbounded()) {
      throw new ModelException.NonNumericOperand(
          "ConstantEvaluator.evaluate",
          "unbounded cannot be an operand of '" + operator + "' in " + expr);
    }
    if (!value.isNumber()) {
      throw new ModelException.NonNumericOperand(
          "ConstantEvaluator.evaluate",
          "operand "
              + value.describe()
              + " of '"
              + operator
              + "' in "
              + expr
              + " is not a number");
    }
    return value.asNumber();
  }

  private static final class Evaluator implements ExprVisitor<Value> {
    private final CompileContext context;

    Evaluator(CompileContext context) {
      this.context = context;
    }

    @Override
    public Value visitConstant(ConstantExpr expr) {
      return expr.getValue();
    }

    @Override
    public Value visitRef(RefExpr expr) {
      return context.resolve("ConstantEvaluator.evaluate", expr.getName());
    }

    @Override
    public Value visitIndex(IndexExpr expr) {
      throw new ModelException.NonNumericOperand(
          "ConstantEvaluator.evaluate",
          "variable " + expr + " cannot be used where a constant is expected");
    }

    @Override
    public Value visitWildcardIndex(WildcardIndexExpr expr) {
      throw new ModelException.NonNumericOperand(
          "ConstantEvaluator.evaluate",
          "variable selection " + expr + " cannot be used where a constant is expected");
    }

    @Override
    public Value visitWildcard(WildcardExpr expr) {
      throw new ModelException.NotEnumerable(
          "ConstantEvaluator.evaluate",
          "the wildcard _ has no value here; use it as a variable index or as a container key"
              + " inside sum(...)");
    }

    @Override
    public Value visitBinary(BinaryExpr expr) {
      String symbol = expr.getOperator().symbol();
      NumberValue left = numericOperand(expr.getLeft().accept(this), expr, symbol);
      NumberValue right = numericOperand(expr.getRight().accept(this), expr, symbol);
      switch (expr.getOperator()) {
        case ADD:
          return left.add(right);
        case SUBTRACT:
          return left.subtract(right);
        case MULTIPLY:
          return left.multiply(right);
        case DIVIDE:
          if (right.doubleValue() == 0.0) {
            throw new ModelException.DivisionByZero("ConstantEvaluator.evaluate", expr);
          }
          return left.divide(right);
      }
      throw new AssertionError(expr.getOperator());
    }

    @Override
    public Value visitNegate(NegateExpr expr) {
      return numericOperand(expr.getExpr().accept(this), expr, "-").negate();
    }

    @Override
    public Value visitSum(SumExpr expr) {
      NumberValue total = NumberValue.of(0);
      for (Bindings bindings : Generators.expand(expr.getClauses(), context)) {
        Value term = evaluate(expr.getBody(), context.withBindings(bindings));
        total = total.add(numericOperand(term, expr, "sum"));
      }
      return total;
    }

    @Override
    public Value visitAccess(AccessExpr expr) {
      Value container = expr.getContainer().accept(this);
      return access(container, evaluateKey(expr.getKey()));
    }

    private Value evaluateKey(Expr key) {
      if (key instanceof RefExpr) {
        String name = ((RefExpr) key).getName();
        Value value = context.lookup(name);
        return value != null ? value : new TextValue(name);
      }
      return key.accept(this);
    }

    @Override
    public Value visitCompare(CompareExpr expr) {
      return Values.number(test(expr, context) ? 1 : 0);
    }

    @Override
    public Value visitRange(RangeExpr expr) {
      NumberValue from = bound(expr.getFrom().accept(this), expr);
      NumberValue to = bound(expr.getTo().accept(this), expr);
      return SequenceValue.range(from.longValue(), to.longValue());
    }

    private NumberValue bound(Value value, RangeExpr expr) {
      NumberValue number = numericOperand(value, expr, "..");
      if (!number.isWhole()) {
        throw new ModelException.NonNumericOperand(
            "ConstantEvaluator.evaluate",
            "range bounds must be integers, got " + number.describe() + " in " + expr);
      }
      return number;
    }

    @Override
    public Value visitList(ListExpr expr) {
      ImmutableList.Builder<Value> elements = ImmutableList.builder();
      for (Expr element : expr.getElements()) {
        elements.add(element.accept(this));
      }
      return new SequenceValue(elements.build());
    }
  }
}
