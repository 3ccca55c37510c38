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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.linmodel.expr.Clause;
import io.linmodel.expr.Expr;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.value.Value;
import io.linmodel.value.Values;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class ConstantEvaluatorTest {
  private static CompileContext context() {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("costs", ImmutableList.of(10, 20, 30));
    data.put("supply", ImmutableMap.of("north", 3, "south", 4));
    data.put("byNumber", ImmutableMap.of(1, 5, 2, 6));
    data.put("byText", ImmutableMap.of("1", 7));
    data.put("matrix", ImmutableList.of(ImmutableList.of(1, 2), ImmutableList.of(3, 4)));
    data.put("n", 4);
    data.put("big", Values.unbounded());
    return CompileContext.of(Values.parameters(data));
  }

  private static Value evaluate(Expr expr) {
    return ConstantEvaluator.evaluate(expr, context());
  }

  @Test
  public void testConstantEvaluator_arithmetic() {
    final Value value =
        evaluate(
            Expr.add(Expr.constant(2), Expr.multiply(Expr.constant(3), Expr.ref("n"))));

    assertThat(value).isEqualTo(Values.number(14));
    assertThat(value.asNumber().isIntegral()).isTrue();
    assertThat(evaluate(Expr.divide(Expr.constant(1), Expr.constant(4))))
        .isEqualTo(Values.number(0.25));
    assertThat(evaluate(Expr.negate(Expr.ref("n")))).isEqualTo(Values.number(-4));
    assertThat(evaluate(Expr.subtract(Expr.constant(1.5), Expr.constant(1))))
        .isEqualTo(Values.number(0.5));
  }

  @Test
  public void testConstantEvaluator_divisionByZero() {
    assertThrows(
        ModelException.DivisionByZero.class,
        () -> evaluate(Expr.divide(Expr.ref("n"), Expr.subtract(Expr.ref("n"), Expr.ref("n")))));
  }

  @Test
  public void testConstantEvaluator_unboundedEvaluatesToItself() {
    assertThat(evaluate(Expr.unbounded()).isUnbounded()).isTrue();
    assertThat(evaluate(Expr.ref("big")).isUnbounded()).isTrue();
  }

  @Test
  public void testConstantEvaluator_noArithmeticOnUnbounded() {
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> evaluate(Expr.add(Expr.unbounded(), Expr.constant(1))));
    assertThrows(
        ModelException.NonNumericOperand.class, () -> evaluate(Expr.negate(Expr.ref("big"))));
  }

  @Test
  public void testConstantEvaluator_nonNumericOperand() {
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> evaluate(Expr.add(Expr.text("a"), Expr.constant(1))));
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> ConstantEvaluator.evaluateNumber(Expr.text("a"), context()));
  }

  @Test
  public void testConstantEvaluator_sequenceAccess() {
    assertThat(evaluate(Expr.access(Expr.ref("costs"), Expr.constant(1))))
        .isEqualTo(Values.number(20));
    assertThat(evaluate(Expr.access(Expr.ref("costs"), Expr.constant(2.0))))
        .isEqualTo(Values.number(30));
  }

  @Test
  public void testConstantEvaluator_sequenceAccessOutOfRange() {
    final ModelException.InvalidAccess e =
        assertThrows(
            ModelException.InvalidAccess.class,
            () -> evaluate(Expr.access(Expr.ref("costs"), Expr.constant(3))));

    assertThat(e.getKey()).isEqualTo("3");
    assertThat(e.getContainer()).isEqualTo("[10, 20, 30]");
    assertThat(e).hasMessageThat().contains("3 elements");
    assertThrows(
        ModelException.InvalidAccess.class,
        () -> evaluate(Expr.access(Expr.ref("costs"), Expr.constant(-1))));
    assertThrows(
        ModelException.InvalidAccess.class,
        () -> evaluate(Expr.access(Expr.ref("costs"), Expr.constant(0.5))));
  }

  @Test
  public void testConstantEvaluator_mappingAccess() {
    assertThat(evaluate(Expr.access(Expr.ref("supply"), Expr.text("north"))))
        .isEqualTo(Values.number(3));
    // An unbound identifier is a text key.
    assertThat(evaluate(Expr.access(Expr.ref("supply"), Expr.ref("south"))))
        .isEqualTo(Values.number(4));
  }

  @Test
  public void testConstantEvaluator_mappingAccessThroughBinding() {
    final CompileContext context = context().bind("p", Values.text("south"));

    assertThat(
            ConstantEvaluator.evaluate(Expr.access(Expr.ref("supply"), Expr.ref("p")), context))
        .isEqualTo(Values.number(4));
  }

  @Test
  public void testConstantEvaluator_mappingAccessFallsBackToRenderedKey() {
    assertThat(evaluate(Expr.access(Expr.ref("byNumber"), Expr.text("2"))))
        .isEqualTo(Values.number(6));
    assertThat(evaluate(Expr.access(Expr.ref("byText"), Expr.constant(1))))
        .isEqualTo(Values.number(7));
  }

  @Test
  public void testConstantEvaluator_mappingAccessMissingKey() {
    final ModelException.InvalidAccess e =
        assertThrows(
            ModelException.InvalidAccess.class,
            () -> evaluate(Expr.access(Expr.ref("supply"), Expr.text("east"))));

    assertThat(e.getKey()).isEqualTo("\"east\"");
    assertThat(e).hasMessageThat().contains("north");
  }

  @Test
  public void testConstantEvaluator_chainedAccess() {
    assertThat(evaluate(Expr.access(Expr.ref("matrix"), Expr.constant(1), Expr.constant(0))))
        .isEqualTo(Values.number(3));
  }

  @Test
  public void testConstantEvaluator_accessOnScalar() {
    assertThrows(
        ModelException.InvalidAccess.class,
        () -> evaluate(Expr.access(Expr.ref("n"), Expr.constant(0))));
  }

  @Test
  public void testConstantEvaluator_undefinedSymbol() {
    assertThrows(ModelException.UndefinedSymbol.class, () -> evaluate(Expr.ref("missing")));
  }

  @Test
  public void testConstantEvaluator_sum() {
    final Expr sum =
        Expr.sum(
            ImmutableList.of(Clause.generator("i", Expr.range(Expr.constant(1), Expr.ref("n")))),
            Expr.access(Expr.ref("byNumber"), Expr.constant(1)));

    assertThat(evaluate(sum)).isEqualTo(Values.number(20));
    assertThat(
            evaluate(
                Expr.sum(ImmutableList.of(Clause.generator("i", 1, 4)), Expr.ref("i"))))
        .isEqualTo(Values.number(10));
  }

  @Test
  public void testConstantEvaluator_comparisonIsZeroOrOne() {
    assertThat(evaluate(Expr.lt(Expr.constant(1), Expr.constant(2))))
        .isEqualTo(Values.number(1));
    assertThat(evaluate(Expr.eq(Expr.text("a"), Expr.constant(1))))
        .isEqualTo(Values.number(0));
  }

  @Test
  public void testConstantEvaluator_test() {
    final CompileContext context = context();

    assertThat(ConstantEvaluator.test(Expr.lt(Expr.text("a"), Expr.text("b")), context)).isTrue();
    assertThat(ConstantEvaluator.test(Expr.ne(Expr.text("a"), Expr.constant(1)), context))
        .isTrue();
    assertThat(ConstantEvaluator.test(Expr.constant(0), context)).isFalse();
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> ConstantEvaluator.test(Expr.lt(Expr.text("a"), Expr.constant(1)), context));
  }

  @Test
  public void testConstantEvaluator_rangeAndList() {
    assertThat(evaluate(Expr.range(Expr.constant(1), Expr.ref("n"))))
        .isEqualTo(Values.range(1, 4));
    assertThat(evaluate(Expr.list(Expr.constant(1), Expr.text("a"))))
        .isEqualTo(Values.sequence(Values.number(1), Values.text("a")));
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> evaluate(Expr.range(Expr.constant(1), Expr.constant(2.5))));
  }

  @Test
  public void testConstantEvaluator_variablesAndWildcardsAreNotConstants() {
    assertThrows(
        ModelException.NonNumericOperand.class,
        () -> evaluate(Expr.index("x", Expr.constant(1))));
    assertThrows(ModelException.NotEnumerable.class, () -> evaluate(Expr.wildcard()));
  }

  @Test
  public void testConstantEvaluator_rangeEndingAtLongMaxValue() {
    final Value range = evaluate(Expr.range(Long.MAX_VALUE - 1, Long.MAX_VALUE));

    assertThat(range.asSequence().size()).isEqualTo(2);
  }
}
