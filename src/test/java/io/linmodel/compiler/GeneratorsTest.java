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
import org.junit.jupiter.api.Test;

public final class GeneratorsTest {
  private static ImmutableList<Bindings> expand(CompileContext context, Clause... clauses) {
    return ImmutableList.copyOf(Generators.expand(ImmutableList.copyOf(clauses), context));
  }

  private static ImmutableList<Bindings> expand(Clause... clauses) {
    return expand(CompileContext.empty(), clauses);
  }

  @Test
  public void testGenerators_independentClausesYieldCartesianProduct() {
    final ImmutableList<Bindings> bindings =
        expand(
            Clause.generator("i", 1, 3),
            Clause.generator("j", Expr.list(Expr.text("a"), Expr.text("b"))),
            Clause.generator("k", 1, 2));

    assertThat(bindings).hasSize(3 * 2 * 2);
    for (Bindings b : bindings) {
      assertThat(b.size()).isEqualTo(3);
      assertThat(b.names()).containsExactly("i", "j", "k").inOrder();
    }
    assertThat(bindings.get(0).valuesOf(ImmutableList.of("i", "j", "k")))
        .containsExactly(Values.number(1), Values.text("a"), Values.number(1))
        .inOrder();
    assertThat(bindings.get(1).valuesOf(ImmutableList.of("i", "j", "k")))
        .containsExactly(Values.number(1), Values.text("a"), Values.number(2))
        .inOrder();
    assertThat(bindings.get(11).valuesOf(ImmutableList.of("i", "j", "k")))
        .containsExactly(Values.number(3), Values.text("b"), Values.number(2))
        .inOrder();
  }

  @Test
  public void testGenerators_firstClauseIsOutermost() {
    final ImmutableList<Bindings> bindings =
        expand(Clause.generator("i", 1, 2), Clause.generator("j", 1, 2));

    assertThat(bindings).hasSize(4);
    assertThat(bindings.get(0).get("i")).isEqualTo(Values.number(1));
    assertThat(bindings.get(1).get("i")).isEqualTo(Values.number(1));
    assertThat(bindings.get(1).get("j")).isEqualTo(Values.number(2));
    assertThat(bindings.get(2).get("i")).isEqualTo(Values.number(2));
  }

  @Test
  public void testGenerators_dependentDomain() {
    final ImmutableList<Bindings> bindings =
        expand(
            Clause.generator("i", 1, 3),
            Clause.generator("j", Expr.range(Expr.ref("i"), Expr.constant(3))));

    assertThat(bindings).hasSize(3 + 2 + 1);
    for (Bindings b : bindings) {
      assertThat(b.get("j").asNumber().compareTo(b.get("i").asNumber())).isAtLeast(0);
    }
  }

  @Test
  public void testGenerators_filterPrunes() {
    final ImmutableList<Bindings> bindings =
        expand(
            Clause.generator("i", 1, 3),
            Clause.generator("j", 1, 3),
            Clause.filter(Expr.ne(Expr.ref("i"), Expr.ref("j"))));

    assertThat(bindings).hasSize(6);
    for (Bindings b : bindings) {
      assertThat(b.get("i")).isNotEqualTo(b.get("j"));
    }
  }

  @Test
  public void testGenerators_filterBeforeLaterClauses() {
    final ImmutableList<Bindings> bindings =
        expand(
            Clause.generator("i", 1, 4),
            Clause.filter(Expr.gt(Expr.ref("i"), Expr.constant(2))),
            Clause.generator("j", 1, 2));

    assertThat(bindings).hasSize(4);
    assertThat(bindings.get(0).get("i")).isEqualTo(Values.number(3));
    assertThat(bindings.get(3).get("i")).isEqualTo(Values.number(4));
  }

  @Test
  public void testGenerators_emptyDomainYieldsNothing() {
    assertThat(expand(Clause.generator("i", 1, 0))).isEmpty();
    assertThat(expand(Clause.generator("i", 1, 2), Clause.generator("j", 1, 0))).isEmpty();
  }

  @Test
  public void testGenerators_emptyDomainInTheMiddle() {
    final ImmutableList<Bindings> bindings =
        expand(
            Clause.generator("i", 1, 3),
            Clause.generator("j", Expr.range(Expr.constant(2), Expr.ref("i"))));

    // i = 1 has no j.
    assertThat(bindings).hasSize(0 + 1 + 2);
  }

  @Test
  public void testGenerators_noClauseYieldsOuterBindingsOnce() {
    final CompileContext context = CompileContext.empty().bind("k", Values.number(7));

    final ImmutableList<Bindings> bindings = expand(context);

    assertThat(bindings).hasSize(1);
    assertThat(bindings.get(0).get("k")).isEqualTo(Values.number(7));
  }

  @Test
  public void testGenerators_extendsOuterBindings() {
    final CompileContext context = CompileContext.empty().bind("k", Values.number(7));

    final ImmutableList<Bindings> bindings = expand(context, Clause.generator("i", 1, 2));

    assertThat(bindings).hasSize(2);
    assertThat(bindings.get(1).names()).containsExactly("k", "i").inOrder();
  }

  @Test
  public void testGenerators_restartable() {
    final Generators generators =
        Generators.expand(
            ImmutableList.of(Clause.generator("i", 1, 3), Clause.generator("j", 1, 2)),
            CompileContext.empty());

    assertThat(ImmutableList.copyOf(generators)).hasSize(6);
    assertThat(ImmutableList.copyOf(generators)).hasSize(6);
  }

  @Test
  public void testGenerators_mappingDomainYieldsKeys() {
    final ImmutableMap<String, Value> parameters =
        Values.parameters(ImmutableMap.of("cost", ImmutableMap.of("north", 3, "south", 4)));

    final ImmutableList<Bindings> bindings =
        expand(CompileContext.of(parameters), Clause.generator("p", Expr.ref("cost")));

    assertThat(bindings).hasSize(2);
    assertThat(bindings.get(0).get("p")).isEqualTo(Values.text("north"));
    assertThat(bindings.get(1).get("p")).isEqualTo(Values.text("south"));
  }

  @Test
  public void testGenerators_notEnumerable() {
    assertThrows(
        ModelException.NotEnumerable.class,
        () -> expand(Clause.generator("i", Expr.constant(3))));
    assertThrows(
        ModelException.NotEnumerable.class, () -> expand(Clause.generator("i", Expr.text("abc"))));
  }

  @Test
  public void testGenerators_undefinedDomainSymbol() {
    assertThrows(
        ModelException.UndefinedSymbol.class,
        () -> expand(Clause.generator("i", Expr.ref("missing"))));
  }

  @Test
  public void testGenerators_symbols() {
    final ImmutableList<Clause> clauses =
        ImmutableList.of(
            Clause.generator("i", 1, 2),
            Clause.filter(Expr.gt(Expr.ref("i"), Expr.constant(0))),
            Clause.generator("j", 1, 2));

    assertThat(Generators.symbols(clauses)).containsExactly("i", "j").inOrder();
    assertThat(Generators.expand(clauses, CompileContext.empty()).symbols())
        .containsExactly("i", "j")
        .inOrder();
  }
}
