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
import io.linmodel.modelbuilder.Model;
import io.linmodel.modelbuilder.ModelBuilder;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.modelbuilder.Polynomial;
import io.linmodel.modelbuilder.VariableType;
import io.linmodel.value.Values;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public final class WildcardExpansionTest {
  private ModelBuilder builder;
  private CompileContext context;
  private Model model;

  @BeforeEach
  public void setUp() {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("cost", ImmutableMap.of("north", 3, "south", 4, "east", 5));
    data.put("sites", ImmutableList.of("south", "north"));
    data.put("weights", ImmutableList.of(2, 5));
    data.put("n", 2);
    builder = ModelBuilder.withParameters(data);
    context = CompileContext.of(builder.getParameters());
    model =
        builder.declareFamily(
            Model.empty(),
            "x",
            ImmutableList.of(Clause.generator("p", Expr.ref("sites"))),
            VariableType.CONTINUOUS);
    model =
        builder.declareFamily(
            model,
            "q",
            ImmutableList.of(Clause.generator("i", 1, 2), Clause.generator("j", 1, 2)),
            VariableType.BINARY);
  }

  private static Expr costTimesX() {
    return Expr.multiply(
        Expr.access(Expr.ref("cost"), Expr.wildcard()), Expr.index("x", Expr.wildcard()));
  }

  @Test
  public void testWildcardExpansion_hasContainerWildcard() {
    assertThat(WildcardExpansion.hasContainerWildcard(costTimesX())).isTrue();
    assertThat(WildcardExpansion.hasContainerWildcard(Expr.index("x", Expr.wildcard()))).isFalse();
    // Nested sums are expanded on their own.
    assertThat(WildcardExpansion.hasContainerWildcard(Expr.sum(costTimesX()))).isFalse();
  }

  @Test
  public void testWildcardExpansion_domainIsIntersectionInFirstSourceOrder() {
    assertThat(WildcardExpansion.domain(costTimesX(), context, model))
        .containsExactly(Values.text("north"), Values.text("south"))
        .inOrder();
  }

  @Test
  public void testWildcardExpansion_familyFirstOrder() {
    final Expr expr =
        Expr.multiply(
            Expr.index("x", Expr.wildcard()), Expr.access(Expr.ref("cost"), Expr.wildcard()));

    assertThat(WildcardExpansion.domain(expr, context, model))
        .containsExactly(Values.text("south"), Values.text("north"))
        .inOrder();
  }

  @Test
  public void testWildcardExpansion_sequenceDomainIsIndices() {
    final Expr expr = Expr.access(Expr.ref("weights"), Expr.wildcard());

    assertThat(WildcardExpansion.domain(expr, context, model))
        .containsExactly(Values.number(0), Values.number(1))
        .inOrder();
  }

  @Test
  public void testWildcardExpansion_familyValuesAtFirstWildcard() {
    final Expr expr = Expr.index("q", Expr.constant(1), Expr.wildcard());

    assertThat(WildcardExpansion.domain(expr, context, model))
        .containsExactly(Values.number(1), Values.number(2))
        .inOrder();
  }

  @Test
  public void testWildcardExpansion_expand() {
    final ImmutableList<Expr> instances =
        WildcardExpansion.expand(costTimesX(), context, model);

    assertThat(instances)
        .containsExactly(
            Expr.multiply(
                Expr.access(Expr.ref("cost"), Expr.text("north")),
                Expr.index("x", Expr.text("north"))),
            Expr.multiply(
                Expr.access(Expr.ref("cost"), Expr.text("south")),
                Expr.index("x", Expr.text("south"))))
        .inOrder();
  }

  @Test
  public void testWildcardExpansion_substituteKeepsNestedSums() {
    final Expr nested = Expr.sum(Expr.index("x", Expr.wildcard()));
    final Expr expr = Expr.add(Expr.access(Expr.ref("cost"), Expr.wildcard()), nested);

    final Expr substituted = WildcardExpansion.substitute(expr, Values.text("east"));

    assertThat(substituted)
        .isEqualTo(Expr.add(Expr.access(Expr.ref("cost"), Expr.text("east")), nested));
  }

  @Test
  public void testWildcardExpansion_substituteKeepsSelections() {
    final Expr selection = Expr.select("q", Expr.wildcard(), Expr.constant(1));

    assertThat(WildcardExpansion.substitute(selection, Values.number(2)))
        .isEqualTo(Expr.select("q", Expr.constant(2), Expr.constant(1)));
  }

  @Test
  public void testWildcardExpansion_disjointDomains() {
    final Expr expr =
        Expr.multiply(
            Expr.access(Expr.ref("cost"), Expr.wildcard()),
            Expr.index("q", Expr.wildcard(), Expr.constant(1)));

    assertThrows(
        ModelException.NotEnumerable.class,
        () -> WildcardExpansion.domain(expr, context, model));
  }

  @Test
  public void testWildcardExpansion_scalarContainer() {
    assertThrows(
        ModelException.NotEnumerable.class,
        () ->
            WildcardExpansion.domain(
                Expr.access(Expr.ref("n"), Expr.wildcard()), context, model));
  }

  @Test
  public void testWildcardExpansion_noSource() {
    assertThrows(
        ModelException.NotEnumerable.class,
        () -> WildcardExpansion.domain(Expr.constant(1), context, model));
  }

  @Test
  public void testWildcardExpansion_unknownFamily() {
    final Expr expr =
        Expr.multiply(
            Expr.access(Expr.ref("cost"), Expr.wildcard()), Expr.index("z", Expr.wildcard()));

    assertThrows(
        ModelException.UndefinedVariable.class,
        () -> WildcardExpansion.domain(expr, context, model));
  }

  @Test
  public void testWildcardExpansion_textKeysMeetNumericIndices() {
    final ModelBuilder textKeys =
        ModelBuilder.withParameters(
            ImmutableMap.of("price", ImmutableMap.of("1", 5, "2", 7, "3", 9)));
    final Model weights =
        textKeys.declareFamily(
            Model.empty(),
            "w",
            ImmutableList.of(Clause.generator("i", 1, 2)),
            VariableType.CONTINUOUS);
    final CompileContext textContext = CompileContext.of(textKeys.getParameters());
    final Expr expr =
        Expr.multiply(
            Expr.access(Expr.ref("price"), Expr.wildcard()), Expr.index("w", Expr.wildcard()));

    assertThat(WildcardExpansion.domain(expr, textContext, weights))
        .containsExactly(Values.number(1), Values.number(2))
        .inOrder();
    assertThat(ExpressionCompiler.compile(Expr.sum(expr), textContext, weights))
        .isEqualTo(Polynomial.builder().addTerm("w(1)", 5).addTerm("w(2)", 7).build());
  }
}
