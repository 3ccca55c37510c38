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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.ComparisonOperator;
import org.junit.jupiter.api.Test;

public final class ConstraintTest {
  @Test
  public void testConstraint_normalizesSides() {
    final Polynomial left = Polynomial.builder().addTerm("x", 1).add(2).build();
    final Polynomial right = Polynomial.builder().addTerm("y", 3).add(10).build();

    final Constraint constraint = Constraint.create(left, ComparisonOperator.LE, right);

    assertThat(constraint.getLeft())
        .isEqualTo(Polynomial.builder().addTerm("x", 1).addTerm("y", -3).build());
    assertThat(constraint.getRight()).isEqualTo(Polynomial.constant(8));
    assertThat(constraint.getRightValue()).isEqualTo(8.0);
    assertThat(constraint.getOperator()).isEqualTo(ComparisonOperator.LE);
    assertThat(constraint.isUnbounded()).isFalse();
  }

  @Test
  public void testConstraint_rejectsStrictOperators() {
    final Polynomial x = Polynomial.variable("x");

    assertThrows(
        ModelException.UnsupportedOperator.class,
        () -> Constraint.create(x, ComparisonOperator.LT, Polynomial.constant(1)));
    assertThrows(
        ModelException.UnsupportedOperator.class,
        () -> Constraint.create(x, ComparisonOperator.GT, Polynomial.constant(1)));
    assertThrows(
        ModelException.UnsupportedOperator.class,
        () -> Constraint.create(x, ComparisonOperator.NE, Polynomial.constant(1)));
  }

  @Test
  public void testConstraint_rejectsNonlinearTerms() {
    final Polynomial quadratic =
        Polynomial.builder().addTerm(ImmutableList.of("x", "y"), 1).build();

    assertThrows(
        ModelException.NonlinearExpression.class,
        () -> Constraint.create(quadratic, ComparisonOperator.EQ, Polynomial.constant(1)));
  }

  @Test
  public void testConstraint_unbounded() {
    final Polynomial left = Polynomial.builder().addTerm("x", 1).add(4).build();

    final Constraint constraint = Constraint.createUnbounded(left, ComparisonOperator.LE);

    assertThat(constraint.isUnbounded()).isTrue();
    assertThat(constraint.getLeft()).isEqualTo(Polynomial.variable("x"));
    assertThat(constraint.getRightValue()).isEqualTo(Double.POSITIVE_INFINITY);
    assertThrows(IllegalStateException.class, constraint::getRight);
    assertThat(constraint.toString()).isEqualTo("x <= unbounded");
    assertThrows(
        ModelException.UnsupportedOperator.class,
        () -> Constraint.createUnbounded(left, ComparisonOperator.EQ));
  }

  @Test
  public void testConstraint_withNameAndDescription() {
    final Constraint constraint =
        Constraint.create(Polynomial.variable("x"), ComparisonOperator.GE, Polynomial.zero())
            .withName("positive_x")
            .withDescription("positive x");

    assertThat(constraint.getName()).isEqualTo("positive_x");
    assertThat(constraint.getDescription()).isEqualTo("positive x");
    assertThat(constraint)
        .isNotEqualTo(
            Constraint.create(Polynomial.variable("x"), ComparisonOperator.GE, Polynomial.zero()));
  }
}
