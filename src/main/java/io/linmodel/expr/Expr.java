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

package io.linmodel.expr;

import com.google.common.collect.ImmutableList;
import io.linmodel.value.Value;
import io.linmodel.value.Values;
import java.util.List;

/**
 * An immutable node of a model expression tree.
 *
 * <p>The static methods are the front-end used to write models in Java, for instance
 *
 * <pre>{@code
 * Expr.eq(Expr.select("q", Expr.ref("i"), Expr.wildcard()), Expr.constant(1))
 * }</pre>
 *
 * <p>describes {@code sum(q(i, _)) == 1}.
 */
public interface Expr {
  <R> R accept(ExprVisitor<R> visitor);

  /** Returns true if a wildcard marker appears anywhere below this node. */
  boolean containsWildcard();

  // Leaves.

  /** Shortcut for a numeric constant. */
  static Expr constant(long value) {
    return new ConstantExpr(Values.number(value));
  }

  /** Shortcut for a numeric constant. */
  static Expr constant(double value) {
    return new ConstantExpr(Values.number(value));
  }

  /** Shortcut for a constant value. */
  static Expr constant(Value value) {
    return new ConstantExpr(value);
  }

  /** Shortcut for a text constant. */
  static Expr text(String value) {
    return new ConstantExpr(Values.text(value));
  }

  /** The "no bound" constant. */
  static Expr unbounded() {
    return new ConstantExpr(Values.unbounded());
  }

  /** A reference to a variable, a generator symbol or a model parameter. */
  static Expr ref(String name) {
    return new RefExpr(name);
  }

  /** The wildcard index marker, {@code _}. */
  static Expr wildcard() {
    return WildcardExpr.INSTANCE;
  }

  /** An indexed reference {@code name(i1, ..., ik)}. Indices may contain {@link #wildcard()}. */
  static Expr index(String name, Expr... indices) {
    return new IndexExpr(name, ImmutableList.copyOf(indices));
  }

  /** A wildcard selection {@code name(pattern)}, implicitly summed over the matching members. */
  static Expr select(String name, Expr... pattern) {
    return new WildcardIndexExpr(name, ImmutableList.copyOf(pattern));
  }

  /** A container access {@code container[key]}. */
  static Expr access(Expr container, Expr key) {
    return new AccessExpr(container, key);
  }

  /** Shortcut for chained access {@code container[k1][k2]...}. */
  static Expr access(Expr container, Expr firstKey, Expr... moreKeys) {
    Expr result = new AccessExpr(container, firstKey);
    for (Expr key : moreKeys) {
      result = new AccessExpr(result, key);
    }
    return result;
  }

  /** The inclusive integer range {@code from..to}. */
  static Expr range(Expr from, Expr to) {
    return new RangeExpr(from, to);
  }

  /** Shortcut for a literal range. */
  static Expr range(long from, long to) {
    return new RangeExpr(constant(from), constant(to));
  }

  /** A list literal. */
  static Expr list(Expr... elements) {
    return new ListExpr(ImmutableList.copyOf(elements));
  }

  // Arithmetic.

  static Expr add(Expr left, Expr right) {
    return new BinaryExpr(ArithmeticOperator.ADD, left, right);
  }

  /** Shortcut for a left-associated sum of several terms. */
  static Expr add(Expr first, Expr second, Expr... more) {
    Expr result = add(first, second);
    for (Expr e : more) {
      result = add(result, e);
    }
    return result;
  }

  static Expr subtract(Expr left, Expr right) {
    return new BinaryExpr(ArithmeticOperator.SUBTRACT, left, right);
  }

  static Expr multiply(Expr left, Expr right) {
    return new BinaryExpr(ArithmeticOperator.MULTIPLY, left, right);
  }

  static Expr divide(Expr left, Expr right) {
    return new BinaryExpr(ArithmeticOperator.DIVIDE, left, right);
  }

  static Expr negate(Expr expr) {
    return new NegateExpr(expr);
  }

  /** {@code sum(body for clauses)}. */
  static Expr sum(List<Clause> clauses, Expr body) {
    return new SumExpr(ImmutableList.copyOf(clauses), body);
  }

  /** {@code sum(body)}, used for wildcard bodies without generator clauses. */
  static Expr sum(Expr body) {
    return new SumExpr(ImmutableList.of(), body);
  }

  // Comparisons.

  static CompareExpr compare(ComparisonOperator op, Expr left, Expr right) {
    return new CompareExpr(op, left, right);
  }

  static CompareExpr eq(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.EQ, left, right);
  }

  static CompareExpr ne(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.NE, left, right);
  }

  static CompareExpr le(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.LE, left, right);
  }

  static CompareExpr ge(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.GE, left, right);
  }

  static CompareExpr lt(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.LT, left, right);
  }

  static CompareExpr gt(Expr left, Expr right) {
    return new CompareExpr(ComparisonOperator.GT, left, right);
  }
}
