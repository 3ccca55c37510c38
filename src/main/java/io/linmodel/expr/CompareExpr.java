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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** {@code left op right}. A constraint at the top level, a predicate inside filter clauses. */
public final class CompareExpr implements Expr {
  private final ComparisonOperator operator;
  private final Expr left;
  private final Expr right;

  public CompareExpr(ComparisonOperator operator, Expr left, Expr right) {
    this.operator = checkNotNull(operator);
    this.left = checkNotNull(left);
    this.right = checkNotNull(right);
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public Expr getLeft() {
    return left;
  }

  public Expr getRight() {
    return right;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitCompare(this);
  }

  @Override
  public boolean containsWildcard() {
    return left.containsWildcard() || right.containsWildcard();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CompareExpr)) {
      return false;
    }
    CompareExpr other = (CompareExpr) o;
    return other.operator == operator && other.left.equals(left) && other.right.equals(right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, left, right);
  }

  @Override
  public String toString() {
    return left + " " + operator.symbol() + " " + right;
  }
}
