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

/** {@code left op right} for one of the four arithmetic operators. */
public final class BinaryExpr implements Expr {
  private final ArithmeticOperator operator;
  private final Expr left;
  private final Expr right;

  public BinaryExpr(ArithmeticOperator operator, Expr left, Expr right) {
    this.operator = checkNotNull(operator);
    this.left = checkNotNull(left);
    this.right = checkNotNull(right);
  }

  public ArithmeticOperator getOperator() {
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
    return visitor.visitBinary(this);
  }

  @Override
  public boolean containsWildcard() {
    return left.containsWildcard() || right.containsWildcard();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BinaryExpr)) {
      return false;
    }
    BinaryExpr other = (BinaryExpr) o;
    return other.operator == operator && other.left.equals(left) && other.right.equals(right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, left, right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.symbol() + " " + right + ")";
  }
}
