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

/** Unary minus. */
public final class NegateExpr implements Expr {
  private final Expr expr;

  public NegateExpr(Expr expr) {
    this.expr = checkNotNull(expr);
  }

  public Expr getExpr() {
    return expr;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitNegate(this);
  }

  @Override
  public boolean containsWildcard() {
    return expr.containsWildcard();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NegateExpr && ((NegateExpr) o).expr.equals(expr);
  }

  @Override
  public int hashCode() {
    return ~expr.hashCode();
  }

  @Override
  public String toString() {
    return "-" + expr;
  }
}
