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

/** The inclusive integer range {@code from..to}. Bounds may depend on bindings and parameters. */
public final class RangeExpr implements Expr {
  private final Expr from;
  private final Expr to;

  public RangeExpr(Expr from, Expr to) {
    this.from = checkNotNull(from);
    this.to = checkNotNull(to);
  }

  public Expr getFrom() {
    return from;
  }

  public Expr getTo() {
    return to;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitRange(this);
  }

  @Override
  public boolean containsWildcard() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RangeExpr)) {
      return false;
    }
    RangeExpr other = (RangeExpr) o;
    return other.from.equals(from) && other.to.equals(to);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to, "..");
  }

  @Override
  public String toString() {
    return from + ".." + to;
  }
}
