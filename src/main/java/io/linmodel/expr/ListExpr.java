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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** A list literal {@code [e1, ..., en]}. */
public final class ListExpr implements Expr {
  private final ImmutableList<Expr> elements;

  public ListExpr(ImmutableList<Expr> elements) {
    this.elements = elements;
  }

  public ImmutableList<Expr> getElements() {
    return elements;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitList(this);
  }

  @Override
  public boolean containsWildcard() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ListExpr && ((ListExpr) o).elements.equals(elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on(", ").join(elements) + "]";
  }
}
