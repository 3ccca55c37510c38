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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** An indexed family reference {@code name(i1, ..., ik)}. */
public final class IndexExpr implements Expr {
  private final String name;
  private final ImmutableList<Expr> indices;

  public IndexExpr(String name, ImmutableList<Expr> indices) {
    checkArgument(name != null && !name.isEmpty(), "family name must not be empty");
    this.name = name;
    this.indices = indices;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Expr> getIndices() {
    return indices;
  }

  /** Returns true if one of the indices is the wildcard marker. */
  public boolean hasWildcardIndex() {
    for (Expr index : indices) {
      if (index instanceof WildcardExpr) {
        return true;
      }
    }
    return false;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitIndex(this);
  }

  @Override
  public boolean containsWildcard() {
    for (Expr index : indices) {
      if (index.containsWildcard()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IndexExpr)) {
      return false;
    }
    IndexExpr other = (IndexExpr) o;
    return other.name.equals(name) && other.indices.equals(indices);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, indices);
  }

  @Override
  public String toString() {
    return name + "(" + Joiner.on(", ").join(indices) + ")";
  }
}
