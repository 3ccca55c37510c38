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

/** {@code container[key]} over a list or a mapping. */
public final class AccessExpr implements Expr {
  private final Expr container;
  private final Expr key;

  public AccessExpr(Expr container, Expr key) {
    this.container = checkNotNull(container);
    this.key = checkNotNull(key);
  }

  public Expr getContainer() {
    return container;
  }

  public Expr getKey() {
    return key;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitAccess(this);
  }

  @Override
  public boolean containsWildcard() {
    return container.containsWildcard() || key.containsWildcard();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AccessExpr)) {
      return false;
    }
    AccessExpr other = (AccessExpr) o;
    return other.container.equals(container) && other.key.equals(key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(container, key);
  }

  @Override
  public String toString() {
    return container + "[" + key + "]";
  }
}
