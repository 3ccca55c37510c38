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

/** A bare name: a scalar variable, a variable family, a generator symbol or a model parameter. */
public final class RefExpr implements Expr {
  private final String name;

  public RefExpr(String name) {
    checkArgument(name != null && !name.isEmpty(), "reference name must not be empty");
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitRef(this);
  }

  @Override
  public boolean containsWildcard() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RefExpr && ((RefExpr) o).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
