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

import io.linmodel.value.Value;

/** A literal value: a number, a text, or the unbounded marker. */
public final class ConstantExpr implements Expr {
  private final Value value;

  public ConstantExpr(Value value) {
    this.value = checkNotNull(value);
  }

  public Value getValue() {
    return value;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitConstant(this);
  }

  @Override
  public boolean containsWildcard() {
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ConstantExpr && ((ConstantExpr) o).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.describe();
  }
}
