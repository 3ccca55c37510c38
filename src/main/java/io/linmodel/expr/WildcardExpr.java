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

/** The wildcard index marker {@code _}, meaning "any value at this position". */
public final class WildcardExpr implements Expr {
  static final WildcardExpr INSTANCE = new WildcardExpr();

  private WildcardExpr() {}

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitWildcard(this);
  }

  @Override
  public boolean containsWildcard() {
    return true;
  }

  @Override
  public String toString() {
    return "_";
  }
}
