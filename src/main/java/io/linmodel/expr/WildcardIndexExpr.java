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

/**
 * A selection {@code name(pattern)} over a variable family. Positions holding the wildcard marker
 * match any value; the selection stands for the sum of every matching member.
 */
public final class WildcardIndexExpr implements Expr {
  private final String name;
  private final ImmutableList<Expr> pattern;

  public WildcardIndexExpr(String name, ImmutableList<Expr> pattern) {
    checkArgument(name != null && !name.isEmpty(), "family name must not be empty");
    this.name = name;
    this.pattern = pattern;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Expr> getPattern() {
    return pattern;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitWildcardIndex(this);
  }

  @Override
  public boolean containsWildcard() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WildcardIndexExpr)) {
      return false;
    }
    WildcardIndexExpr other = (WildcardIndexExpr) o;
    return other.name.equals(name) && other.pattern.equals(pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, pattern, "select");
  }

  @Override
  public String toString() {
    return "sum(" + name + "(" + Joiner.on(", ").join(pattern) + "))";
  }
}
