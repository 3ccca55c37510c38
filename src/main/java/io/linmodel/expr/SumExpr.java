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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** {@code sum(body for clauses)}: the body summed over every binding the clauses produce. */
public final class SumExpr implements Expr {
  private final ImmutableList<Clause> clauses;
  private final Expr body;

  public SumExpr(ImmutableList<Clause> clauses, Expr body) {
    this.clauses = checkNotNull(clauses);
    this.body = checkNotNull(body);
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }

  public Expr getBody() {
    return body;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitSum(this);
  }

  @Override
  public boolean containsWildcard() {
    return body.containsWildcard();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SumExpr)) {
      return false;
    }
    SumExpr other = (SumExpr) o;
    return other.clauses.equals(clauses) && other.body.equals(body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clauses, body);
  }

  @Override
  public String toString() {
    if (clauses.isEmpty()) {
      return "sum(" + body + ")";
    }
    return "sum(" + body + " for " + Joiner.on(", ").join(clauses) + ")";
  }
}
