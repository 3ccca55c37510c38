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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * One clause of a generator list: either {@code symbol <- domain}, which iterates the symbol over
 * the values of the domain, or a filter predicate that prunes the combinations built so far.
 */
public final class Clause {
  private final String symbol;
  private final Expr expr;

  private Clause(String symbol, Expr expr) {
    this.symbol = symbol;
    this.expr = checkNotNull(expr);
  }

  /** Creates {@code symbol <- domain}. */
  public static Clause generator(String symbol, Expr domain) {
    checkArgument(symbol != null && !symbol.isEmpty(), "generator symbol must not be empty");
    return new Clause(symbol, domain);
  }

  /** Shortcut for {@code symbol <- from..to}. */
  public static Clause generator(String symbol, long from, long to) {
    return generator(symbol, Expr.range(from, to));
  }

  /** Creates a filter clause. The predicate is usually a {@link CompareExpr}. */
  public static Clause filter(Expr predicate) {
    return new Clause(null, predicate);
  }

  public boolean isFilter() {
    return symbol == null;
  }

  /** Returns the bound symbol, or null for a filter. */
  public String getSymbol() {
    return symbol;
  }

  /** Returns the domain of a generator. */
  public Expr getDomain() {
    checkArgument(!isFilter(), "a filter clause has no domain");
    return expr;
  }

  /** Returns the predicate of a filter. */
  public Expr getPredicate() {
    checkArgument(isFilter(), "a generator clause has no predicate");
    return expr;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Clause)) {
      return false;
    }
    Clause other = (Clause) o;
    return Objects.equals(other.symbol, symbol) && other.expr.equals(expr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, expr);
  }

  @Override
  public String toString() {
    return isFilter() ? "if " + expr : symbol + " <- " + expr;
  }
}
