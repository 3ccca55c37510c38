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

package io.linmodel.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import io.linmodel.expr.Clause;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Expands generator clauses into binding environments.
 *
 * <p>Clauses are nested loops, the first one outermost. The domain of a clause is evaluated for
 * each partial binding, so it may use the symbols bound by the clauses before it. A filter prunes
 * the current branch before the clauses after it are expanded. An empty clause list yields the
 * outer bindings once.
 *
 * <p>The expansion is lazy and restartable: each call to {@link #iterator()} evaluates the domains
 * again.
 */
public final class Generators implements Iterable<Bindings> {
  private final ImmutableList<Clause> clauses;
  private final CompileContext context;

  private Generators(ImmutableList<Clause> clauses, CompileContext context) {
    this.clauses = clauses;
    this.context = context;
  }

  /** Returns the bindings produced by {@code clauses} on top of the bindings of {@code context}. */
  public static Generators expand(List<Clause> clauses, CompileContext context) {
    return new Generators(ImmutableList.copyOf(clauses), checkNotNull(context));
  }

  /** Returns the generator symbols in declaration order. Filters bind nothing. */
  public ImmutableList<String> symbols() {
    return symbols(clauses);
  }

  /** Returns the generator symbols of {@code clauses} in declaration order. */
  public static ImmutableList<String> symbols(List<Clause> clauses) {
    ImmutableList.Builder<String> symbols = ImmutableList.builder();
    for (Clause clause : clauses) {
      if (!clause.isFilter()) {
        symbols.add(clause.getSymbol());
      }
    }
    return symbols.build();
  }

  @Override
  public Iterator<Bindings> iterator() {
    return new BindingIterator();
  }

  /**
   * Returns the values a generator domain enumerates: the elements of a sequence or the keys of a
   * mapping.
   *
   * @throws ModelException.NotEnumerable for any other value
   */
  public static List<Value> enumerate(String symbol, Value domain) {
    switch (domain.kind()) {
      case SEQUENCE:
        return domain.asSequence().elements();
      case MAPPING:
        return domain.asMapping().entries().keySet().asList();
      case NUMBER:
      case TEXT:
      case UNBOUNDED:
        break;
    }
    throw new ModelException.NotEnumerable(
        "Generators.expand",
        "the domain of '"
            + symbol
            + "' must be a sequence, a range or a mapping, got "
            + domain.describe());
  }

  /** Depth-first walk over the clauses, one level per clause. */
  private final class BindingIterator extends AbstractIterator<Bindings> {
    // prefix[k] holds the bindings built before clause k.
    private final Bindings[] prefix;
    private final List<Iterator<Value>> domains;
    private int level;
    private boolean started;

    BindingIterator() {
      this.prefix = new Bindings[clauses.size() + 1];
      this.domains = new ArrayList<>(Collections.<Iterator<Value>>nCopies(clauses.size(), null));
    }

    @Override
    protected Bindings computeNext() {
      if (!started) {
        started = true;
        prefix[0] = context.getBindings();
        level = 0;
      } else if (!backtrack()) {
        return endOfData();
      }
      while (level < clauses.size()) {
        Clause clause = clauses.get(level);
        CompileContext partial = context.withBindings(prefix[level]);
        if (clause.isFilter()) {
          if (ConstantEvaluator.test(clause.getPredicate(), partial)) {
            prefix[level + 1] = prefix[level];
            level++;
          } else if (!backtrack()) {
            return endOfData();
          }
        } else {
          Value domain = ConstantEvaluator.evaluate(clause.getDomain(), partial);
          Iterator<Value> values = enumerate(clause.getSymbol(), domain).iterator();
          domains.set(level, values);
          if (values.hasNext()) {
            prefix[level + 1] = prefix[level].extend(clause.getSymbol(), values.next());
            level++;
          } else if (!backtrack()) {
            return endOfData();
          }
        }
      }
      return prefix[clauses.size()];
    }

    /**
     * Moves the deepest generator above the current level that still has values to its next
     * value. Returns false when every generator is exhausted.
     */
    private boolean backtrack() {
      for (int l = level - 1; l >= 0; --l) {
        Clause clause = clauses.get(l);
        if (clause.isFilter()) {
          continue;
        }
        Iterator<Value> values = domains.get(l);
        if (values.hasNext()) {
          prefix[l + 1] = prefix[l].extend(clause.getSymbol(), values.next());
          level = l + 1;
          return true;
        }
      }
      return false;
    }
  }
}
