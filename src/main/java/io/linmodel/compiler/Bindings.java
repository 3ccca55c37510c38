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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.linmodel.value.Value;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered, immutable environment of generator symbols and their current values.
 *
 * <p>{@link #extend} never modifies the receiver; nested generator clauses each get a new
 * environment.
 */
public final class Bindings {
  private static final Bindings EMPTY = new Bindings(ImmutableMap.of());

  private final ImmutableMap<String, Value> values;

  private Bindings(ImmutableMap<String, Value> values) {
    this.values = values;
  }

  public static Bindings empty() {
    return EMPTY;
  }

  /** Returns an environment holding the given symbols, in iteration order. */
  public static Bindings of(Map<String, ? extends Value> values) {
    return values.isEmpty() ? EMPTY : new Bindings(ImmutableMap.copyOf(values));
  }

  /**
   * Returns a new environment with {@code symbol} bound to {@code value}. A symbol already bound
   * keeps its position and gets the new value.
   */
  public Bindings extend(String symbol, Value value) {
    checkNotNull(symbol);
    checkNotNull(value);
    if (!values.containsKey(symbol)) {
      return new Bindings(
          ImmutableMap.<String, Value>builder().putAll(values).put(symbol, value).buildOrThrow());
    }
    Map<String, Value> copy = new LinkedHashMap<>(values);
    copy.put(symbol, value);
    return new Bindings(ImmutableMap.copyOf(copy));
  }

  /** Returns the value bound to {@code symbol}, or null. */
  public Value get(String symbol) {
    return values.get(symbol);
  }

  public boolean contains(String symbol) {
    return values.containsKey(symbol);
  }

  /** Returns the bound symbols in binding order. */
  public ImmutableSet<String> names() {
    return values.keySet();
  }

  /** Returns the values of the given symbols, in the order of {@code symbols}. */
  public ImmutableList<Value> valuesOf(List<String> symbols) {
    ImmutableList.Builder<Value> builder = ImmutableList.builder();
    for (String symbol : symbols) {
      Value value = values.get(symbol);
      checkNotNull(value, "symbol %s is not bound", symbol);
      builder.add(value);
    }
    return builder.build();
  }

  public ImmutableMap<String, Value> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Bindings && ((Bindings) o).values.equals(values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
