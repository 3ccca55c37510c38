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

import com.google.common.collect.ImmutableMap;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.value.Value;

/**
 * The two scopes a symbol is resolved against: generator bindings first, then the model
 * parameters.
 *
 * <p>The context is passed explicitly to every compilation step.
 */
public final class CompileContext {
  private final Bindings bindings;
  private final ImmutableMap<String, Value> parameters;

  private CompileContext(Bindings bindings, ImmutableMap<String, Value> parameters) {
    this.bindings = checkNotNull(bindings);
    this.parameters = checkNotNull(parameters);
  }

  /** Returns a context with no binding and no parameter. */
  public static CompileContext empty() {
    return new CompileContext(Bindings.empty(), ImmutableMap.of());
  }

  /** Returns a context with the given parameters and no binding. */
  public static CompileContext of(ImmutableMap<String, Value> parameters) {
    return new CompileContext(Bindings.empty(), parameters);
  }

  public static CompileContext of(Bindings bindings, ImmutableMap<String, Value> parameters) {
    return new CompileContext(bindings, parameters);
  }

  public Bindings getBindings() {
    return bindings;
  }

  public ImmutableMap<String, Value> getParameters() {
    return parameters;
  }

  /** Returns a context sharing the parameters of this one. */
  public CompileContext withBindings(Bindings bindings) {
    return new CompileContext(bindings, parameters);
  }

  /** Shortcut for {@code withBindings(getBindings().extend(symbol, value))}. */
  public CompileContext bind(String symbol, Value value) {
    return new CompileContext(bindings.extend(symbol, value), parameters);
  }

  /** Returns the value of {@code symbol}, or null if neither scope defines it. */
  public Value lookup(String symbol) {
    Value value = bindings.get(symbol);
    return value != null ? value : parameters.get(symbol);
  }

  /**
   * Returns the value of {@code symbol}.
   *
   * @throws ModelException.UndefinedSymbol if neither scope defines it
   */
  public Value resolve(String methodName, String symbol) {
    Value value = lookup(symbol);
    if (value == null) {
      throw new ModelException.UndefinedSymbol(
          methodName, symbol, bindings.names(), parameters.keySet());
    }
    return value;
  }

  @Override
  public String toString() {
    return "CompileContext[bindings=" + bindings + ", parameters=" + parameters.keySet() + "]";
  }
}
