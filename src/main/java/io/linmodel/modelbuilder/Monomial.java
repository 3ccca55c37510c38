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

package io.linmodel.modelbuilder;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * The ordered list of variable names identifying one polynomial term. Arity 0 is the constant
 * term, arity 1 a linear term.
 */
public final class Monomial {
  private static final Monomial CONSTANT = new Monomial(ImmutableList.of());

  private final ImmutableList<String> variables;

  private Monomial(ImmutableList<String> variables) {
    this.variables = variables;
  }

  /** Returns the arity 0 monomial. */
  public static Monomial constant() {
    return CONSTANT;
  }

  /** Returns the linear monomial of one variable. */
  public static Monomial of(String variable) {
    return new Monomial(ImmutableList.of(variable));
  }

  public static Monomial of(ImmutableList<String> variables) {
    return variables.isEmpty() ? CONSTANT : new Monomial(variables);
  }

  public int arity() {
    return variables.size();
  }

  public boolean isConstant() {
    return variables.isEmpty();
  }

  public ImmutableList<String> getVariables() {
    return variables;
  }

  /** Returns the single variable of a linear monomial. */
  public String getVariable() {
    if (variables.size() != 1) {
      throw new IllegalStateException("monomial " + this + " is not linear");
    }
    return variables.get(0);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Monomial && ((Monomial) o).variables.equals(variables);
  }

  @Override
  public int hashCode() {
    return variables.hashCode();
  }

  @Override
  public String toString() {
    return variables.isEmpty() ? "1" : Joiner.on(" * ").join(variables);
  }
}
