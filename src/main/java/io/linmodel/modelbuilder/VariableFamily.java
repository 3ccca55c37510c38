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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.linmodel.value.Value;
import java.util.List;
import java.util.Map;

/**
 * A named family of variables indexed by fixed-length tuples of values.
 *
 * <p>The family is sparse: only the tuples produced by its generators are stored. Every key has
 * exactly {@link #getArity()} elements. A scalar variable is a family of arity 0 with the single
 * empty key.
 */
public final class VariableFamily {
  private final String name;
  private final int arity;
  private final ImmutableMap<ImmutableList<Value>, Polynomial> members;

  private VariableFamily(
      String name, int arity, ImmutableMap<ImmutableList<Value>, Polynomial> members) {
    this.name = name;
    this.arity = arity;
    this.members = members;
  }

  /** Creates an empty family. */
  public static VariableFamily create(String name, int arity) {
    checkArgument(arity >= 0, "arity must be non negative: %s", arity);
    return new VariableFamily(name, arity, ImmutableMap.of());
  }

  public String getName() {
    return name;
  }

  public int getArity() {
    return arity;
  }

  /** Returns the members in declaration order. */
  public ImmutableMap<ImmutableList<Value>, Polynomial> getMembers() {
    return members;
  }

  public int numMembers() {
    return members.size();
  }

  public boolean containsKey(List<Value> key) {
    return members.containsKey(key);
  }

  /** Returns the unit polynomial stored under {@code key}, or null. */
  public Polynomial get(List<Value> key) {
    return members.get(key);
  }

  /**
   * Returns the sum of the members whose key equals {@code pattern} at every position where the
   * pattern is not null. Null positions are wildcards.
   *
   * @throws ModelException.ArityMismatch if the pattern length differs from the arity
   */
  public Polynomial sumMatching(List<Value> pattern) {
    if (pattern.size() != arity) {
      throw new ModelException.ArityMismatch(
          "VariableFamily.sumMatching", name, arity, pattern.size());
    }
    Polynomial.Builder sum = Polynomial.builder();
    for (Map.Entry<ImmutableList<Value>, Polynomial> member : members.entrySet()) {
      if (matches(member.getKey(), pattern)) {
        sum.add(member.getValue());
      }
    }
    return sum.build();
  }

  /** Returns the sum of every member. */
  public Polynomial sumAll() {
    Polynomial.Builder sum = Polynomial.builder();
    for (Polynomial member : members.values()) {
      sum.add(member);
    }
    return sum.build();
  }

  private static boolean matches(List<Value> key, List<Value> pattern) {
    for (int i = 0; i < pattern.size(); ++i) {
      Value expected = pattern.get(i);
      if (expected != null && !expected.equals(key.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns a copy of this family with the given members appended. */
  VariableFamily withMembers(Map<ImmutableList<Value>, Polynomial> added) {
    for (ImmutableList<Value> key : added.keySet()) {
      checkArgument(
          key.size() == arity,
          "key %s of family %s must have %s elements",
          key,
          name,
          arity);
    }
    return new VariableFamily(
        name,
        arity,
        ImmutableMap.<ImmutableList<Value>, Polynomial>builder()
            .putAll(members)
            .putAll(added)
            .buildOrThrow());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VariableFamily)) {
      return false;
    }
    VariableFamily other = (VariableFamily) o;
    return other.name.equals(name) && other.arity == arity && other.members.equals(members);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + members.hashCode();
  }

  @Override
  public String toString() {
    return String.format("%s[arity=%d, members=%d]", name, arity, members.size());
  }
}
