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

package io.linmodel.value;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** An insertion-ordered mapping from values to values. Enumerating a mapping yields its keys. */
public final class MappingValue extends Value {
  private final ImmutableMap<Value, Value> entries;

  public MappingValue(Map<? extends Value, ? extends Value> entries) {
    this.entries = ImmutableMap.copyOf(entries);
  }

  @Override
  public Kind kind() {
    return Kind.MAPPING;
  }

  @Override
  public MappingValue asMapping() {
    return this;
  }

  public ImmutableMap<Value, Value> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  /** Returns the value stored under {@code key}, or null. */
  public Value get(Value key) {
    return entries.get(key);
  }

  @Override
  public String describe() {
    return "{" + Joiner.on(", ").join(entries.keySet()) + "}";
  }

  @Override
  public String render() {
    return "{" + Joiner.on(", ").withKeyValueSeparator(": ").join(entries) + "}";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MappingValue && ((MappingValue) o).entries.equals(entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }
}
