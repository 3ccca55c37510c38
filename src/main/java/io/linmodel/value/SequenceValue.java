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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;

/** An ordered, zero-indexed list of values. Integer ranges evaluate to sequences. */
public final class SequenceValue extends Value {
  private final ImmutableList<Value> elements;

  public SequenceValue(List<? extends Value> elements) {
    this.elements = ImmutableList.copyOf(elements);
  }

  /** Returns the inclusive range {@code from..to}; empty when {@code to < from}. */
  public static SequenceValue range(long from, long to) {
    ImmutableList.Builder<Value> builder = ImmutableList.builder();
    if (from <= to) {
      // Ends on i == to, since ++i wraps past Long.MAX_VALUE.
      for (long i = from; ; ++i) {
        builder.add(NumberValue.of(i));
        if (i == to) {
          break;
        }
      }
    }
    return new SequenceValue(builder.build());
  }

  @Override
  public Kind kind() {
    return Kind.SEQUENCE;
  }

  @Override
  public SequenceValue asSequence() {
    return this;
  }

  public ImmutableList<Value> elements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  @Override
  public String describe() {
    if (elements.size() > 10) {
      return "["
          + Joiner.on(", ").join(Iterables.limit(elements, 10))
          + ", ... ("
          + elements.size()
          + " elements)]";
    }
    return "[" + Joiner.on(", ").join(elements) + "]";
  }

  @Override
  public String render() {
    return describe();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SequenceValue && ((SequenceValue) o).elements.equals(elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }
}
