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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Factories for {@link Value}, including conversion of plain Java data into model parameters. */
public final class Values {
  private Values() {}

  /** Returns the unbounded marker. */
  public static Value unbounded() {
    return UnboundedValue.INSTANCE;
  }

  public static NumberValue number(long value) {
    return NumberValue.of(value);
  }

  public static NumberValue number(double value) {
    return NumberValue.of(value);
  }

  public static TextValue text(String text) {
    return new TextValue(text);
  }

  /** Shortcut for a sequence of the given values. */
  public static SequenceValue sequence(Value... elements) {
    return new SequenceValue(ImmutableList.copyOf(elements));
  }

  /** Returns the inclusive integer range {@code from..to}. */
  public static SequenceValue range(long from, long to) {
    return SequenceValue.range(from, to);
  }

  /**
   * Converts plain Java data into a value.
   *
   * <p>Accepted inputs are {@link Value} (returned as is), {@link Number}, {@link CharSequence},
   * {@link Character}, {@link Collection}, arrays of objects, {@code int[]}, {@code long[]}, {@code
   * double[]} and {@link Map}. Conversion is recursive, so nested containers become nested values.
   *
   * @throws IllegalArgumentException on null or on any other type
   */
  public static Value of(Object object) {
    if (object == null) {
      throw new IllegalArgumentException("null cannot be converted to a model value");
    }
    if (object instanceof Value) {
      return (Value) object;
    }
    if (object instanceof Integer
        || object instanceof Long
        || object instanceof Short
        || object instanceof Byte
        || object instanceof BigInteger) {
      return NumberValue.of(((Number) object).longValue());
    }
    if (object instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) object;
      if (decimal.stripTrailingZeros().scale() <= 0) {
        return NumberValue.of(decimal.longValue());
      }
      return NumberValue.of(decimal.doubleValue());
    }
    if (object instanceof Number) {
      double value = ((Number) object).doubleValue();
      if (Double.isInfinite(value) && value > 0) {
        return unbounded();
      }
      return NumberValue.of(value);
    }
    if (object instanceof CharSequence || object instanceof Character) {
      return new TextValue(object.toString());
    }
    if (object instanceof Map) {
      Map<Value, Value> converted = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) object).entrySet()) {
        converted.put(of(entry.getKey()), of(entry.getValue()));
      }
      return new MappingValue(converted);
    }
    if (object instanceof Collection) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      for (Object element : (Collection<?>) object) {
        builder.add(of(element));
      }
      return new SequenceValue(builder.build());
    }
    if (object instanceof Object[]) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      for (Object element : (Object[]) object) {
        builder.add(of(element));
      }
      return new SequenceValue(builder.build());
    }
    if (object instanceof int[]) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      for (int element : (int[]) object) {
        builder.add(NumberValue.of(element));
      }
      return new SequenceValue(builder.build());
    }
    if (object instanceof long[]) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      for (long element : (long[]) object) {
        builder.add(NumberValue.of(element));
      }
      return new SequenceValue(builder.build());
    }
    if (object instanceof double[]) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      for (double element : (double[]) object) {
        builder.add(NumberValue.of(element));
      }
      return new SequenceValue(builder.build());
    }
    throw new IllegalArgumentException(
        "cannot convert " + object.getClass().getName() + " to a model value");
  }

  /** Converts a map of named parameters, keeping insertion order. */
  public static ImmutableMap<String, Value> parameters(Map<String, ?> parameters) {
    ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
    for (Map.Entry<String, ?> entry : parameters.entrySet()) {
      builder.put(entry.getKey(), of(entry.getValue()));
    }
    return builder.buildOrThrow();
  }
}
