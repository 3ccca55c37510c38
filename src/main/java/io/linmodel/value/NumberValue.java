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

/**
 * A numeric value. Integral numbers keep their integral kind through addition, subtraction,
 * multiplication and exact division; any floating operand promotes the result to floating.
 *
 * <p>Equality is numeric: {@code 1} equals {@code 1.0}.
 */
public final class NumberValue extends Value {
  private final boolean integral;
  private final long longValue;
  private final double doubleValue;

  private NumberValue(boolean integral, long longValue, double doubleValue) {
    this.integral = integral;
    this.longValue = longValue;
    this.doubleValue = doubleValue;
  }

  public static NumberValue of(long value) {
    return new NumberValue(true, value, value);
  }

  /** Returns a floating number. Negative zero is stored as zero. */
  public static NumberValue of(double value) {
    double normalized = value == 0.0 ? 0.0 : value;
    return new NumberValue(false, (long) normalized, normalized);
  }

  @Override
  public Kind kind() {
    return Kind.NUMBER;
  }

  @Override
  public NumberValue asNumber() {
    return this;
  }

  /** Returns true if the number was produced from integral operands only. */
  public boolean isIntegral() {
    return integral;
  }

  /** Returns true if the numeric value has no fractional part, whatever its kind. */
  public boolean isWhole() {
    return integral || (doubleValue == Math.rint(doubleValue) && !Double.isInfinite(doubleValue));
  }

  public long longValue() {
    return integral ? longValue : (long) doubleValue;
  }

  public double doubleValue() {
    return doubleValue;
  }

  public NumberValue add(NumberValue other) {
    if (integral && other.integral) {
      return of(longValue + other.longValue);
    }
    return of(doubleValue + other.doubleValue);
  }

  public NumberValue subtract(NumberValue other) {
    if (integral && other.integral) {
      return of(longValue - other.longValue);
    }
    return of(doubleValue - other.doubleValue);
  }

  public NumberValue multiply(NumberValue other) {
    if (integral && other.integral) {
      return of(longValue * other.longValue);
    }
    return of(doubleValue * other.doubleValue);
  }

  /** Divides by a non-zero number. Integral division stays integral only when exact. */
  public NumberValue divide(NumberValue other) {
    if (other.doubleValue == 0.0) {
      throw new ArithmeticException("division by zero");
    }
    if (integral && other.integral && longValue % other.longValue == 0) {
      return of(longValue / other.longValue);
    }
    return of(doubleValue / other.doubleValue);
  }

  public NumberValue negate() {
    return integral ? of(-longValue) : of(-doubleValue);
  }

  public int compareTo(NumberValue other) {
    if (integral && other.integral) {
      return Long.compare(longValue, other.longValue);
    }
    return Double.compare(doubleValue, other.doubleValue);
  }

  @Override
  public String describe() {
    return render();
  }

  @Override
  public String render() {
    if (integral) {
      return Long.toString(longValue);
    }
    if (isWhole() && Math.abs(doubleValue) < 1e15) {
      return Long.toString((long) doubleValue);
    }
    return Double.toString(doubleValue);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumberValue)) {
      return false;
    }
    NumberValue other = (NumberValue) o;
    if (integral && other.integral) {
      return longValue == other.longValue;
    }
    return Double.compare(doubleValue, other.doubleValue) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(doubleValue);
  }
}
