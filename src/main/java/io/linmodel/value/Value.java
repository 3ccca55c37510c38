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
 * A constant value produced by evaluating an expression against bindings and model parameters.
 *
 * <p>Values form a closed set of kinds. Code consuming a value switches on {@link #kind()} rather
 * than probing the runtime class.
 */
public abstract class Value {
  /** The kind of a value. */
  public enum Kind {
    NUMBER,
    TEXT,
    SEQUENCE,
    MAPPING,
    UNBOUNDED
  }

  Value() {}

  /** Returns the kind of this value. */
  public abstract Kind kind();

  /** Returns a short description of the value, used in error messages. */
  public abstract String describe();

  /**
   * Returns the text used when the value is substituted into a name or description template.
   *
   * <p>Integral numbers render without a fraction so that {@code x({i})} with {@code i = 1} yields
   * {@code x(1)}.
   */
  public abstract String render();

  public boolean isNumber() {
    return kind() == Kind.NUMBER;
  }

  public boolean isUnbounded() {
    return kind() == Kind.UNBOUNDED;
  }

  /** Returns this value as a number, or throws {@link ClassCastException} naming the real kind. */
  public NumberValue asNumber() {
    throw new ClassCastException("expected a number, got " + describe());
  }

  /** Returns this value as a text, or throws {@link ClassCastException} naming the real kind. */
  public TextValue asText() {
    throw new ClassCastException("expected a text, got " + describe());
  }

  /** Returns this value as a sequence, or throws {@link ClassCastException}. */
  public SequenceValue asSequence() {
    throw new ClassCastException("expected a sequence, got " + describe());
  }

  /** Returns this value as a mapping, or throws {@link ClassCastException} naming the real kind. */
  public MappingValue asMapping() {
    throw new ClassCastException("expected a mapping, got " + describe());
  }

  @Override
  public String toString() {
    return describe();
  }
}
