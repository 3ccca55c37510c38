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

import static com.google.common.base.Preconditions.checkNotNull;

/** A text value, typically an identifier used as an index or a mapping key. */
public final class TextValue extends Value {
  private final String text;

  public TextValue(String text) {
    this.text = checkNotNull(text);
  }

  @Override
  public Kind kind() {
    return Kind.TEXT;
  }

  @Override
  public TextValue asText() {
    return this;
  }

  public String text() {
    return text;
  }

  @Override
  public String describe() {
    return '"' + text + '"';
  }

  @Override
  public String render() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TextValue && ((TextValue) o).text.equals(text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }
}
