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

/** The "no bound" marker. It evaluates to itself and supports no arithmetic. */
public final class UnboundedValue extends Value {
  static final UnboundedValue INSTANCE = new UnboundedValue();

  private UnboundedValue() {}

  @Override
  public Kind kind() {
    return Kind.UNBOUNDED;
  }

  @Override
  public String describe() {
    return "unbounded";
  }

  @Override
  public String render() {
    return "unbounded";
  }
}
