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

import java.util.Locale;

/** Optimization direction of the objective. */
public enum Direction {
  MINIMIZE,
  MAXIMIZE;

  /**
   * Parses exactly {@code "minimize"} or {@code "maximize"}.
   *
   * @throws ModelException.InvalidDirection otherwise
   */
  public static Direction parse(String direction) {
    if ("minimize".equals(direction)) {
      return MINIMIZE;
    }
    if ("maximize".equals(direction)) {
      return MAXIMIZE;
    }
    throw new ModelException.InvalidDirection("Direction.parse", String.valueOf(direction));
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
