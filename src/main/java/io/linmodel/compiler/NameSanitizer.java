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

package io.linmodel.compiler;

import com.google.common.base.CharMatcher;
import java.util.regex.Pattern;

/**
 * Turns arbitrary text into an identifier accepted by the LP file format.
 *
 * <p>Sanitized names use only letters, digits and {@code _!"#$%&(),.;?@'~}, never start with a
 * digit or a period, never look like a number in exponent notation, and are at most {@value
 * #MAX_LENGTH} characters long. Sanitizing is idempotent.
 */
public final class NameSanitizer {
  /** Longest identifier the LP format accepts. */
  public static final int MAX_LENGTH = 255;

  private static final CharMatcher ALLOWED =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_!\"#$%&(),.;?@'~"))
          .precomputed();

  private static final CharMatcher UNDERSCORE = CharMatcher.is('_');

  // "e1" would be read as the number 1e1.
  private static final Pattern EXPONENT_PREFIX = Pattern.compile("^[eE][0-9].*");

  private NameSanitizer() {}

  public static String sanitize(String name) {
    String result = UNDERSCORE.trimFrom(ALLOWED.negate().replaceFrom(name, '_'));
    if (result.isEmpty()) {
      return "v";
    }
    char first = result.charAt(0);
    if ((first >= '0' && first <= '9')
        || first == '.'
        || EXPONENT_PREFIX.matcher(result).matches()) {
      result = "v_" + result;
    }
    if (result.length() > MAX_LENGTH) {
      result = result.substring(0, MAX_LENGTH);
    }
    return UNDERSCORE.trimTrailingFrom(result);
  }

  /** Returns true if {@code name} is already a valid identifier. */
  public static boolean isValid(String name) {
    return sanitize(name).equals(name);
  }
}
