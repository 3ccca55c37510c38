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

import com.google.common.base.Joiner;
import io.linmodel.value.Value;
import java.util.ArrayList;
import java.util.List;

/** Name and description templates with {@code {symbol}} placeholders. */
public final class Templates {
  private Templates() {}

  /**
   * Replaces every {@code {symbol}} of {@code template} by the rendered value of the symbol. A
   * brace without a matching closing brace is kept as is.
   *
   * @throws io.linmodel.modelbuilder.ModelException.UndefinedSymbol if a placeholder names a symbol
   *     that is neither bound nor a parameter
   */
  public static String interpolate(String template, CompileContext context) {
    StringBuilder result = new StringBuilder(template.length());
    int pos = 0;
    while (pos < template.length()) {
      int open = template.indexOf('{', pos);
      int close = open < 0 ? -1 : template.indexOf('}', open + 1);
      if (close < 0) {
        result.append(template, pos, template.length());
        break;
      }
      result.append(template, pos, open);
      String symbol = template.substring(open + 1, close).trim();
      result.append(context.resolve("Templates.interpolate", symbol).render());
      pos = close + 1;
    }
    return result.toString();
  }

  /** Returns {@code name(v1,v2,...)}, or {@code name} when there is no value. */
  public static String defaultName(String name, List<Value> values) {
    if (values.isEmpty()) {
      return name;
    }
    List<String> rendered = new ArrayList<>(values.size());
    for (Value value : values) {
      rendered.add(value.render());
    }
    return name + "(" + Joiner.on(',').join(rendered) + ")";
  }
}
