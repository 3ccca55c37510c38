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

package io.linmodel.solver;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the solution file written by HiGHS with {@code --solution_file}.
 *
 * <pre>
 * Model status
 * Optimal
 *
 * # Primal solution values
 * Feasible
 * Objective 3
 * # Columns 2
 * x 1
 * y 2
 * # Rows 1
 * capacity 3
 *
 * # Dual solution values
 * Feasible
 * # Columns 2
 * ...
 * # Basis
 * ...
 * </pre>
 *
 * <p>Blank lines are ignored. Everything from {@code # Basis} on is ignored.
 */
public final class SolutionParser {
  private static final Logger logger = Logger.getLogger(SolutionParser.class.getName());

  private static final String MODEL_STATUS = "Model status";
  private static final String PRIMAL = "# Primal solution values";
  private static final String DUAL = "# Dual solution values";
  private static final String OBJECTIVE = "Objective";
  private static final String COLUMNS = "# Columns";
  private static final String ROWS = "# Rows";
  private static final String BASIS = "# Basis";

  private final List<String> lines = new ArrayList<>();
  private final List<Integer> lineNumbers = new ArrayList<>();
  private int pos;

  private SolutionParser(String contents) {
    int lineNumber = 0;
    for (String line : Splitter.onPattern("\r?\n").split(contents)) {
      lineNumber++;
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
        lineNumbers.add(lineNumber);
      }
    }
  }

  /**
   * Parses the contents of a solution file.
   *
   * @throws ModelSolver.MalformedResult if the contents do not follow the solution file layout
   */
  public static Solution parse(String contents) {
    return new SolutionParser(contents).parse();
  }

  private Solution parse() {
    if (lines.isEmpty() || !lines.get(0).startsWith(MODEL_STATUS)) {
      throw malformed("expected '" + MODEL_STATUS + "'");
    }
    pos = 1;
    Solution.Builder solution = Solution.newBuilder(next("the model status"));
    boolean dual = false;
    while (pos < lines.size()) {
      String line = lines.get(pos);
      if (line.startsWith(BASIS)) {
        break;
      } else if (line.equals(PRIMAL)) {
        pos++;
        solution.setPrimalFeasibility(next("the primal feasibility"));
        dual = false;
      } else if (line.equals(DUAL)) {
        pos++;
        if (pos < lines.size() && !lines.get(pos).startsWith("#")) {
          pos++;
        }
        dual = true;
      } else if (line.startsWith(OBJECTIVE)) {
        String value = line.substring(OBJECTIVE.length()).trim();
        pos++;
        if (value.isEmpty()) {
          value = next("the objective value");
        }
        solution.setObjectiveValue(parseDouble(value, pos - 1));
      } else if (line.startsWith(COLUMNS)) {
        Map<String, Double> values = section(COLUMNS);
        if (dual) {
          solution.setReducedCosts(values);
        } else {
          solution.setVariableValues(values);
        }
      } else if (line.startsWith(ROWS)) {
        Map<String, Double> values = section(ROWS);
        if (dual) {
          solution.setDualValues(values);
        } else {
          solution.setActivities(values);
        }
      } else {
        logger.fine("Ignoring solution line " + lineNumbers.get(pos) + ": " + line);
        pos++;
      }
    }
    return solution.build();
  }

  /** Returns the current line and moves past it. */
  private String next(String what) {
    if (pos >= lines.size()) {
      throw new ModelSolver.MalformedResult(
          "SolutionParser.parse", "unexpected end of file, expected " + what);
    }
    return lines.get(pos++);
  }

  /** Reads a {@code # Columns n} or {@code # Rows n} header and its n lines. */
  private Map<String, Double> section(String header) {
    String count = lines.get(pos).substring(header.length()).trim();
    int size;
    try {
      size = Integer.parseInt(count);
    } catch (NumberFormatException e) {
      throw malformed("invalid count '" + count + "' in " + header);
    }
    if (size < 0) {
      throw malformed("negative count in " + header);
    }
    pos++;
    Map<String, Double> values = new LinkedHashMap<>();
    for (int i = 0; i < size; ++i) {
      String line = next(size + " lines after '" + header + " " + size + "'");
      int separator = lastWhitespace(line);
      if (separator < 0) {
        throw malformedAt(pos - 1, "expected 'name value', got '" + line + "'");
      }
      String name = line.substring(0, separator).trim();
      double value = parseDouble(line.substring(separator + 1), pos - 1);
      if (values.put(name, value) != null) {
        throw malformedAt(pos - 1, "duplicate name '" + name + "'");
      }
    }
    return values;
  }

  private static int lastWhitespace(String line) {
    for (int i = line.length() - 1; i >= 0; --i) {
      if (Character.isWhitespace(line.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private double parseDouble(String text, int index) {
    String value = text.trim();
    switch (value) {
      case "inf":
      case "+inf":
        return Double.POSITIVE_INFINITY;
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw malformedAt(index, "invalid number '" + value + "'");
    }
  }

  private ModelSolver.MalformedResult malformed(String msg) {
    return malformedAt(Math.min(pos, lines.size() - 1), msg);
  }

  private ModelSolver.MalformedResult malformedAt(int index, String msg) {
    int lineNumber = index >= 0 && index < lineNumbers.size() ? lineNumbers.get(index) : 0;
    return new ModelSolver.MalformedResult(
        "SolutionParser.parse", "line " + lineNumber + ": " + msg);
  }
}
