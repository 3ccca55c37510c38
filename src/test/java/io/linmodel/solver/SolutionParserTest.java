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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Joiner;
import org.junit.jupiter.api.Test;

public final class SolutionParserTest {
  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static final String OPTIMAL =
      lines(
          "Model status",
          "Optimal",
          "",
          "# Primal solution values",
          "Feasible",
          "Objective 3.5",
          "# Columns 2",
          "x 1",
          "q(1,2) 2.5",
          "# Rows 1",
          "capacity 3.5",
          "",
          "# Dual solution values",
          "Feasible",
          "# Columns 2",
          "x 0",
          "q(1,2) -0.5",
          "# Rows 1",
          "capacity 1",
          "",
          "# Basis",
          "HiGHS v1",
          "Valid",
          "# Columns 2",
          "1 0");

  @Test
  public void testSolutionParser_optimal() {
    final Solution solution = SolutionParser.parse(OPTIMAL);

    assertThat(solution.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(solution.getModelStatus()).isEqualTo("Optimal");
    assertThat(solution.isFeasible()).isTrue();
    assertThat(solution.getObjectiveValue()).isEqualTo(3.5);
    assertThat(solution.getVariableValues().keySet()).containsExactly("x", "q(1,2)").inOrder();
    assertThat(solution.getValue("q(1,2)")).isEqualTo(2.5);
    assertThat(solution.getActivity("capacity")).isEqualTo(3.5);
    assertThat(solution.hasDualSolution()).isTrue();
    assertThat(solution.getReducedCost("q(1,2)")).isEqualTo(-0.5);
    assertThat(solution.getDualValue("capacity")).isEqualTo(1.0);
  }

  @Test
  public void testSolutionParser_objectiveOnNextLine() {
    final Solution solution =
        SolutionParser.parse(
            lines(
                "Model status",
                "Optimal",
                "# Primal solution values",
                "Feasible",
                "Objective",
                "-2",
                "# Columns 1",
                "x -2",
                "# Rows 0"));

    assertThat(solution.getObjectiveValue()).isEqualTo(-2.0);
    assertThat(solution.getValue("x")).isEqualTo(-2.0);
    assertThat(solution.getActivities()).isEmpty();
    assertThat(solution.hasDualSolution()).isFalse();
  }

  @Test
  public void testSolutionParser_infeasible() {
    final Solution solution =
        SolutionParser.parse(
            lines("Model status", "Infeasible", "", "# Primal solution values", "None"));

    assertThat(solution.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
    assertThat(solution.isFeasible()).isFalse();
    assertThat(solution.hasObjectiveValue()).isFalse();
    assertThat(solution.getVariableValues()).isEmpty();
    assertThrows(IllegalStateException.class, solution::getObjectiveValue);
  }

  @Test
  public void testSolutionParser_infiniteValues() {
    final Solution solution =
        SolutionParser.parse(
            lines(
                "Model status",
                "Unbounded",
                "# Primal solution values",
                "Infeasible",
                "Objective -inf",
                "# Columns 2",
                "x inf",
                "y +inf"));

    assertThat(solution.getStatus()).isEqualTo(SolveStatus.UNBOUNDED);
    assertThat(solution.getObjectiveValue()).isNegativeInfinity();
    assertThat(solution.getValue("x")).isPositiveInfinity();
    assertThat(solution.getValue("y")).isPositiveInfinity();
  }

  @Test
  public void testSolutionParser_windowsLineEndings() {
    final Solution solution =
        SolutionParser.parse(
            "Model status\r\nOptimal\r\n# Primal solution values\r\nFeasible\r\n"
                + "Objective 1\r\n# Columns 1\r\nx 1\r\n");

    assertThat(solution.getValue("x")).isEqualTo(1.0);
  }

  @Test
  public void testSolutionParser_ignoresBasis() {
    final Solution solution =
        SolutionParser.parse(
            lines(
                "Model status",
                "Optimal",
                "# Basis",
                "# Columns 1",
                "this line is not a column"));

    assertThat(solution.getVariableValues()).isEmpty();
  }

  @Test
  public void testSolutionParser_missingStatus() {
    assertThrows(ModelSolver.MalformedResult.class, () -> SolutionParser.parse(""));
    assertThrows(
        ModelSolver.MalformedResult.class,
        () -> SolutionParser.parse(lines("# Primal solution values", "Feasible")));
    assertThrows(
        ModelSolver.MalformedResult.class, () -> SolutionParser.parse(lines("Model status")));
  }

  @Test
  public void testSolutionParser_invalidNumber() {
    final ModelSolver.MalformedResult e =
        assertThrows(
            ModelSolver.MalformedResult.class,
            () ->
                SolutionParser.parse(
                    lines(
                        "Model status",
                        "Optimal",
                        "# Primal solution values",
                        "Feasible",
                        "# Columns 1",
                        "x one")));

    assertThat(e).hasMessageThat().startsWith("SolutionParser.parse: line 6:");
    assertThat(e).hasMessageThat().contains("'one'");
  }

  @Test
  public void testSolutionParser_duplicateName() {
    final ModelSolver.MalformedResult e =
        assertThrows(
            ModelSolver.MalformedResult.class,
            () ->
                SolutionParser.parse(
                    lines(
                        "Model status",
                        "Optimal",
                        "# Primal solution values",
                        "Feasible",
                        "# Columns 2",
                        "x 1",
                        "x 2")));

    assertThat(e).hasMessageThat().contains("duplicate name 'x'");
  }

  @Test
  public void testSolutionParser_truncatedSection() {
    final ModelSolver.MalformedResult e =
        assertThrows(
            ModelSolver.MalformedResult.class,
            () ->
                SolutionParser.parse(
                    lines(
                        "Model status",
                        "Optimal",
                        "# Primal solution values",
                        "Feasible",
                        "# Columns 3",
                        "x 1")));

    assertThat(e).hasMessageThat().contains("unexpected end of file");
  }

  @Test
  public void testSolutionParser_invalidCount() {
    assertThrows(
        ModelSolver.MalformedResult.class,
        () ->
            SolutionParser.parse(
                lines(
                    "Model status",
                    "Optimal",
                    "# Primal solution values",
                    "Feasible",
                    "# Columns two")));
    assertThrows(
        ModelSolver.MalformedResult.class,
        () -> SolutionParser.parse(lines("Model status", "Optimal", "# Rows -1")));
  }

  @Test
  public void testSolutionParser_missingValue() {
    assertThrows(
        ModelSolver.MalformedResult.class,
        () -> SolutionParser.parse(lines("Model status", "Optimal", "# Columns 1", "lonely")));
  }
}
