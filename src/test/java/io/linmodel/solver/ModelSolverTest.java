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

import io.linmodel.expr.Expr;
import io.linmodel.lp.LpWriter;
import io.linmodel.modelbuilder.Direction;
import io.linmodel.modelbuilder.Model;
import io.linmodel.modelbuilder.ModelBuilder;
import io.linmodel.modelbuilder.VariableType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs {@link ModelSolver} against shell scripts standing in for the solver binary. */
@EnabledOnOs({OS.LINUX, OS.MAC})
public final class ModelSolverTest {
  private static final String SOLUTION =
      "Model status\\n"
          + "Optimal\\n"
          + "\\n"
          + "# Primal solution values\\n"
          + "Feasible\\n"
          + "Objective 10\\n"
          + "# Columns 1\\n"
          + "x 10\\n"
          + "# Rows 1\\n"
          + "limit 10\\n";

  @TempDir Path directory;

  private Model model;

  @BeforeEach
  public void setUp() {
    final ModelBuilder builder = new ModelBuilder();
    Model m = builder.declareVariable(Model.empty(), "x", VariableType.CONTINUOUS, 0.0, null);
    m = builder.declareConstraint(m, Expr.le(Expr.ref("x"), Expr.constant(10)), "limit");
    model = builder.setObjective(m, Expr.ref("x"), Direction.MAXIMIZE);
  }

  /** Writes an executable script; {@code $1} is the model file and {@code $3} the solution file. */
  private String script(String body) throws IOException {
    final Path script = directory.resolve("fake-highs.sh");
    Files.write(script, ("#!/bin/sh\n" + body + "\n").getBytes(StandardCharsets.UTF_8));
    assertThat(script.toFile().setExecutable(true)).isTrue();
    return script.toString();
  }

  private static ModelSolver solver(String binary) {
    return new ModelSolver(SolverParameters.newBuilder().setBinary(binary).build());
  }

  @Test
  public void testModelSolver_solve() throws Exception {
    final Path seen = directory.resolve("seen.lp");
    final String binary =
        script(
            "cp \"$1\" \"" + seen + "\"\n"
                + "test \"$2\" = --solution_file || exit 3\n"
                + "printf '" + SOLUTION + "' > \"$3\"\n"
                + "echo solving");

    final Solution solution = solver(binary).solve(model);

    assertThat(solution.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    assertThat(solution.getObjectiveValue()).isEqualTo(10.0);
    assertThat(solution.getValue("x")).isEqualTo(10.0);
    assertThat(solution.getActivity("limit")).isEqualTo(10.0);
    assertThat(new String(Files.readAllBytes(seen), StandardCharsets.UTF_8))
        .isEqualTo(LpWriter.exportToLpString(model));
  }

  @Test
  public void testModelSolver_removesWorkingDirectory() throws Exception {
    final Path recorded = directory.resolve("workdir.txt");
    final String binary =
        script(
            "dirname \"$1\" > \"" + recorded + "\"\n"
                + "printf '" + SOLUTION + "' > \"$3\"");

    solver(binary).solve(model);

    final String workdir =
        new String(Files.readAllBytes(recorded), StandardCharsets.UTF_8).trim();
    assertThat(Files.exists(Path.of(workdir))).isFalse();
  }

  @Test
  public void testModelSolver_passesTimeLimitAndOptions() throws Exception {
    final Path arguments = directory.resolve("arguments.txt");
    final String binary =
        script(
            "echo \"$4 $5 $6 $7\" > \"" + arguments + "\"\n"
                + "printf '" + SOLUTION + "' > \"$3\"");
    final ModelSolver solver =
        new ModelSolver(
            SolverParameters.newBuilder()
                .setBinary(binary)
                .setTimeLimit(Duration.ofSeconds(2))
                .addExtraOption("--presolve")
                .addExtraOption("off")
                .build());

    solver.solve(model);

    assertThat(new String(Files.readAllBytes(arguments), StandardCharsets.UTF_8).trim())
        .isEqualTo("--time_limit 2.0 --presolve off");
  }

  @Test
  public void testModelSolver_nonZeroExit() throws Exception {
    final String binary = script("echo 'license expired'\nexit 7");

    final ModelSolver.SolverFailure e =
        assertThrows(ModelSolver.SolverFailure.class, () -> solver(binary).solve(model));

    assertThat(e.getExitCode()).isEqualTo(7);
    assertThat(e.getModelText()).contains("limit: x <= 10");
    assertThat(e.getSolverOutput()).contains("license expired");
    assertThat(e).hasMessageThat().contains("--- model ---");
    assertThat(e).hasMessageThat().contains("exited with code 7");
  }

  @Test
  public void testModelSolver_missingSolutionFile() throws Exception {
    final String binary = script("exit 0");

    final ModelSolver.SolverFailure e =
        assertThrows(ModelSolver.SolverFailure.class, () -> solver(binary).solve(model));

    assertThat(e.getExitCode()).isEqualTo(0);
    assertThat(e).hasMessageThat().contains("no solution file");
  }

  @Test
  public void testModelSolver_malformedSolutionFile() throws Exception {
    final String binary = script("echo garbage > \"$3\"");

    assertThrows(ModelSolver.MalformedResult.class, () -> solver(binary).solve(model));
  }

  @Test
  public void testModelSolver_processTimeout() throws Exception {
    final String binary = script("exec sleep 30");
    final ModelSolver solver =
        new ModelSolver(
            SolverParameters.newBuilder()
                .setBinary(binary)
                .setProcessTimeout(Duration.ofMillis(200))
                .build());

    final ModelSolver.SolverFailure e =
        assertThrows(ModelSolver.SolverFailure.class, () -> solver.solve(model));

    assertThat(e.getExitCode()).isEqualTo(-1);
    assertThat(e).hasMessageThat().contains("did not finish within");
  }

  @Test
  public void testModelSolver_missingBinary() {
    final String binary = directory.resolve("no-such-solver").toString();

    final ModelSolver.SolverUnavailable e =
        assertThrows(ModelSolver.SolverUnavailable.class, () -> solver(binary).solve(model));

    assertThat(e.getBinary()).isEqualTo(binary);
    assertThat(solver(binary).solverIsSupported()).isFalse();
  }

  @Test
  public void testModelSolver_solverIsSupported() throws Exception {
    assertThat(solver(script("exit 0")).solverIsSupported()).isTrue();
    assertThat(solver(script("exit 1")).solverIsSupported()).isFalse();
  }
}
