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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.linmodel.lp.LpWriter;
import io.linmodel.modelbuilder.Model;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Solves a {@link Model} with the HiGHS command line solver.
 *
 * <p>Each call to {@link #solve} writes the model to a fresh temporary directory, runs
 * {@code <binary> model.lp --solution_file solution.sol} and parses the solution file. The
 * directory is removed before returning.
 */
public final class ModelSolver {
  private static final Logger logger = Logger.getLogger(ModelSolver.class.getName());

  private static final String MODEL_FILE = "model.lp";
  private static final String SOLUTION_FILE = "solution.sol";
  private static final String OUTPUT_FILE = "solver.log";
  private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);

  /** Base class of the errors raised while running the solver. */
  public static class ModelSolverException extends RuntimeException {
    public ModelSolverException(String methodName, String msg) {
      // Call constructor of parent Exception
      super(methodName + ": " + msg);
    }

    public ModelSolverException(String methodName, String msg, Throwable cause) {
      super(methodName + ": " + msg, cause);
    }
  }

  /** Exception thrown when the solver binary cannot be started. */
  public static class SolverUnavailable extends ModelSolverException {
    private final String binary;

    public SolverUnavailable(String methodName, String binary, Throwable cause) {
      super(methodName, "cannot run solver '" + binary + "'", cause);
      this.binary = binary;
    }

    public String getBinary() {
      return binary;
    }
  }

  /** Exception thrown when the solver fails, times out or writes no solution file. */
  public static class SolverFailure extends ModelSolverException {
    private final int exitCode;
    private final String modelText;
    private final String solverOutput;

    public SolverFailure(
        String methodName, String msg, int exitCode, String modelText, String solverOutput) {
      this(methodName, msg, exitCode, modelText, solverOutput, null);
    }

    public SolverFailure(
        String methodName,
        String msg,
        int exitCode,
        String modelText,
        String solverOutput,
        Throwable cause) {
      super(
          methodName,
          msg + "\n--- model ---\n" + modelText + "--- solver output ---\n" + solverOutput,
          cause);
      this.exitCode = exitCode;
      this.modelText = modelText;
      this.solverOutput = solverOutput;
    }

    /** Returns the exit code of the solver, or -1 if it did not exit on its own. */
    public int getExitCode() {
      return exitCode;
    }

    public String getModelText() {
      return modelText;
    }

    public String getSolverOutput() {
      return solverOutput;
    }
  }

  /** Exception thrown when the solution file does not follow the expected layout. */
  public static class MalformedResult extends ModelSolverException {
    public MalformedResult(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  private final SolverParameters parameters;

  /** Creates a solver configured by {@link SolverParameters#fromEnvironment()}. */
  public ModelSolver() {
    this(SolverParameters.fromEnvironment());
  }

  /** Creates the solver with the supplied parameters. */
  public ModelSolver(SolverParameters parameters) {
    this.parameters = checkNotNull(parameters);
  }

  public SolverParameters getParameters() {
    return parameters;
  }

  /** Returns whether the solver binary can be run. */
  public boolean solverIsSupported() {
    ProcessBuilder builder =
        new ProcessBuilder(parameters.getBinary(), "--version")
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD);
    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      logger.fine("Solver " + parameters.getBinary() + " is not available: " + e.getMessage());
      return false;
    }
    try {
      if (!process.waitFor(VERSION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        return false;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      return false;
    }
    return process.exitValue() == 0;
  }

  /**
   * Solves the given model and returns the parsed solution.
   *
   * @throws SolverUnavailable if the solver binary cannot be started
   * @throws SolverFailure if the solver exits with an error, times out or writes no solution
   * @throws MalformedResult if the solution file cannot be parsed
   */
  public Solution solve(Model model) {
    String methodName = "ModelSolver.solve";
    String modelText = LpWriter.exportToLpString(model);
    Path directory;
    try {
      directory = Files.createTempDirectory("linmodel");
    } catch (IOException e) {
      throw new SolverFailure(
          methodName, "cannot create a temporary directory", -1, modelText, "", e);
    }
    try {
      return solveIn(directory, modelText);
    } finally {
      cleanUp(directory);
    }
  }

  private Solution solveIn(Path directory, String modelText) {
    String methodName = "ModelSolver.solve";
    Path modelFile = directory.resolve(MODEL_FILE);
    Path solutionFile = directory.resolve(SOLUTION_FILE);
    Path outputFile = directory.resolve(OUTPUT_FILE);
    try {
      Files.write(modelFile, modelText.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SolverFailure(methodName, "cannot write " + modelFile, -1, modelText, "", e);
    }

    ImmutableList<String> command =
        parameters.commandLine(modelFile.toString(), solutionFile.toString());
    logger.info("Running " + Joiner.on(' ').join(command));
    ProcessBuilder builder =
        new ProcessBuilder(command)
            .directory(directory.toFile())
            .redirectErrorStream(true)
            .redirectOutput(outputFile.toFile());
    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new SolverUnavailable(methodName, parameters.getBinary(), e);
    }

    int exitCode;
    try {
      exitCode = waitFor(process);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new SolverFailure(
          methodName, "interrupted while waiting for the solver", -1, modelText, "", e);
    }
    String output = readOutput(outputFile);
    if (parameters.getEnableOutput()) {
      for (String line : Splitter.onPattern("\r?\n").omitEmptyStrings().split(output)) {
        logger.info(line);
      }
    }
    if (exitCode < 0) {
      throw new SolverFailure(
          methodName,
          "the solver did not finish within " + parameters.getProcessTimeout(),
          exitCode,
          modelText,
          output);
    }
    if (exitCode != 0) {
      throw new SolverFailure(
          methodName, "the solver exited with code " + exitCode, exitCode, modelText, output);
    }
    if (!Files.isRegularFile(solutionFile)) {
      throw new SolverFailure(
          methodName, "the solver wrote no solution file", exitCode, modelText, output);
    }

    String contents;
    try {
      contents = new String(Files.readAllBytes(solutionFile), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SolverFailure(
          methodName, "cannot read " + solutionFile, exitCode, modelText, output, e);
    }
    Solution solution = SolutionParser.parse(contents);
    logger.info("Solver finished: " + solution);
    return solution;
  }

  /** Waits for the process and returns its exit code, or -1 if it was killed on timeout. */
  private int waitFor(Process process) throws InterruptedException {
    Duration timeout = parameters.getProcessTimeout();
    if (timeout == null) {
      return process.waitFor();
    }
    if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      process.waitFor();
      return -1;
    }
    return process.exitValue();
  }

  private static String readOutput(Path outputFile) {
    if (!Files.exists(outputFile)) {
      return "";
    }
    try {
      return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.warning("Cannot read solver output " + outputFile + ": " + e.getMessage());
      return "";
    }
  }

  private static void cleanUp(Path directory) {
    File[] files = directory.toFile().listFiles();
    List<File> entries = files == null ? ImmutableList.of() : ImmutableList.copyOf(files);
    for (File file : entries) {
      delete(file.toPath());
    }
    delete(directory);
  }

  private static void delete(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.warning("Cannot delete " + path + ": " + e.getMessage());
    }
  }
}
