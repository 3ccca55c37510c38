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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;

/** Immutable settings of {@link ModelSolver}. */
public final class SolverParameters {
  /** System property naming the solver binary. */
  public static final String BINARY_PROPERTY = "linmodel.highs.binary";

  /** Environment variable naming the solver binary, read when the property is not set. */
  public static final String BINARY_ENVIRONMENT_VARIABLE = "HIGHS_BINARY";

  /** Binary used when neither the property nor the environment variable is set. */
  public static final String DEFAULT_BINARY = "highs";

  private final String binary;
  private final Duration timeLimit;
  private final Duration processTimeout;
  private final boolean enableOutput;
  private final ImmutableList<String> extraOptions;

  private SolverParameters(Builder builder) {
    this.binary = builder.binary;
    this.timeLimit = builder.timeLimit;
    this.processTimeout = builder.processTimeout;
    this.enableOutput = builder.enableOutput;
    this.extraOptions = builder.extraOptions.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns the default parameters, with the binary taken from the {@value #BINARY_PROPERTY}
   * system property, else the {@value #BINARY_ENVIRONMENT_VARIABLE} environment variable, else
   * {@value #DEFAULT_BINARY}.
   */
  public static SolverParameters fromEnvironment() {
    String binary = System.getProperty(BINARY_PROPERTY);
    if (Strings.isNullOrEmpty(binary)) {
      binary = System.getenv(BINARY_ENVIRONMENT_VARIABLE);
    }
    if (Strings.isNullOrEmpty(binary)) {
      binary = DEFAULT_BINARY;
    }
    return newBuilder().setBinary(binary).build();
  }

  /** Returns the path or name of the solver executable. */
  public String getBinary() {
    return binary;
  }

  /** Returns the time limit passed to the solver, or null. */
  public Duration getTimeLimit() {
    return timeLimit;
  }

  /** Returns how long to wait for the solver process before killing it, or null to wait. */
  public Duration getProcessTimeout() {
    return processTimeout;
  }

  /** Returns true if the solver output is logged. */
  public boolean getEnableOutput() {
    return enableOutput;
  }

  public ImmutableList<String> getExtraOptions() {
    return extraOptions;
  }

  /** Returns the solver command line for the given model and solution files. */
  public ImmutableList<String> commandLine(String modelFile, String solutionFile) {
    ImmutableList.Builder<String> command = ImmutableList.builder();
    command.add(binary, modelFile, "--solution_file", solutionFile);
    if (timeLimit != null) {
      command.add("--time_limit", Double.toString(timeLimit.toMillis() / 1000.0));
    }
    command.addAll(extraOptions);
    return command.build();
  }

  public Builder toBuilder() {
    return newBuilder()
        .setBinary(binary)
        .setTimeLimit(timeLimit)
        .setProcessTimeout(processTimeout)
        .setEnableOutput(enableOutput)
        .addExtraOptions(extraOptions);
  }

  @Override
  public String toString() {
    return "SolverParameters[binary="
        + binary
        + ", timeLimit="
        + timeLimit
        + ", processTimeout="
        + processTimeout
        + ", extraOptions="
        + extraOptions
        + "]";
  }

  /** Builder class for SolverParameters. */
  public static final class Builder {
    private String binary = DEFAULT_BINARY;
    private Duration timeLimit;
    private Duration processTimeout;
    private boolean enableOutput;
    private final ImmutableList.Builder<String> extraOptions = ImmutableList.builder();

    Builder() {}

    public Builder setBinary(String binary) {
      checkArgument(!Strings.isNullOrEmpty(binary), "the solver binary must not be empty");
      this.binary = binary;
      return this;
    }

    /** Sets the time limit of the solve, or null for none. */
    public Builder setTimeLimit(Duration timeLimit) {
      checkArgument(timeLimit == null || !timeLimit.isNegative(), "negative time limit");
      this.timeLimit = timeLimit;
      return this;
    }

    /** Sets how long to wait for the solver process, or null to wait until it exits. */
    public Builder setProcessTimeout(Duration processTimeout) {
      checkArgument(
          processTimeout == null || !processTimeout.isNegative(), "negative process timeout");
      this.processTimeout = processTimeout;
      return this;
    }

    /** Enables or disables logging of the solver output. */
    public Builder setEnableOutput(boolean enableOutput) {
      this.enableOutput = enableOutput;
      return this;
    }

    /** Adds options appended to the solver command line. */
    public Builder addExtraOptions(List<String> options) {
      for (String option : options) {
        extraOptions.add(checkNotNull(option));
      }
      return this;
    }

    public Builder addExtraOption(String option) {
      extraOptions.add(checkNotNull(option));
      return this;
    }

    public SolverParameters build() {
      return new SolverParameters(this);
    }
  }
}
