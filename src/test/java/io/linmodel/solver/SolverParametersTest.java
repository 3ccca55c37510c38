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

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.junit.jupiter.api.Test;

public final class SolverParametersTest {
  @Test
  public void testSolverParameters_defaults() {
    final SolverParameters parameters = SolverParameters.newBuilder().build();

    assertThat(parameters.getBinary()).isEqualTo(SolverParameters.DEFAULT_BINARY);
    assertThat(parameters.getTimeLimit()).isNull();
    assertThat(parameters.getProcessTimeout()).isNull();
    assertThat(parameters.getEnableOutput()).isFalse();
    assertThat(parameters.commandLine("m.lp", "s.sol"))
        .containsExactly("highs", "m.lp", "--solution_file", "s.sol")
        .inOrder();
  }

  @Test
  public void testSolverParameters_commandLine() {
    final SolverParameters parameters =
        SolverParameters.newBuilder()
            .setBinary("/opt/highs/bin/highs")
            .setTimeLimit(Duration.ofMillis(1500))
            .addExtraOption("--presolve")
            .addExtraOption("off")
            .build();

    assertThat(parameters.commandLine("m.lp", "s.sol"))
        .containsExactly(
            "/opt/highs/bin/highs",
            "m.lp",
            "--solution_file",
            "s.sol",
            "--time_limit",
            "1.5",
            "--presolve",
            "off")
        .inOrder();
  }

  @Test
  public void testSolverParameters_toBuilder() {
    final SolverParameters parameters =
        SolverParameters.newBuilder()
            .setBinary("highs-1.7")
            .setProcessTimeout(Duration.ofSeconds(30))
            .setEnableOutput(true)
            .addExtraOptions(ImmutableList.of("--parallel", "on"))
            .build();

    final SolverParameters copy =
        parameters.toBuilder().setTimeLimit(Duration.ofSeconds(2)).build();

    assertThat(copy.getBinary()).isEqualTo("highs-1.7");
    assertThat(copy.getProcessTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(copy.getEnableOutput()).isTrue();
    assertThat(copy.getExtraOptions()).containsExactly("--parallel", "on").inOrder();
    assertThat(copy.getTimeLimit()).isEqualTo(Duration.ofSeconds(2));
    assertThat(parameters.getTimeLimit()).isNull();
  }

  @Test
  public void testSolverParameters_validation() {
    final SolverParameters.Builder builder = SolverParameters.newBuilder();

    assertThrows(IllegalArgumentException.class, () -> builder.setBinary(""));
    assertThrows(IllegalArgumentException.class, () -> builder.setBinary(null));
    assertThrows(
        IllegalArgumentException.class, () -> builder.setTimeLimit(Duration.ofSeconds(-1)));
    assertThrows(
        IllegalArgumentException.class, () -> builder.setProcessTimeout(Duration.ofMillis(-5)));
    assertThrows(NullPointerException.class, () -> builder.addExtraOption(null));
  }

  @Test
  public void testSolverParameters_binaryFromSystemProperty() {
    final String previous = System.getProperty(SolverParameters.BINARY_PROPERTY);
    System.setProperty(SolverParameters.BINARY_PROPERTY, "/usr/local/bin/highs");
    try {
      assertThat(SolverParameters.fromEnvironment().getBinary()).isEqualTo("/usr/local/bin/highs");
    } finally {
      if (previous == null) {
        System.clearProperty(SolverParameters.BINARY_PROPERTY);
      } else {
        System.setProperty(SolverParameters.BINARY_PROPERTY, previous);
      }
    }
  }
}
