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

/** Status of a solve, as reported by the solver's {@code Model status} line. */
public enum SolveStatus {
  OPTIMAL,
  INFEASIBLE,
  UNBOUNDED,
  INFEASIBLE_OR_UNBOUNDED,
  TIME_LIMIT,
  ITERATION_LIMIT,
  MODEL_EMPTY,
  UNKNOWN_STATUS;

  /** Maps a HiGHS model status line to a status. Unrecognized lines map to UNKNOWN_STATUS. */
  public static SolveStatus fromHighs(String status) {
    switch (status.trim()) {
      case "Optimal":
        return OPTIMAL;
      case "Infeasible":
        return INFEASIBLE;
      case "Unbounded":
        return UNBOUNDED;
      case "Primal infeasible or unbounded":
        return INFEASIBLE_OR_UNBOUNDED;
      case "Time limit reached":
        return TIME_LIMIT;
      case "Iteration limit reached":
        return ITERATION_LIMIT;
      case "Empty":
        return MODEL_EMPTY;
      default:
        return UNKNOWN_STATUS;
    }
  }

  /** Returns true if the solver reports a proven optimum. */
  public boolean isOptimal() {
    return this == OPTIMAL;
  }
}
