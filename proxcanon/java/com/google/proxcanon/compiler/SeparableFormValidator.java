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

package com.google.proxcanon.compiler;

/**
 * Checks that a graph is in separable form: every objective term has a proximal operator known to
 * the backend and every variable is referenced by exactly one objective term.
 */
public final class SeparableFormValidator {
  private SeparableFormValidator() {}

  /**
   * Validates {@code graph}.
   *
   * @throws IllegalStateException on the first violation found
   */
  public static void validate(ProblemGraph graph) {
    for (Function f : graph.objTerms()) {
      if (!ProxAnalysis.hasProxDescriptor(f.getExpression())) {
        throw new IllegalStateException("objective term without prox function: " + f);
      }
    }
    for (String variable : graph.variables()) {
      int numTerms = graph.objectiveEdgesByVariable(variable).size();
      if (numTerms != 1) {
        throw new IllegalStateException(
            "variable " + variable + " referenced by " + numTerms + " objective terms");
      }
    }
  }
}
