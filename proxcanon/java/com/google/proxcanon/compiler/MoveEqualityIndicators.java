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

import com.google.proxcanon.expression.Cone;
import com.google.proxcanon.expression.Expressions;
import java.util.logging.Logger;

/**
 * Moves prox-friendly equality indicators from the objective to the constraints.
 *
 * <p>See {@link ProxAnalysis#isProxFriendlyConstraint}. A lone objective term is never moved.
 * Not part of the default pipeline; it must run before {@link SeparateObjectiveTerms}.
 */
public final class MoveEqualityIndicators implements GraphTransform {
  private static final Logger logger = Logger.getLogger(MoveEqualityIndicators.class.getName());

  @Override
  public void apply(ProblemGraph graph) {
    for (Function f : graph.objTerms()) {
      if (graph.objTerms().size() <= 1) {
        return;
      }
      if (!ProxAnalysis.isProxFriendlyConstraint(graph, f)) {
        continue;
      }
      graph.removeFunction(f);
      graph.addFunction(
          new Function(
              Expressions.indicator(Cone.Type.ZERO, f.getExpression().getArg(0)),
              /* constraint= */ true));
      logger.fine("Moved " + f + " to constraints");
    }
  }
}
