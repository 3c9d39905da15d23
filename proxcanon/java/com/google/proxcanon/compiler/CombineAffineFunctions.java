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

import com.google.proxcanon.expression.Expressions;
import java.util.logging.Logger;

/**
 * Merges each AFFINE objective term into the objective term sharing the most variables with it.
 *
 * <p>Not part of the default pipeline: merged terms may share variables again, so it must run
 * before {@link SeparateObjectiveTerms}.
 */
public final class CombineAffineFunctions implements GraphTransform {
  private static final Logger logger = Logger.getLogger(CombineAffineFunctions.class.getName());

  @Override
  public void apply(ProblemGraph graph) {
    for (Function f : graph.objTerms()) {
      // Already merged into an earlier term.
      if (!graph.hasFunction(f)) {
        continue;
      }
      if (!ProxAnalysis.isAffineTerm(f) || graph.edgesByFunction(f).isEmpty()) {
        continue;
      }
      Function g = ProxAnalysis.maxOverlapFunction(graph, f);
      if (g == null) {
        continue;
      }

      graph.removeFunction(f);
      graph.removeFunction(g);
      // Non-affine term first, it carries the prox function of the sum.
      graph.addFunction(
          new Function(
              Expressions.add(g.getExpression(), f.getExpression()), /* constraint= */ false));
      logger.fine("Combined " + f + " into " + g);
    }
  }
}
