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

import com.google.proxcanon.expression.Expression;
import com.google.proxcanon.expression.Expressions;
import com.google.proxcanon.expression.ProxFunction;
import java.util.logging.Logger;

/**
 * Adds an {@code f(x) = 0} objective term for every variable appearing in constraints only, so
 * that each variable gets a proximal update.
 */
public final class AddNullProx implements GraphTransform {
  private static final Logger logger = Logger.getLogger(AddNullProx.class.getName());

  @Override
  public void apply(ProblemGraph graph) {
    for (String variable : graph.variables()) {
      if (!graph.objectiveEdgesByVariable(variable).isEmpty()) {
        continue;
      }
      Expression variableExpr =
          graph.edgesByVariable(variable).get(0).getInstances().get(0).getExpression();
      graph.addFunction(
          new Function(
              Expressions.proxFunction(ProxFunction.Type.CONSTANT, variableExpr),
              /* constraint= */ false));
      logger.fine("Added null prox for " + variable);
    }
  }
}
