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

import static com.google.proxcanon.expression.ExpressionUtil.dim;

import com.google.proxcanon.expression.Expression;
import com.google.proxcanon.expression.ExpressionUtil;
import com.google.proxcanon.expression.Expressions;
import java.util.List;
import java.util.logging.Logger;

/**
 * Makes the objective separable: after this pass every variable is referenced by at most one
 * objective term.
 *
 * <p>For a variable shared by several objective terms, one occurrence is kept: the last term
 * referencing it without a linear operator, or the last term if all of them apply one. Every
 * other term gets a fresh copy of the variable, tied to the original by an equality constraint.
 * Constraints are left untouched.
 *
 * <p>Copies are named {@code separate:<variable>:<fingerprint of the term>}, so the same problem
 * always produces the same names.
 */
public final class SeparateObjectiveTerms implements GraphTransform {
  /** Prefix of the ids of the variables introduced by this pass. */
  public static final String COPY_PREFIX = "separate:";

  private static final Logger logger = Logger.getLogger(SeparateObjectiveTerms.class.getName());

  @Override
  public void apply(ProblemGraph graph) {
    for (String variable : graph.variables()) {
      List<FunctionVariable> edges = graph.objectiveEdgesByVariable(variable);
      if (edges.size() <= 1) {
        continue;
      }
      FunctionVariable primary = selectPrimary(edges);
      for (int i = edges.size() - 1; i >= 0; --i) {
        FunctionVariable edge = edges.get(i);
        if (edge != primary) {
          separate(graph, edge);
        }
      }
    }
  }

  /** Returns the edge that keeps the original variable. */
  static FunctionVariable selectPrimary(List<FunctionVariable> edges) {
    for (int i = edges.size() - 1; i >= 0; --i) {
      if (!edges.get(i).hasLinearOperators()) {
        return edges.get(i);
      }
    }
    return edges.get(edges.size() - 1);
  }

  private static void separate(ProblemGraph graph, FunctionVariable edge) {
    Expression oldVariable = edge.getInstances().get(0).getExpression();
    String copyId = uniqueCopyVariableId(graph, edge);
    Expression newVariable = Expressions.variable(dim(oldVariable, 0), dim(oldVariable, 1), copyId);

    graph.replaceVariable(edge, newVariable);
    graph.addFunction(
        new Function(
            Expressions.eqConstraint(oldVariable, newVariable), /* constraint= */ true));
    logger.fine("Separated " + edge.getVariable() + " as " + copyId);
  }

  // Identical terms sharing a variable would get the same copy; those are numbered.
  private static String uniqueCopyVariableId(ProblemGraph graph, FunctionVariable edge) {
    String base = copyVariableId(edge.getVariable(), edge.getFunction().getExpression());
    String copyId = base;
    for (int n = 1; graph.hasVariable(copyId); ++n) {
      copyId = base + ":" + n;
    }
    return copyId;
  }

  /** Returns the id of the copy of {@code variable} owned by the term {@code owner}. */
  public static String copyVariableId(String variable, Expression owner) {
    return COPY_PREFIX + variable + ":" + ExpressionUtil.fingerprint(owner);
  }

  /** Returns true if {@code variableId} names a copy introduced by this pass. */
  public static boolean isCopyVariable(String variableId) {
    return variableId.startsWith(COPY_PREFIX);
  }
}
