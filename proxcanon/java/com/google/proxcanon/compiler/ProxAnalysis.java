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
import com.google.proxcanon.expression.LinearMapProperties;
import com.google.proxcanon.expression.ProxFunction;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Structural queries on objective terms shared by the transforms. */
public final class ProxAnalysis {
  private ProxAnalysis() {}

  /**
   * Returns true if {@code f} is an equality indicator that can be treated as a constraint without
   * interfering with the proximal operators of the other objective terms.
   *
   * <p>That is the case when {@code f} is a ZERO prox function and, for every variable it touches,
   * either {@code f} is the only objective term referencing it or its argument depends on it
   * through a scalar multiple only.
   *
   * @throws IllegalStateException if a ZERO prox function does not have exactly one argument, or
   *     its argument lacks the linear map of one of its variables
   */
  public static boolean isProxFriendlyConstraint(ProblemGraph graph, Function f) {
    Expression expr = f.getExpression();
    if (expr.getExpressionType() != Expression.Type.PROX_FUNCTION
        || expr.getProxFunction().getProxFunctionType() != ProxFunction.Type.ZERO) {
      return false;
    }
    if (expr.getArgCount() != 1) {
      throw new IllegalStateException(
          "ZERO prox function with " + expr.getArgCount() + " arguments: " + f);
    }

    Expression arg = expr.getArg(0);
    for (FunctionVariable edge : graph.edgesByFunction(f)) {
      String variable = edge.getVariable();
      if (graph.objectiveEdgesByVariable(variable).size() <= 1) {
        continue;
      }
      LinearMapProperties props = arg.getAffineProps().getLinearMapsMap().get(variable);
      if (props == null) {
        throw new IllegalStateException("no linear map for " + variable + " in " + f);
      }
      if (!props.getScalar()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the objective term other than {@code f} sharing the most variables with it, or null if
   * no other term shares any. Ties go to the first term in graph order.
   */
  public static Function maxOverlapFunction(ProblemGraph graph, Function f) {
    Set<String> variablesF = variables(graph, f);
    Function best = null;
    int bestOverlap = 0;
    for (Function g : graph.objTerms()) {
      if (g == f) {
        continue;
      }
      Set<String> overlap = variables(graph, g);
      overlap.retainAll(variablesF);
      if (overlap.size() > bestOverlap) {
        best = g;
        bestOverlap = overlap.size();
      }
    }
    return best;
  }

  /** Returns the ids of the variables referenced by {@code f}. */
  public static Set<String> variables(ProblemGraph graph, Function f) {
    List<FunctionVariable> edges = graph.edgesByFunction(f);
    Set<String> variables = new HashSet<>();
    for (FunctionVariable edge : edges) {
      variables.add(edge.getVariable());
    }
    return variables;
  }

  /** Returns true if the backend recognizes a proximal operator for {@code expr}. */
  public static boolean hasProxDescriptor(Expression expr) {
    switch (expr.getExpressionType()) {
      case ADD:
        return expr.getArgCount() > 0 && hasProxDescriptor(expr.getArg(0));
      case MULTIPLY:
        return expr.getArgCount() > 1 && hasProxDescriptor(expr.getArg(1));
      case PROX_FUNCTION:
        ProxFunction.Type type = expr.getProxFunction().getProxFunctionType();
        return type != ProxFunction.Type.UNKNOWN && type != ProxFunction.Type.UNRECOGNIZED;
      case INDICATOR:
        return true;
      default:
        return false;
    }
  }

  /** Returns true if {@code f} is an AFFINE prox function. */
  public static boolean isAffineTerm(Function f) {
    Expression expr = f.getExpression();
    return expr.getExpressionType() == Expression.Type.PROX_FUNCTION
        && expr.getProxFunction().getProxFunctionType() == ProxFunction.Type.AFFINE;
  }
}
