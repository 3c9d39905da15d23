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
import com.google.proxcanon.expression.ExpressionUtil;
import com.google.proxcanon.expression.Problem;
import com.google.proxcanon.expression.TreeFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites a problem into separable sum-of-prox form.
 *
 * <p>The problem is loaded in a {@link ProblemGraph}, each transform is applied once in a fixed
 * order, and the problem is read back from the graph. By default the transforms are
 * {@link SeparateObjectiveTerms} then {@link AddNullProx}; the optional transforms enabled in the
 * parameters run before them.
 *
 * <p>An {@link com.google.proxcanon.expression.ExpressionException} raised while rewriting aborts
 * the transformation and nothing is returned.
 */
public final class ProblemTransformer {
  private static final Logger logger = Logger.getLogger(ProblemTransformer.class.getName());

  /** Main construction of the ProblemTransformer class. */
  public ProblemTransformer() {
    this.parameters = CompilerParameters.newBuilder();
  }

  /** Returns the builder of the parameters, to modify them in place. */
  public CompilerParameters.Builder getParameters() {
    return parameters;
  }

  /** Replaces the parameters. */
  public void setParameters(CompilerParameters parameters) {
    this.parameters.clear().mergeFrom(parameters);
  }

  /** Returns the transforms in the order they are applied. */
  public List<GraphTransform> transforms() {
    List<GraphTransform> transforms = new ArrayList<>();
    if (parameters.getCombineAffineFunctions()) {
      transforms.add(new CombineAffineFunctions());
    }
    if (parameters.getMoveEqualityIndicators()) {
      transforms.add(new MoveEqualityIndicators());
    }
    transforms.add(new SeparateObjectiveTerms());
    transforms.add(new AddNullProx());
    return transforms;
  }

  /**
   * Returns {@code problem} in separable form. A problem without variables is returned as is.
   *
   * @throws IllegalStateException if verification is enabled and the result is not separable
   */
  public Problem transform(Problem problem) {
    if (!hasVariables(problem)) {
      logger.fine("No variables, problem left unchanged");
      return problem;
    }

    ProblemGraph graph = ProblemGraph.fromProblem(problem);
    for (GraphTransform transform : transforms()) {
      transform.apply(graph);
      logger.fine(
          transform.name() + ": " + graph.objTerms().size() + " objective terms, "
              + graph.functions().size() + " functions, " + graph.variables().size()
              + " variables");
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(transform.name() + ":\n" + TreeFormat.formatProblem(graph.toProblem()));
      }
    }

    if (parameters.getVerifySeparableForm()) {
      SeparableFormValidator.validate(graph);
    }
    return graph.toProblem();
  }

  private static boolean hasVariables(Problem problem) {
    if (ExpressionUtil.containsVariable(problem.getObjective())) {
      return true;
    }
    for (Expression constraint : problem.getConstraintList()) {
      if (ExpressionUtil.containsVariable(constraint)) {
        return true;
      }
    }
    return false;
  }

  private final CompilerParameters.Builder parameters;
}
