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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.proxcanon.expression.Cone;
import com.google.proxcanon.expression.Expression;
import com.google.proxcanon.expression.Expressions;
import com.google.proxcanon.expression.LinearMapOperator;
import com.google.proxcanon.expression.Problem;
import com.google.proxcanon.expression.ProxFunction;
import org.junit.jupiter.api.Test;

public final class MoveEqualityIndicatorsTest {
  private final Expression x = Expressions.variable(3, 1, "x");
  private final Expression y = Expressions.variable(3, 1, "y");

  private static ProblemGraph graph(Expression... terms) {
    Problem.Builder problem = Problem.newBuilder();
    if (terms.length == 1) {
      problem.setObjective(terms[0]);
    } else {
      problem.setObjective(Expressions.add(terms));
    }
    return ProblemGraph.fromProblem(problem.build());
  }

  private Expression equality(Expression a) {
    return Expressions.proxFunction(
        ProxFunction.Type.ZERO, Expressions.add(a, Expressions.negate(y)));
  }

  @Test
  public void testMove_scalarEquality() {
    final Expression f = Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, x);
    final Expression eq = equality(x);
    final ProblemGraph graph = graph(f, eq);

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.objTerms()).hasSize(1);
    assertThat(graph.objTerms().get(0).getExpression()).isEqualTo(f);
    assertThat(graph.toProblem().getConstraintList())
        .containsExactly(Expressions.eqConstraint(x, y));
  }

  @Test
  public void testMove_sharedVariableBehindLinearMap() {
    final Expression f = Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, x);
    final Expression eq = equality(Expressions.multiply(Expressions.constant(3, 3, 1.0), x));
    final ProblemGraph graph = graph(f, eq);
    final Problem before = graph.toProblem();

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.toProblem()).isEqualTo(before);
  }

  @Test
  public void testMove_unsharedVariableBehindLinearMap() {
    final Expression f = Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, y);
    final Expression eq = equality(Expressions.multiply(Expressions.constant(3, 3, 1.0), x));
    final ProblemGraph graph = graph(f, eq);

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.objTerms()).hasSize(1);
    assertThat(graph.toProblem().getConstraintCount()).isEqualTo(1);
  }

  @Test
  public void testMove_sharedVariableBehindScalarMap() {
    final LinearMapOperator twice =
        LinearMapOperator.newBuilder()
            .setLinearMapType(LinearMapOperator.Type.SCALAR)
            .setM(3)
            .setN(3)
            .setScalar(2.0)
            .build();
    final Expression f = Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, x);
    final Expression eq = equality(Expressions.linearMap(twice, x));
    final ProblemGraph graph = graph(f, eq);

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.objTerms()).hasSize(1);
    assertThat(graph.toProblem().getConstraintList())
        .containsExactly(Expressions.indicator(Cone.Type.ZERO, eq.getArg(0)));
  }

  @Test
  public void testMove_singleTermKept() {
    final ProblemGraph graph = graph(equality(x));
    final Problem before = graph.toProblem();

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.toProblem()).isEqualTo(before);
  }

  @Test
  public void testMove_lastTermKept() {
    final ProblemGraph graph = graph(equality(x), equality(Expressions.variable(3, 1, "z")));

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.objTerms()).hasSize(1);
    assertThat(graph.toProblem().getConstraintCount()).isEqualTo(1);
  }

  @Test
  public void testMove_otherTermsIgnored() {
    final ProblemGraph graph =
        graph(
            Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, x),
            Expressions.proxFunction(ProxFunction.Type.NORM_1, y));
    final Problem before = graph.toProblem();

    new MoveEqualityIndicators().apply(graph);

    assertThat(graph.toProblem()).isEqualTo(before);
  }

  @Test
  public void testMove_malformedEqualityFails() {
    final Expression malformed =
        Expression.newBuilder()
            .setExpressionType(Expression.Type.PROX_FUNCTION)
            .setSize(Expressions.size(1, 1))
            .setProxFunction(
                ProxFunction.newBuilder().setProxFunctionType(ProxFunction.Type.ZERO))
            .addArg(x)
            .addArg(y)
            .build();
    final ProblemGraph graph =
        graph(Expressions.proxFunction(ProxFunction.Type.SUM_SQUARE, x), malformed);

    assertThrows(IllegalStateException.class, () -> new MoveEqualityIndicators().apply(graph));
  }
}
