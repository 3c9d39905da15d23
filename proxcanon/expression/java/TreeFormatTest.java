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

package com.google.proxcanon.expression;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public final class TreeFormatTest {
  @Test
  public void testFormatExpression() {
    final Expression x = Expressions.variable(3, 1, "x");
    final Expression f =
        Expressions.proxFunction(
            ProxFunction.Type.SUM_SQUARE, Expressions.add(x, Expressions.constant(3, 1, 1.0)));

    assertThat(TreeFormat.formatExpression(f))
        .isEqualTo(
            "prox_function(SUM_SQUARE) 1 x 1\n"
                + "  add 3 x 1\n"
                + "    variable(x) 3 x 1\n"
                + "    constant(1.0) 3 x 1\n");
  }

  @Test
  public void testFormatProblem() {
    final Expression y = Expressions.variable(1, 1, "y");
    final Problem problem =
        Problem.newBuilder()
            .setObjective(Expressions.proxFunction(ProxFunction.Type.NORM_1, y))
            .addConstraint(Expressions.leqConstraint(y, Expressions.scalarConstant(5.0)))
            .build();

    assertThat(TreeFormat.formatProblem(problem))
        .isEqualTo(
            "objective:\n"
                + "  prox_function(NORM_1) 1 x 1\n"
                + "    variable(y) 1 x 1\n"
                + "constraints:\n"
                + "  indicator(NON_NEGATIVE) 1 x 1\n"
                + "    add 1 x 1\n"
                + "      constant(5.0) 1 x 1\n"
                + "      negate 1 x 1\n"
                + "        variable(y) 1 x 1\n");
  }
}
