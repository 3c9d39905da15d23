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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests fingerprinting and variable substitution. */
public final class ExpressionUtilTest {
  private static Expression term(String variableId) {
    return Expressions.proxFunction(
        ProxFunction.Type.SUM_SQUARE,
        Expressions.add(
            Expressions.variable(3, 1, variableId),
            Expressions.negate(Expressions.variable(3, 1, "y"))));
  }

  @Test
  public void testFingerprint_deterministic() {
    final String first = ExpressionUtil.fingerprint(term("x"));
    final String second = ExpressionUtil.fingerprint(term("x"));

    assertThat(first).isEqualTo(second);
    assertThat(first).hasLength(2 * ExpressionUtil.FINGERPRINT_BYTES);
    assertThat(first).matches("[0-9a-f]+");
    assertThat(ExpressionUtil.fingerprint(term("z"))).isNotEqualTo(first);
  }

  @Test
  public void testFingerprint_ignoresMapInsertionOrder() {
    final LinearMapProperties scalar = LinearMapProperties.newBuilder().setScalar(true).build();
    final Expression ab =
        Expression.newBuilder()
            .setExpressionType(Expression.Type.ADD)
            .setAffineProps(
                AffineProperties.newBuilder()
                    .putLinearMaps("a", scalar)
                    .putLinearMaps("b", scalar))
            .build();
    final Expression ba =
        Expression.newBuilder()
            .setExpressionType(Expression.Type.ADD)
            .setAffineProps(
                AffineProperties.newBuilder()
                    .putLinearMaps("b", scalar)
                    .putLinearMaps("a", scalar))
            .build();

    assertThat(ExpressionUtil.fingerprint(ab)).isEqualTo(ExpressionUtil.fingerprint(ba));
  }

  @Test
  public void testReplaceVariable() {
    final Expression original = term("x");
    final Expression copy = Expressions.variable(3, 1, "x2");
    final Expression replaced = ExpressionUtil.replaceVariable(original, "x", copy);

    assertThat(replaced).isEqualTo(term("x2"));
    // The input is left untouched.
    assertThat(original).isEqualTo(term("x"));
    final AffineProperties props = replaced.getArg(0).getAffineProps();
    assertThat(props.getLinearMapsMap()).containsKey("x2");
    assertThat(props.getLinearMapsMap()).doesNotContainKey("x");
    assertThat(props.getLinearMapsOrThrow("x2").getScalar()).isTrue();
  }

  @Test
  public void testReplaceVariable_absentVariable() {
    final Expression original = term("x");

    assertThat(
            ExpressionUtil.replaceVariable(original, "w", Expressions.variable(3, 1, "w2")))
        .isSameInstanceAs(original);
  }

  @Test
  public void testReplaceVariable_allOccurrences() {
    final Expression x = Expressions.variable(1, 1, "x");
    final Expression original =
        Expressions.proxFunction(
            ProxFunction.Type.NORM_1,
            Expressions.add(x, Expressions.multiply(Expressions.scalarConstant(2.0), x)));
    final Expression replaced =
        ExpressionUtil.replaceVariable(original, "x", Expressions.variable(1, 1, "x2"));

    assertThat(ExpressionUtil.containsVariable(replaced)).isTrue();
    assertThat(replaced.getArg(0).getArg(0).getVariable().getVariableId()).isEqualTo("x2");
    assertThat(replaced.getArg(0).getArg(1).getArg(1).getVariable().getVariableId())
        .isEqualTo("x2");
  }

  @Test
  public void testOnlyArg() {
    final Expression x = Expressions.variable(3, 1, "x");

    assertThat(ExpressionUtil.onlyArg(Expressions.negate(x))).isEqualTo(x);
    assertThrows(
        ExpressionException.class,
        () -> ExpressionUtil.onlyArg(Expressions.add(x, Expressions.variable(3, 1, "y"))));
  }

  @Test
  public void testDim() {
    final Expression x = Expressions.variable(3, 2, "x");

    assertThat(ExpressionUtil.dim(x)).isEqualTo(6);
    assertThat(ExpressionUtil.dim(x, 1)).isEqualTo(2);
    assertThat(ExpressionUtil.dimsString(x)).isEqualTo("3 x 2");
    assertThrows(
        ExpressionException.class, () -> ExpressionUtil.dim(Expression.getDefaultInstance()));
  }

  @Test
  public void testContainsVariable() {
    assertThat(ExpressionUtil.containsVariable(term("x"))).isTrue();
    assertThat(
            ExpressionUtil.containsVariable(
                Expressions.add(Expressions.scalarConstant(1.0), Expressions.scalarConstant(2.0))))
        .isFalse();
  }
}
