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

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.CodedOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Helpers to inspect and rewrite expression trees. */
public final class ExpressionUtil {
  /** Number of hash bytes kept in a fingerprint. */
  public static final int FINGERPRINT_BYTES = 16;

  private ExpressionUtil() {}

  /**
   * Returns a content fingerprint of an expression.
   *
   * <p>The expression is serialized deterministically (map entries sorted by key) and hashed with
   * SHA-256. Structurally identical expressions always get the same fingerprint, independently of
   * how or where they were built.
   */
  public static String fingerprint(Expression expr) {
    return BaseEncoding.base16()
        .lowerCase()
        .encode(fingerprintHash(expr).asBytes(), 0, FINGERPRINT_BYTES);
  }

  private static HashCode fingerprintHash(Expression expr) {
    byte[] bytes = new byte[expr.getSerializedSize()];
    CodedOutputStream output = CodedOutputStream.newInstance(bytes);
    output.useDeterministicSerialization();
    try {
      expr.writeTo(output);
      output.checkNoSpaceLeft();
    } catch (IOException e) {
      throw new IllegalStateException("Serializing to a byte array threw an IOException", e);
    }
    return Hashing.sha256().hashBytes(bytes);
  }

  /** Returns the only argument of {@code expr}. */
  public static Expression onlyArg(Expression expr) {
    if (expr.getArgCount() != 1) {
      throw new ExpressionException(
          "onlyArg", "wrong number of args: " + expr.getArgCount(), expr);
    }
    return expr.getArg(0);
  }

  /** Returns the total number of entries of {@code expr}. */
  public static int dim(Expression expr) {
    return dim(expr, 0) * dim(expr, 1);
  }

  /** Returns the number of rows (index 0) or columns (index 1) of {@code expr}. */
  public static int dim(Expression expr, int index) {
    if (expr.getSize().getDimCount() != 2) {
      throw new ExpressionException(
          "dim", "wrong number of dimensions: " + expr.getSize().getDimCount(), expr);
    }
    return expr.getSize().getDim(index);
  }

  /** Returns {@code "rows x cols"}. */
  public static String dimsString(Expression expr) {
    if (expr.getSize().getDimCount() != 2) {
      return "?";
    }
    return expr.getSize().getDim(0) + " x " + expr.getSize().getDim(1);
  }

  /** Returns true if the expression is known to be affine or constant. */
  public static boolean isAffine(Expression expr) {
    Curvature.Type type = expr.getCurvature().getCurvatureType();
    return type == Curvature.Type.AFFINE || type == Curvature.Type.CONSTANT;
  }

  public static boolean isConstant(Expression expr) {
    return expr.getCurvature().getCurvatureType() == Curvature.Type.CONSTANT;
  }

  /** Returns true if a VARIABLE leaf appears anywhere in {@code expr}. */
  public static boolean containsVariable(Expression expr) {
    if (expr.getExpressionType() == Expression.Type.VARIABLE) {
      return true;
    }
    for (Expression arg : expr.getArgList()) {
      if (containsVariable(arg)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the id of a VARIABLE leaf. */
  public static String variableId(Expression expr) {
    if (expr.getExpressionType() != Expression.Type.VARIABLE) {
      throw new IllegalArgumentException(
          "expected a variable, got " + expr.getExpressionType());
    }
    return expr.getVariable().getVariableId();
  }

  /**
   * Returns a copy of {@code expr} in which every occurrence of variable {@code oldId} is replaced
   * by {@code newVar}.
   *
   * <p>Nodes on the path to a replaced leaf are rebuilt, their affine properties renamed
   * accordingly. Untouched subtrees are shared with the input, which is never modified.
   */
  public static Expression replaceVariable(Expression expr, String oldId, Expression newVar) {
    if (expr.getExpressionType() == Expression.Type.VARIABLE) {
      return oldId.equals(expr.getVariable().getVariableId()) ? newVar : expr;
    }

    boolean changed = false;
    List<Expression> args = new ArrayList<>(expr.getArgCount());
    for (Expression arg : expr.getArgList()) {
      Expression replaced = replaceVariable(arg, oldId, newVar);
      changed |= replaced != arg;
      args.add(replaced);
    }
    if (!changed) {
      return expr;
    }

    Expression.Builder builder = expr.toBuilder().clearArg().addAllArg(args);
    if (builder.getAffineProps().containsLinearMaps(oldId)) {
      String newId = variableId(newVar);
      AffineProperties.Builder props = builder.getAffinePropsBuilder();
      boolean scalar = props.getLinearMapsOrThrow(oldId).getScalar();
      if (props.containsLinearMaps(newId)) {
        scalar &= props.getLinearMapsOrThrow(newId).getScalar();
      }
      props
          .removeLinearMaps(oldId)
          .putLinearMaps(newId, LinearMapProperties.newBuilder().setScalar(scalar).build());
    }
    return builder.build();
  }
}
