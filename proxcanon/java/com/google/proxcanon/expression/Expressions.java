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

import static com.google.proxcanon.expression.ExpressionUtil.dim;
import static com.google.proxcanon.expression.ExpressionUtil.dimsString;

import java.util.Arrays;
import java.util.List;

/**
 * Factory for expression nodes.
 *
 * <p>Every method checks the shapes of its arguments and throws {@link ExpressionException} when
 * they are incompatible. Affine nodes get their curvature and linear-map properties attached.
 */
public final class Expressions {
  private static final Monotonicity SIGNED =
      Monotonicity.newBuilder().setMonotonicityType(Monotonicity.Type.SIGNED).build();

  private Expressions() {}

  /** Returns a {@code rows x cols} size. */
  public static Size size(int rows, int cols) {
    return Size.newBuilder().addDim(rows).addDim(cols).build();
  }

  // Leaves.

  /** Creates a {@code rows x cols} variable. */
  public static Expression variable(int rows, int cols, String variableId) {
    return Expression.newBuilder()
        .setExpressionType(Expression.Type.VARIABLE)
        .setSize(size(rows, cols))
        .setVariable(Variable.newBuilder().setVariableId(variableId))
        .setCurvature(
            Curvature.newBuilder()
                .setCurvatureType(Curvature.Type.AFFINE)
                .setElementwise(true)
                .setScalarMultiple(true))
        .setAffineProps(
            AffineProperties.newBuilder()
                .putLinearMaps(
                    variableId, LinearMapProperties.newBuilder().setScalar(true).build()))
        .build();
  }

  /** Creates a 1x1 constant. */
  public static Expression scalarConstant(double scalar) {
    return constant(1, 1, scalar);
  }

  /** Creates a {@code rows x cols} constant with all entries equal to {@code scalar}. */
  public static Expression constant(int rows, int cols, double scalar) {
    return constant(
        rows,
        cols,
        Constant.newBuilder().setConstantType(Constant.Type.SCALAR).setScalar(scalar).build());
  }

  /** Creates a {@code rows x cols} constant backed by {@code constant}. */
  public static Expression constant(int rows, int cols, Constant constant) {
    return Expression.newBuilder()
        .setExpressionType(Expression.Type.CONSTANT)
        .setSize(size(rows, cols))
        .setConstant(constant)
        .setCurvature(Curvature.newBuilder().setCurvatureType(Curvature.Type.CONSTANT))
        .build();
  }

  // Affine operators.

  /** Returns the sum of {@code args}; 1x1 arguments are broadcast. */
  public static Expression add(Expression... args) {
    return add(Arrays.asList(args));
  }

  /** Same as above. */
  public static Expression add(List<Expression> args) {
    if (args.isEmpty()) {
      throw new ExpressionException("add", "adding null args");
    }
    Expression a = args.get(0);
    Size size = a.getSize();
    dim(a);
    for (int i = 1; i < args.size(); ++i) {
      Expression b = args.get(i);
      if (dim(b) == 1) {
        continue;
      }
      if (size.getDim(0) * size.getDim(1) == 1 || size.equals(b.getSize())) {
        size = b.getSize();
      } else {
        throw new ExpressionException(
            "add", "adding incompatible sizes " + dimsString(a) + " and " + dimsString(b), a, b);
      }
      a = b;
    }
    return affine(Expression.Type.ADD, args, size);
  }

  /** Returns the matrix product of {@code args}; 1x1 arguments act as scalars. */
  public static Expression multiply(Expression... args) {
    return multiply(Arrays.asList(args), /* elementwise= */ false);
  }

  /** Returns the elementwise product of {@code args}. */
  public static Expression multiplyElementwise(Expression... args) {
    return multiply(Arrays.asList(args), /* elementwise= */ true);
  }

  private static Expression multiply(List<Expression> args, boolean elementwise) {
    final String methodName = elementwise ? "multiplyElementwise" : "multiply";
    if (args.isEmpty()) {
      throw new ExpressionException(methodName, "multiplying null args");
    }
    Expression a = args.get(0);
    Size size = a.getSize();
    dim(a);
    for (int i = 1; i < args.size(); ++i) {
      Expression b = args.get(i);
      int rows = size.getDim(0);
      int cols = size.getDim(1);
      if (rows * cols == 1) {
        size = b.getSize();
      } else if (dim(b) == 1) {
        continue;
      } else if (!elementwise && cols == dim(b, 0)) {
        size = size(rows, dim(b, 1));
      } else if (elementwise && size.equals(b.getSize())) {
        continue;
      } else {
        throw new ExpressionException(
            methodName,
            "multiplying incompatible sizes " + dimsString(a) + " and " + dimsString(b),
            a,
            b);
      }
      a = b;
    }
    return affine(
        elementwise ? Expression.Type.MULTIPLY_ELEMENTWISE : Expression.Type.MULTIPLY, args, size);
  }

  /** Returns {@code -x}; {@code negate(negate(x))} is reduced to {@code x}. */
  public static Expression negate(Expression x) {
    if (x.getExpressionType() == Expression.Type.NEGATE) {
      return ExpressionUtil.onlyArg(x);
    }
    return affine(Expression.Type.NEGATE, Arrays.asList(x), x.getSize());
  }

  /** Returns the sum of all entries of {@code x}. */
  public static Expression sum(Expression x) {
    return affine(Expression.Type.SUM, Arrays.asList(x), size(1, 1));
  }

  public static Expression transpose(Expression x) {
    return affine(Expression.Type.TRANSPOSE, Arrays.asList(x), size(dim(x, 1), dim(x, 0)));
  }

  /** Returns the rows {@code [startRow, stopRow)} of {@code x}. */
  public static Expression index(Expression x, int startRow, int stopRow) {
    return index(x, startRow, stopRow, 0, dim(x, 1));
  }

  /** Returns the block {@code [startRow, stopRow) x [startCol, stopCol)} of {@code x}. */
  public static Expression index(
      Expression x, int startRow, int stopRow, int startCol, int stopCol) {
    if (startRow < 0 || stopRow > dim(x, 0) || startRow >= stopRow) {
      throw new ExpressionException(
          "index", "invalid row range [" + startRow + ", " + stopRow + ")", x);
    }
    if (startCol < 0 || stopCol > dim(x, 1) || startCol >= stopCol) {
      throw new ExpressionException(
          "index", "invalid column range [" + startCol + ", " + stopCol + ")", x);
    }
    Size size = size(stopRow - startRow, stopCol - startCol);
    return affine(Expression.Type.INDEX, Arrays.asList(x), size)
        .toBuilder()
        .addKey(Slice.newBuilder().setStart(startRow).setStop(stopRow).setStep(1))
        .addKey(Slice.newBuilder().setStart(startCol).setStop(stopCol).setStep(1))
        .build();
  }

  /** Reshapes {@code x} to {@code rows x cols}; two reshapes that undo each other cancel out. */
  public static Expression reshape(Expression x, int rows, int cols) {
    if (rows * cols != dim(x)) {
      throw new ExpressionException("reshape", "cant reshape to " + rows + " x " + cols, x);
    }
    if (x.getExpressionType() == Expression.Type.RESHAPE
        && dim(x.getArg(0), 0) == rows
        && dim(x.getArg(0), 1) == cols) {
      return x.getArg(0);
    }
    return affine(Expression.Type.RESHAPE, Arrays.asList(x), size(rows, cols))
        .toBuilder()
        .setSign(x.getSign())
        .build();
  }

  /** Concatenates {@code args} horizontally. */
  public static Expression hstack(Expression... args) {
    if (args.length == 0) {
      throw new ExpressionException("hstack", "stacking null args");
    }
    int rows = dim(args[0], 0);
    int cols = 0;
    for (Expression arg : args) {
      if (dim(arg, 0) != rows) {
        throw new ExpressionException("hstack", "stacking incompatible sizes", args[0], arg);
      }
      cols += dim(arg, 1);
    }
    return affine(Expression.Type.HSTACK, Arrays.asList(args), size(rows, cols));
  }

  /** Concatenates {@code args} vertically. */
  public static Expression vstack(Expression... args) {
    if (args.length == 0) {
      throw new ExpressionException("vstack", "stacking null args");
    }
    int rows = 0;
    int cols = dim(args[0], 1);
    for (Expression arg : args) {
      if (dim(arg, 1) != cols) {
        throw new ExpressionException("vstack", "stacking incompatible sizes", args[0], arg);
      }
      rows += dim(arg, 0);
    }
    return affine(Expression.Type.VSTACK, Arrays.asList(args), size(rows, cols));
  }

  /** Applies the operator {@code a} to the column vector {@code x}. */
  public static Expression linearMap(LinearMapOperator a, Expression x) {
    if (dim(x, 1) != 1) {
      throw new ExpressionException("linearMap", "applying linear map to non vector", x);
    }
    if (a.getN() != dim(x)) {
      throw new ExpressionException(
          "linearMap", "linear map has wrong size: " + a.getM() + " x " + a.getN(), x);
    }
    return affine(
        Expression.newBuilder()
            .setExpressionType(Expression.Type.LINEAR_MAP)
            .setSize(size(a.getM(), 1))
            .addArg(x)
            .setLinearMap(a));
  }

  // Functions.

  /** Returns the indicator of {@code args} belonging to the cone {@code coneType}. */
  public static Expression indicator(Cone.Type coneType, Expression... args) {
    int expected = coneType == Cone.Type.SECOND_ORDER ? 2 : 1;
    if (args.length != expected) {
      throw new ExpressionException(
          "indicator",
          coneType + " cone takes " + expected + " argument(s), got " + args.length,
          args);
    }
    return function(Expression.Type.INDICATOR, args)
        .setCone(Cone.newBuilder().setConeType(coneType))
        .build();
  }

  /** Returns the prox function of kind {@code type} applied to {@code args}. */
  public static Expression proxFunction(ProxFunction.Type type, Expression... args) {
    int expected = expectedProxArgs(type);
    if (args.length == 0 || (expected > 0 && args.length != expected)) {
      throw new ExpressionException(
          "proxFunction", type + " got wrong number of arguments: " + args.length, args);
    }
    return function(Expression.Type.PROX_FUNCTION, args)
        .setProxFunction(ProxFunction.newBuilder().setProxFunctionType(type))
        .build();
  }

  // Number of arguments required by a prox function kind, -1 if any positive count is allowed.
  private static int expectedProxArgs(ProxFunction.Type type) {
    switch (type) {
      case SECOND_ORDER_CONE:
        return 2;
      case MAX:
        return -1;
      default:
        return 1;
    }
  }

  /** Returns the function that is zero when {@code x == 0}. */
  public static Expression zero(Expression x) {
    return function(Expression.Type.ZERO, x).build();
  }

  public static Expression normP(Expression x, double p) {
    return function(Expression.Type.NORM_P, x).setP(p).build();
  }

  public static Expression normPq(Expression x, double p, double q) {
    return function(Expression.Type.NORM_PQ, x).setP(p).setQ(q).build();
  }

  /** Elementwise power. */
  public static Expression power(Expression x, double p) {
    return function(Expression.Type.POWER, x).setSize(x.getSize()).setP(p).build();
  }

  /** Elementwise absolute value. */
  public static Expression absVal(Expression x) {
    return function(Expression.Type.ABS, x).setSize(x.getSize()).addArgMonotonicity(SIGNED).build();
  }

  /** Sum of the {@code k} largest entries. */
  public static Expression sumLargest(Expression x, int k) {
    if (k <= 0 || k > dim(x)) {
      throw new ExpressionException("sumLargest", "invalid k: " + k, x);
    }
    return function(Expression.Type.SUM_LARGEST, x).setK(k).build();
  }

  // Constraints.

  /** Returns the indicator of {@code a == b}. */
  public static Expression eqConstraint(Expression a, Expression b) {
    return indicator(Cone.Type.ZERO, add(a, negate(b)));
  }

  /** Returns the indicator of {@code a <= b}. */
  public static Expression leqConstraint(Expression a, Expression b) {
    return indicator(Cone.Type.NON_NEGATIVE, add(b, negate(a)));
  }

  /** Returns the indicator of {@code ||x||_2 <= t}. */
  public static Expression socConstraint(Expression t, Expression x) {
    return indicator(Cone.Type.SECOND_ORDER, t, x);
  }

  /** Returns the indicator of {@code b - a} being positive semidefinite. */
  public static Expression psdConstraint(Expression a, Expression b) {
    return indicator(Cone.Type.SEMIDEFINITE, add(b, negate(a)));
  }

  // Internal helpers.

  private static Expression.Builder function(Expression.Type type, Expression... args) {
    return Expression.newBuilder()
        .setExpressionType(type)
        .setSize(size(1, 1))
        .addAllArg(Arrays.asList(args));
  }

  private static Expression affine(Expression.Type type, List<Expression> args, Size size) {
    return affine(Expression.newBuilder().setExpressionType(type).setSize(size).addAllArg(args));
  }

  private static Expression affine(Expression.Builder node) {
    Curvature.Type curvature = affineCurvature(node.getExpressionType(), node.getArgList());
    if (curvature != Curvature.Type.UNKNOWN) {
      node.setCurvature(Curvature.newBuilder().setCurvatureType(curvature));
      node.setAffineProps(LinearMaps.combine(node));
    }
    return node.build();
  }

  // CONSTANT if all args are constant, AFFINE if the node is affine in its args, UNKNOWN otherwise.
  private static Curvature.Type affineCurvature(Expression.Type type, List<Expression> args) {
    int numConstant = 0;
    for (Expression arg : args) {
      if (!ExpressionUtil.isAffine(arg)) {
        return Curvature.Type.UNKNOWN;
      }
      if (ExpressionUtil.isConstant(arg)) {
        numConstant++;
      }
    }
    if (numConstant == args.size()) {
      return Curvature.Type.CONSTANT;
    }
    boolean product =
        type == Expression.Type.MULTIPLY || type == Expression.Type.MULTIPLY_ELEMENTWISE;
    if (product && args.size() - numConstant > 1) {
      return Curvature.Type.UNKNOWN;
    }
    return Curvature.Type.AFFINE;
  }
}
