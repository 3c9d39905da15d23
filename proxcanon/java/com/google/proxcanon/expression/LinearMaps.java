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

import java.util.List;
import java.util.Map;

/**
 * Linear-map scalarity of variable occurrences.
 *
 * <p>An occurrence of a variable is a pure scalar multiple when every operator between it and the
 * enclosing function only scales it: additions, negations, products with 1x1 constants and SCALAR
 * linear maps.
 */
public final class LinearMaps {
  private LinearMaps() {}

  /**
   * Returns true if {@code parent} keeps its {@code argIndex}-th argument a pure scalar multiple.
   */
  public static boolean preservesScalar(ExpressionOrBuilder parent, int argIndex) {
    Expression.Type type = parent.getExpressionType();
    List<Expression> args = parent.getArgList();
    switch (type) {
      case ADD:
      case NEGATE:
        return true;
      case MULTIPLY:
      case MULTIPLY_ELEMENTWISE:
        for (int i = 0; i < args.size(); ++i) {
          if (i != argIndex && !isScalarConstant(args.get(i))) {
            return false;
          }
        }
        return true;
      case INDEX:
      case TRANSPOSE:
      case RESHAPE:
      case SUM:
      case HSTACK:
      case VSTACK:
        return false;
      case LINEAR_MAP:
        return parent.getLinearMap().getLinearMapType() == LinearMapOperator.Type.SCALAR;
      case INDICATOR:
      case PROX_FUNCTION:
      case ZERO:
      case NORM_P:
      case NORM_PQ:
      case POWER:
      case ABS:
      case SUM_LARGEST:
        // Functions apply no linear operator to their arguments.
        return true;
      case VARIABLE:
      case CONSTANT:
        throw new IllegalArgumentException(type + " has no arguments");
      case UNKNOWN:
      case UNRECOGNIZED:
      default:
        throw new IllegalArgumentException("unknown expression type: " + type);
    }
  }

  /**
   * Derives the affine properties of {@code node} from those of its arguments.
   *
   * <p>A variable stays scalar only if all its occurrences do.
   */
  public static AffineProperties combine(ExpressionOrBuilder node) {
    List<Expression> args = node.getArgList();
    AffineProperties.Builder props = AffineProperties.newBuilder();
    for (int i = 0; i < args.size(); ++i) {
      boolean preserved = preservesScalar(node, i);
      for (Map.Entry<String, LinearMapProperties> entry :
          args.get(i).getAffineProps().getLinearMapsMap().entrySet()) {
        boolean scalar = preserved && entry.getValue().getScalar();
        if (props.containsLinearMaps(entry.getKey())) {
          scalar &= props.getLinearMapsOrThrow(entry.getKey()).getScalar();
        }
        props.putLinearMaps(
            entry.getKey(), LinearMapProperties.newBuilder().setScalar(scalar).build());
      }
    }
    return props.build();
  }

  static boolean isScalarConstant(Expression expr) {
    return expr.getExpressionType() == Expression.Type.CONSTANT
        && expr.getSize().getDimCount() == 2
        && ExpressionUtil.dim(expr) == 1;
  }
}
