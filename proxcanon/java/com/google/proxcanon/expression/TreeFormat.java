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

/** Renders expressions and problems as indented trees, one node per line. */
public final class TreeFormat {
  private static final String INDENT = "  ";

  private TreeFormat() {}

  /** Returns {@code expr} as a tree, e.g. {@code "add 1 x 1\n  variable(x) 1 x 1\n..."}. */
  public static String formatExpression(Expression expr) {
    StringBuilder out = new StringBuilder();
    append(out, expr, 0);
    return out.toString();
  }

  /** Returns the objective and each constraint of {@code problem} as trees. */
  public static String formatProblem(Problem problem) {
    StringBuilder out = new StringBuilder();
    out.append("objective:\n");
    append(out, problem.getObjective(), 1);
    out.append("constraints:\n");
    for (Expression constraint : problem.getConstraintList()) {
      append(out, constraint, 1);
    }
    return out.toString();
  }

  /** Returns the one-line description of a node, without its children. */
  public static String formatNode(Expression expr) {
    StringBuilder out = new StringBuilder();
    out.append(expr.getExpressionType().name().toLowerCase());
    String payload = payload(expr);
    if (!payload.isEmpty()) {
      out.append('(').append(payload).append(')');
    }
    out.append(' ').append(ExpressionUtil.dimsString(expr));
    return out.toString();
  }

  private static void append(StringBuilder out, Expression expr, int depth) {
    for (int i = 0; i < depth; ++i) {
      out.append(INDENT);
    }
    out.append(formatNode(expr)).append('\n');
    for (Expression arg : expr.getArgList()) {
      append(out, arg, depth + 1);
    }
  }

  private static String payload(Expression expr) {
    switch (expr.getExpressionType()) {
      case VARIABLE:
        return expr.getVariable().getVariableId();
      case CONSTANT:
        if (expr.getConstant().getDataLocation().isEmpty()) {
          return String.valueOf(expr.getConstant().getScalar());
        }
        return expr.getConstant().getDataLocation();
      case INDICATOR:
        return expr.getCone().getConeType().name();
      case PROX_FUNCTION:
        return expr.getProxFunction().getProxFunctionType().name();
      case LINEAR_MAP:
        return expr.getLinearMap().getLinearMapType().name();
      case INDEX:
        StringBuilder keys = new StringBuilder();
        for (Slice key : expr.getKeyList()) {
          if (keys.length() > 0) {
            keys.append(", ");
          }
          keys.append(key.getStart()).append(':').append(key.getStop());
        }
        return keys.toString();
      case NORM_P:
      case POWER:
        return "p=" + expr.getP();
      case NORM_PQ:
        return "p=" + expr.getP() + ", q=" + expr.getQ();
      case SUM_LARGEST:
        return "k=" + expr.getK();
      default:
        return "";
    }
  }
}
