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
import com.google.proxcanon.expression.TreeFormat;

/**
 * A node of the problem graph: an objective term or a constraint.
 *
 * <p>Identity is per instance; two functions wrapping equal expressions are distinct nodes.
 */
public final class Function {
  private Expression expression;
  private final boolean constraint;

  public Function(Expression expression, boolean constraint) {
    this.expression = expression;
    this.constraint = constraint;
  }

  public Expression getExpression() {
    return expression;
  }

  /** Returns true for constraints, false for objective terms. */
  public boolean isConstraint() {
    return constraint;
  }

  // Only the graph rewrites expressions, together with the matching edges.
  void setExpression(Expression expression) {
    this.expression = expression;
  }

  @Override
  public String toString() {
    return (constraint ? "constraint " : "objective ") + TreeFormat.formatNode(expression);
  }
}
