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
import com.google.proxcanon.expression.Size;

/** One syntactic occurrence of a variable inside a function's expression. */
public final class VariableInstance {
  private final Expression expression;
  private final boolean scalar;

  public VariableInstance(Expression expression, boolean scalar) {
    this.expression = expression;
    this.scalar = scalar;
  }

  /** Returns the VARIABLE leaf. */
  public Expression getExpression() {
    return expression;
  }

  public Size getSize() {
    return expression.getSize();
  }

  /** Returns true if the occurrence is only multiplied by scalars. */
  public boolean isScalar() {
    return scalar;
  }

  /** Returns the same occurrence with {@code variable} as its leaf. */
  VariableInstance withExpression(Expression variable) {
    return new VariableInstance(variable, scalar);
  }
}
