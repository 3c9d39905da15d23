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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when expressions are combined with incompatible shapes or when a node gets the
 * wrong number of arguments for its kind.
 *
 * <p>Carries the offending expressions. Any such error aborts the whole compilation.
 */
public class ExpressionException extends RuntimeException {
  private final List<Expression> expressions;

  public ExpressionException(String methodName, String msg, Expression... expressions) {
    super(methodName + ": " + msg);
    this.expressions = Collections.unmodifiableList(Arrays.asList(expressions));
  }

  /** Returns the expressions that caused the error. */
  public List<Expression> getExpressions() {
    return expressions;
  }
}
