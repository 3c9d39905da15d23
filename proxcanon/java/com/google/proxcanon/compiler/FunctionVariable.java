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

import java.util.Collections;
import java.util.List;

/**
 * An edge of the problem graph, relating a function to a variable it references.
 *
 * <p>Holds every occurrence of the variable in the function's expression.
 */
public final class FunctionVariable {
  private final Function function;
  private final String variable;
  private final List<VariableInstance> instances;

  public FunctionVariable(Function function, String variable, List<VariableInstance> instances) {
    if (instances.isEmpty()) {
      throw new IllegalArgumentException("edge without instances for variable " + variable);
    }
    this.function = function;
    this.variable = variable;
    this.instances = Collections.unmodifiableList(instances);
  }

  public Function getFunction() {
    return function;
  }

  /** Returns the variable id. */
  public String getVariable() {
    return variable;
  }

  public List<VariableInstance> getInstances() {
    return instances;
  }

  /** Returns true if some occurrence goes through a linear operator other than a scalar. */
  public boolean hasLinearOperators() {
    for (VariableInstance instance : instances) {
      if (!instance.isScalar()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return variable + " <- " + function;
  }
}
