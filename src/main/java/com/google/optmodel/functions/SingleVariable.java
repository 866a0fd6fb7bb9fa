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

package com.google.optmodel.functions;

import com.google.common.base.Preconditions;
import com.google.optmodel.VariableIndex;

/** The function {@code x} of one variable. */
public final class SingleVariable implements ScalarFunction {
  private final VariableIndex variable;

  public SingleVariable(VariableIndex variable) {
    this.variable = Preconditions.checkNotNull(variable);
  }

  public VariableIndex getVariable() {
    return variable;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.SINGLE_VARIABLE;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SingleVariable && ((SingleVariable) o).variable.equals(variable);
  }

  @Override
  public int hashCode() {
    return variable.hashCode();
  }

  @Override
  public String toString() {
    return variable.toString();
  }
}
