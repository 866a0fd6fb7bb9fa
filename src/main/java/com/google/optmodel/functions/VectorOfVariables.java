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

import com.google.common.collect.ImmutableList;
import com.google.optmodel.VariableIndex;
import java.util.List;

/** The vector function {@code [x_0, ..., x_{n-1}]}; row i is the ith variable. */
public final class VectorOfVariables implements VectorFunction {
  private final ImmutableList<VariableIndex> variables;

  public VectorOfVariables(List<VariableIndex> variables) {
    this.variables = ImmutableList.copyOf(variables);
  }

  public static VectorOfVariables of(VariableIndex... variables) {
    return new VectorOfVariables(ImmutableList.copyOf(variables));
  }

  public ImmutableList<VariableIndex> getVariables() {
    return variables;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.VECTOR_OF_VARIABLES;
  }

  @Override
  public int getOutputDimension() {
    return variables.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof VectorOfVariables && ((VectorOfVariables) o).variables.equals(variables);
  }

  @Override
  public int hashCode() {
    return variables.hashCode();
  }

  @Override
  public String toString() {
    return variables.toString();
  }
}
