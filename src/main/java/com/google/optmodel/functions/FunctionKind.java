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

/** The closed set of function kinds. */
public enum FunctionKind {
  SINGLE_VARIABLE(SingleVariable.class, false),
  VECTOR_OF_VARIABLES(VectorOfVariables.class, true),
  SCALAR_AFFINE(ScalarAffineFunction.class, false),
  VECTOR_AFFINE(VectorAffineFunction.class, true),
  SCALAR_QUADRATIC(ScalarQuadraticFunction.class, false),
  VECTOR_QUADRATIC(VectorQuadraticFunction.class, true);

  private final Class<? extends Function> functionClass;
  private final boolean vector;

  FunctionKind(Class<? extends Function> functionClass, boolean vector) {
    this.functionClass = functionClass;
    this.vector = vector;
  }

  /** Returns the class implementing this kind. */
  public Class<? extends Function> getFunctionClass() {
    return functionClass;
  }

  public boolean isVector() {
    return vector;
  }
}
