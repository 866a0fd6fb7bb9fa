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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A quadratic term placed on one row (output index, from 0) of a vector function. */
@AutoValue
public abstract class VectorQuadraticTerm {
  public static VectorQuadraticTerm create(int outputIndex, ScalarQuadraticTerm scalarTerm) {
    Preconditions.checkArgument(outputIndex >= 0, "negative output index %s", outputIndex);
    return new AutoValue_VectorQuadraticTerm(outputIndex, scalarTerm);
  }

  public abstract int getOutputIndex();

  public abstract ScalarQuadraticTerm getScalarTerm();

  public VectorQuadraticTerm withOutputIndex(int outputIndex) {
    return create(outputIndex, getScalarTerm());
  }
}
