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

/** An affine term placed on one row (output index, from 0) of a vector function. */
@AutoValue
public abstract class VectorAffineTerm {
  public static VectorAffineTerm create(int outputIndex, ScalarAffineTerm scalarTerm) {
    Preconditions.checkArgument(outputIndex >= 0, "negative output index %s", outputIndex);
    return new AutoValue_VectorAffineTerm(outputIndex, scalarTerm);
  }

  public abstract int getOutputIndex();

  public abstract ScalarAffineTerm getScalarTerm();

  public VectorAffineTerm withOutputIndex(int outputIndex) {
    return create(outputIndex, getScalarTerm());
  }
}
