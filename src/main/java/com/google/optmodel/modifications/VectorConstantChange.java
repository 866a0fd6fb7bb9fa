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

package com.google.optmodel.modifications;

import com.google.auto.value.AutoValue;
import com.google.common.primitives.ImmutableDoubleArray;

/** Replaces the constants of a vector affine or quadratic function. */
@AutoValue
public abstract class VectorConstantChange implements FunctionModification {
  public static VectorConstantChange create(double... newConstants) {
    return new AutoValue_VectorConstantChange(ImmutableDoubleArray.copyOf(newConstants));
  }

  public abstract ImmutableDoubleArray getNewConstants();

  @Override
  public ModificationKind getKind() {
    return ModificationKind.VECTOR_CONSTANT_CHANGE;
  }
}
