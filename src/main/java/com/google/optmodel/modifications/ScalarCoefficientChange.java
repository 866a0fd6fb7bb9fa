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
import com.google.optmodel.VariableIndex;

/**
 * Sets the affine coefficient of a variable in a scalar affine or quadratic function, adding or
 * removing a term if needed.
 */
@AutoValue
public abstract class ScalarCoefficientChange implements FunctionModification {
  public static ScalarCoefficientChange create(VariableIndex variable, double newCoefficient) {
    return new AutoValue_ScalarCoefficientChange(variable, newCoefficient);
  }

  public abstract VariableIndex getVariable();

  public abstract double getNewCoefficient();

  @Override
  public ModificationKind getKind() {
    return ModificationKind.SCALAR_COEFFICIENT_CHANGE;
  }
}
