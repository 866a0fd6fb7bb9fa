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
import com.google.optmodel.VariableIndex;

/** A term {@code coefficient * variable} of an affine function. */
@AutoValue
public abstract class ScalarAffineTerm {
  public static ScalarAffineTerm create(double coefficient, VariableIndex variable) {
    return new AutoValue_ScalarAffineTerm(coefficient, variable);
  }

  public abstract double getCoefficient();

  public abstract VariableIndex getVariable();

  /** Returns a term on the same variable with the given coefficient. */
  public ScalarAffineTerm withCoefficient(double coefficient) {
    return create(coefficient, getVariable());
  }
}
