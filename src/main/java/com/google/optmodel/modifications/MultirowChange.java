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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.optmodel.VariableIndex;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sets the affine coefficient of a variable on some rows of a vector affine or quadratic function.
 *
 * <p>Rows that are not listed keep their terms. When a row is listed twice the last coefficient
 * wins.
 */
@AutoValue
public abstract class MultirowChange implements FunctionModification {
  public static MultirowChange create(
      VariableIndex variable, int[] rows, double[] newCoefficients) {
    Preconditions.checkArgument(
        rows.length == newCoefficients.length,
        "rows and newCoefficients have mismatched lengths");
    Map<Integer, Double> coefficients = new LinkedHashMap<>();
    for (int i = 0; i < rows.length; ++i) {
      coefficients.put(rows[i], newCoefficients[i]);
    }
    return create(variable, coefficients);
  }

  /**
   * Returns the change setting the coefficient of {@code variable} to {@code
   * newCoefficients.get(r)} on each row {@code r} of the map.
   *
   * @throws IllegalArgumentException if a row is negative
   */
  public static MultirowChange create(
      VariableIndex variable, Map<Integer, Double> newCoefficients) {
    for (int row : newCoefficients.keySet()) {
      Preconditions.checkArgument(row >= 0, "negative row %s", row);
    }
    return new AutoValue_MultirowChange(variable, ImmutableMap.copyOf(newCoefficients));
  }

  public abstract VariableIndex getVariable();

  /** Returns the new coefficient of each listed row, in the order they were given. */
  public abstract ImmutableMap<Integer, Double> getNewCoefficients();

  @Override
  public ModificationKind getKind() {
    return ModificationKind.MULTIROW_CHANGE;
  }
}
