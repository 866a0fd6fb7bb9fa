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

package com.google.optmodel.sets;

/**
 * A set constraining the value of a function.
 *
 * <p>Sets are immutable values. A set whose dimension can follow the removal of a variable from a
 * {@code VectorOfVariables} reports it through {@link #supportsDimensionUpdate()}.
 */
public interface ConstraintSet {
  /** Returns the number of components of the elements of the set. */
  int getDimension();

  /** Returns true if {@link #updateDimension(int)} is supported. */
  default boolean supportsDimensionUpdate() {
    return false;
  }

  /**
   * Returns the same kind of set with dimension {@code dimension}.
   *
   * @throws UnsupportedOperationException if the set has a fixed dimension
   */
  default ConstraintSet updateDimension(int dimension) {
    throw new UnsupportedOperationException(
        getClass().getSimpleName() + " does not support dimension update");
  }
}
