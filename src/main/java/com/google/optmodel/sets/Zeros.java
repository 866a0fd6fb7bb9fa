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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** The set containing only the origin of dimension {@link #getDimension()}. */
@AutoValue
public abstract class Zeros implements ConstraintSet {
  public static Zeros create(int dimension) {
    Preconditions.checkArgument(dimension >= 0, "negative dimension %s", dimension);
    return new AutoValue_Zeros(dimension);
  }

  @Override
  public abstract int getDimension();

  @Override
  public boolean supportsDimensionUpdate() {
    return true;
  }

  @Override
  public Zeros updateDimension(int dimension) {
    return create(dimension);
  }
}
