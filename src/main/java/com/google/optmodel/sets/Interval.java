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

/** The set {@code [lower, upper]}. */
@AutoValue
public abstract class Interval implements ConstraintSet {
  public static Interval create(double lower, double upper) {
    Preconditions.checkArgument(lower <= upper, "empty interval [%s, %s]", lower, upper);
    return new AutoValue_Interval(lower, upper);
  }

  public abstract double getLower();

  public abstract double getUpper();

  @Override
  public int getDimension() {
    return 1;
  }
}
