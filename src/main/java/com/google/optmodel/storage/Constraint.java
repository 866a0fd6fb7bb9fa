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

package com.google.optmodel.storage;

import com.google.auto.value.AutoValue;
import com.google.optmodel.functions.Function;
import com.google.optmodel.sets.ConstraintSet;

/** A constraint {@code function in set}. */
@AutoValue
public abstract class Constraint<F extends Function, S extends ConstraintSet> {
  public static <F extends Function, S extends ConstraintSet> Constraint<F, S> create(
      F function, S set) {
    return new AutoValue_Constraint<>(function, set);
  }

  public abstract F getFunction();

  public abstract S getSet();
}
