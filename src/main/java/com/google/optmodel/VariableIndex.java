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

package com.google.optmodel;

import com.google.auto.value.AutoValue;

/**
 * Handle of a decision variable.
 *
 * <p>Handles are allocated by the model owning the variables and compared by value. A removed
 * variable keeps its handle invalid; the value is not handed out again.
 */
@AutoValue
public abstract class VariableIndex implements Comparable<VariableIndex> {
  /** Returns the handle with the given value. */
  public static VariableIndex of(long value) {
    return new AutoValue_VariableIndex(value);
  }

  /** Returns the raw value of the handle. */
  public abstract long getValue();

  @Override
  public int compareTo(VariableIndex other) {
    return Long.compare(getValue(), other.getValue());
  }

  @Override
  public final String toString() {
    return "x" + getValue();
  }
}
