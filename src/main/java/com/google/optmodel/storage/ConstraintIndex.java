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

import com.google.optmodel.functions.Function;
import com.google.optmodel.sets.ConstraintSet;

/**
 * Handle of a constraint of functions of type {@code F} in sets of type {@code S}.
 *
 * <p>Two indices are equal when they have the same value and the same function and set classes.
 * Within a partition, values are handed out once and never reused.
 */
public final class ConstraintIndex<F extends Function, S extends ConstraintSet> {
  private final Class<F> functionType;
  private final Class<S> setType;
  private final long value;

  public ConstraintIndex(Class<F> functionType, Class<S> setType, long value) {
    this.functionType = functionType;
    this.setType = setType;
    this.value = value;
  }

  public Class<F> getFunctionType() {
    return functionType;
  }

  public Class<S> getSetType() {
    return setType;
  }

  public long getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ConstraintIndex)) {
      return false;
    }
    ConstraintIndex<?, ?> that = (ConstraintIndex<?, ?>) o;
    return value == that.value
        && functionType.equals(that.functionType)
        && setType.equals(that.setType);
  }

  @Override
  public int hashCode() {
    return (31 * functionType.hashCode() + setType.hashCode()) * 31 + Long.hashCode(value);
  }

  @Override
  public String toString() {
    return String.format(
        "ConstraintIndex<%s, %s>(%d)",
        functionType.getSimpleName(), setType.getSimpleName(), value);
  }
}
