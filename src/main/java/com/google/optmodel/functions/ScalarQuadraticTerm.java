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

/**
 * A term {@code coefficient * variable1 * variable2} of a quadratic function.
 *
 * <p>When both variables are the same the term contributes {@code coefficient * x^2 / 2}, so that a
 * function {@code 1/2 x'Qx} is written with the entries of {@code Q} as coefficients. The pair of
 * variables is unordered: {@link Canonicalizer} merges {@code (x, y)} and {@code (y, x)}.
 */
@AutoValue
public abstract class ScalarQuadraticTerm {
  public static ScalarQuadraticTerm create(
      double coefficient, VariableIndex variable1, VariableIndex variable2) {
    return new AutoValue_ScalarQuadraticTerm(coefficient, variable1, variable2);
  }

  public abstract double getCoefficient();

  public abstract VariableIndex getVariable1();

  public abstract VariableIndex getVariable2();

  /** Returns true if the term is a square {@code x * x}. */
  public boolean isDiagonal() {
    return getVariable1().equals(getVariable2());
  }

  /** Returns true if one of the two variables is {@code variable}. */
  public boolean references(VariableIndex variable) {
    return getVariable1().equals(variable) || getVariable2().equals(variable);
  }

  /** Returns the same term with its variables in increasing order. */
  public ScalarQuadraticTerm ordered() {
    if (getVariable1().compareTo(getVariable2()) <= 0) {
      return this;
    }
    return create(getCoefficient(), getVariable2(), getVariable1());
  }

  public ScalarQuadraticTerm withCoefficient(double coefficient) {
    return create(coefficient, getVariable1(), getVariable2());
  }
}
