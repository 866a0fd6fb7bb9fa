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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The function {@code sum(a_i * x_i) + b}. */
public final class ScalarAffineFunction implements ScalarFunction {
  private final ImmutableList<ScalarAffineTerm> terms;
  private final double constant;

  public ScalarAffineFunction(List<ScalarAffineTerm> terms, double constant) {
    this.terms = ImmutableList.copyOf(terms);
    this.constant = constant;
  }

  public ImmutableList<ScalarAffineTerm> getTerms() {
    return terms;
  }

  public double getConstant() {
    return constant;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.SCALAR_AFFINE;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ScalarAffineFunction)) {
      return false;
    }
    ScalarAffineFunction that = (ScalarAffineFunction) o;
    return Double.compare(constant, that.constant) == 0 && terms.equals(that.terms);
  }

  @Override
  public int hashCode() {
    return 31 * terms.hashCode() + Double.hashCode(constant);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (ScalarAffineTerm term : terms) {
      sb.append(term.getCoefficient()).append(' ').append(term.getVariable()).append(" + ");
    }
    return sb.append(constant).toString();
  }
}
