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

/** The function {@code sum(a_ij * x_i * x_j) + sum(b_i * x_i) + c}. */
public final class ScalarQuadraticFunction implements ScalarFunction {
  private final ImmutableList<ScalarAffineTerm> affineTerms;
  private final ImmutableList<ScalarQuadraticTerm> quadraticTerms;
  private final double constant;

  public ScalarQuadraticFunction(
      List<ScalarAffineTerm> affineTerms,
      List<ScalarQuadraticTerm> quadraticTerms,
      double constant) {
    this.affineTerms = ImmutableList.copyOf(affineTerms);
    this.quadraticTerms = ImmutableList.copyOf(quadraticTerms);
    this.constant = constant;
  }

  public ImmutableList<ScalarAffineTerm> getAffineTerms() {
    return affineTerms;
  }

  public ImmutableList<ScalarQuadraticTerm> getQuadraticTerms() {
    return quadraticTerms;
  }

  public double getConstant() {
    return constant;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.SCALAR_QUADRATIC;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ScalarQuadraticFunction)) {
      return false;
    }
    ScalarQuadraticFunction that = (ScalarQuadraticFunction) o;
    return Double.compare(constant, that.constant) == 0
        && affineTerms.equals(that.affineTerms)
        && quadraticTerms.equals(that.quadraticTerms);
  }

  @Override
  public int hashCode() {
    return (31 * affineTerms.hashCode() + quadraticTerms.hashCode()) * 31
        + Double.hashCode(constant);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (ScalarQuadraticTerm term : quadraticTerms) {
      sb.append(term.getCoefficient())
          .append(' ')
          .append(term.getVariable1())
          .append('*')
          .append(term.getVariable2())
          .append(" + ");
    }
    for (ScalarAffineTerm term : affineTerms) {
      sb.append(term.getCoefficient()).append(' ').append(term.getVariable()).append(" + ");
    }
    return sb.append(constant).toString();
  }
}
