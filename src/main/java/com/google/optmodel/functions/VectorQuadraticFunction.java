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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.List;

/** A vector function whose rows are quadratic functions. */
public final class VectorQuadraticFunction implements VectorFunction {
  private final ImmutableList<VectorAffineTerm> affineTerms;
  private final ImmutableList<VectorQuadraticTerm> quadraticTerms;
  private final ImmutableDoubleArray constants;

  public VectorQuadraticFunction(
      List<VectorAffineTerm> affineTerms,
      List<VectorQuadraticTerm> quadraticTerms,
      ImmutableDoubleArray constants) {
    this.affineTerms = ImmutableList.copyOf(affineTerms);
    this.quadraticTerms = ImmutableList.copyOf(quadraticTerms);
    this.constants = constants.trimmed();
    for (VectorAffineTerm term : this.affineTerms) {
      checkRow(term.getOutputIndex());
    }
    for (VectorQuadraticTerm term : this.quadraticTerms) {
      checkRow(term.getOutputIndex());
    }
  }

  public VectorQuadraticFunction(
      List<VectorAffineTerm> affineTerms,
      List<VectorQuadraticTerm> quadraticTerms,
      double[] constants) {
    this(affineTerms, quadraticTerms, ImmutableDoubleArray.copyOf(constants));
  }

  private void checkRow(int outputIndex) {
    Preconditions.checkArgument(
        outputIndex < constants.length(),
        "output index %s out of range for dimension %s",
        outputIndex,
        constants.length());
  }

  public ImmutableList<VectorAffineTerm> getAffineTerms() {
    return affineTerms;
  }

  public ImmutableList<VectorQuadraticTerm> getQuadraticTerms() {
    return quadraticTerms;
  }

  public ImmutableDoubleArray getConstants() {
    return constants;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.VECTOR_QUADRATIC;
  }

  @Override
  public int getOutputDimension() {
    return constants.length();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VectorQuadraticFunction)) {
      return false;
    }
    VectorQuadraticFunction that = (VectorQuadraticFunction) o;
    return constants.equals(that.constants)
        && affineTerms.equals(that.affineTerms)
        && quadraticTerms.equals(that.quadraticTerms);
  }

  @Override
  public int hashCode() {
    return (31 * affineTerms.hashCode() + quadraticTerms.hashCode()) * 31 + constants.hashCode();
  }

  @Override
  public String toString() {
    return "VectorQuadraticFunction{affineTerms="
        + affineTerms
        + ", quadraticTerms="
        + quadraticTerms
        + ", constants="
        + constants
        + "}";
  }
}
