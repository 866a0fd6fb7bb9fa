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

/** The vector function {@code Ax + b}; its dimension is the length of {@code b}. */
public final class VectorAffineFunction implements VectorFunction {
  private final ImmutableList<VectorAffineTerm> terms;
  private final ImmutableDoubleArray constants;

  public VectorAffineFunction(List<VectorAffineTerm> terms, ImmutableDoubleArray constants) {
    this.terms = ImmutableList.copyOf(terms);
    this.constants = constants.trimmed();
    for (VectorAffineTerm term : this.terms) {
      Preconditions.checkArgument(
          term.getOutputIndex() < constants.length(),
          "output index %s out of range for dimension %s",
          term.getOutputIndex(),
          constants.length());
    }
  }

  public VectorAffineFunction(List<VectorAffineTerm> terms, double[] constants) {
    this(terms, ImmutableDoubleArray.copyOf(constants));
  }

  public ImmutableList<VectorAffineTerm> getTerms() {
    return terms;
  }

  public ImmutableDoubleArray getConstants() {
    return constants;
  }

  @Override
  public FunctionKind getKind() {
    return FunctionKind.VECTOR_AFFINE;
  }

  @Override
  public int getOutputDimension() {
    return constants.length();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VectorAffineFunction)) {
      return false;
    }
    VectorAffineFunction that = (VectorAffineFunction) o;
    return constants.equals(that.constants) && terms.equals(that.terms);
  }

  @Override
  public int hashCode() {
    return 31 * terms.hashCode() + constants.hashCode();
  }

  @Override
  public String toString() {
    return "VectorAffineFunction{terms=" + terms + ", constants=" + constants + "}";
  }
}
