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
import com.google.optmodel.VariableIndex;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * View of a vector function as the sequence of its rows.
 *
 * <p>Row {@code i} gathers exactly the terms of output index {@code i}; its constant is the ith
 * constant. The view is finite, can be iterated any number of times, and can be projected on an
 * ordered list of rows with {@link #get(int...)}.
 *
 * @param <S> the scalar kind of the rows
 * @param <V> the vector kind being viewed
 */
public final class ScalarFunctionIterator<S extends ScalarFunction, V extends VectorFunction>
    implements Iterable<S> {
  private final V function;

  ScalarFunctionIterator(V function) {
    this.function = function;
  }

  /** Returns the number of rows. */
  public int size() {
    return function.getOutputDimension();
  }

  /** Returns row {@code row} as a scalar function. */
  @SuppressWarnings("unchecked")
  public S get(int row) {
    Preconditions.checkElementIndex(row, size());
    switch (function.getKind()) {
      case VECTOR_OF_VARIABLES:
        return (S) new SingleVariable(((VectorOfVariables) function).getVariables().get(row));
      case VECTOR_AFFINE: {
        VectorAffineFunction f = (VectorAffineFunction) function;
        return (S)
            new ScalarAffineFunction(affineTermsAt(f.getTerms(), row), f.getConstants().get(row));
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction f = (VectorQuadraticFunction) function;
        return (S)
            new ScalarQuadraticFunction(
                affineTermsAt(f.getAffineTerms(), row),
                quadraticTermsAt(f.getQuadraticTerms(), row),
                f.getConstants().get(row));
      }
      default:
        throw new AssertionError(function.getKind());
    }
  }

  /**
   * Returns the vector function made of the given rows, in the given order.
   *
   * <p>Row {@code rows[k]} of the viewed function becomes row {@code k} of the result.
   */
  @SuppressWarnings("unchecked")
  public V get(int... rows) {
    for (int row : rows) {
      Preconditions.checkElementIndex(row, size());
    }
    switch (function.getKind()) {
      case VECTOR_OF_VARIABLES: {
        ImmutableList<VariableIndex> variables =
            ((VectorOfVariables) function).getVariables();
        List<VariableIndex> projected = new ArrayList<>(rows.length);
        for (int row : rows) {
          projected.add(variables.get(row));
        }
        return (V) new VectorOfVariables(projected);
      }
      case VECTOR_AFFINE: {
        VectorAffineFunction f = (VectorAffineFunction) function;
        List<VectorAffineTerm> terms = new ArrayList<>();
        double[] constants = new double[rows.length];
        for (int k = 0; k < rows.length; ++k) {
          for (ScalarAffineTerm term : affineTermsAt(f.getTerms(), rows[k])) {
            terms.add(VectorAffineTerm.create(k, term));
          }
          constants[k] = f.getConstants().get(rows[k]);
        }
        return (V) new VectorAffineFunction(terms, constants);
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction f = (VectorQuadraticFunction) function;
        List<VectorAffineTerm> affineTerms = new ArrayList<>();
        List<VectorQuadraticTerm> quadraticTerms = new ArrayList<>();
        double[] constants = new double[rows.length];
        for (int k = 0; k < rows.length; ++k) {
          for (ScalarAffineTerm term : affineTermsAt(f.getAffineTerms(), rows[k])) {
            affineTerms.add(VectorAffineTerm.create(k, term));
          }
          for (ScalarQuadraticTerm term : quadraticTermsAt(f.getQuadraticTerms(), rows[k])) {
            quadraticTerms.add(VectorQuadraticTerm.create(k, term));
          }
          constants[k] = f.getConstants().get(rows[k]);
        }
        return (V) new VectorQuadraticFunction(affineTerms, quadraticTerms, constants);
      }
      default:
        throw new AssertionError(function.getKind());
    }
  }

  /** Returns the rows as a list. */
  public List<S> asList() {
    return new AbstractList<S>() {
      @Override
      public S get(int index) {
        return ScalarFunctionIterator.this.get(index);
      }

      @Override
      public int size() {
        return ScalarFunctionIterator.this.size();
      }
    };
  }

  @Override
  public Iterator<S> iterator() {
    return asList().iterator();
  }

  static ImmutableList<ScalarAffineTerm> affineTermsAt(List<VectorAffineTerm> terms, int row) {
    ImmutableList.Builder<ScalarAffineTerm> builder = ImmutableList.builder();
    for (VectorAffineTerm term : terms) {
      if (term.getOutputIndex() == row) {
        builder.add(term.getScalarTerm());
      }
    }
    return builder.build();
  }

  static ImmutableList<ScalarQuadraticTerm> quadraticTermsAt(
      List<VectorQuadraticTerm> terms, int row) {
    ImmutableList.Builder<ScalarQuadraticTerm> builder = ImmutableList.builder();
    for (VectorQuadraticTerm term : terms) {
      if (term.getOutputIndex() == row) {
        builder.add(term.getScalarTerm());
      }
    }
    return builder.build();
  }
}
