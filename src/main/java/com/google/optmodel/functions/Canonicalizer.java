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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Computes the canonical form of a function.
 *
 * <p>In canonical form the terms are sorted by {@code (output index, variable[, second variable])},
 * each key appears at most once and no coefficient is zero. Two functions describing the same map
 * have equal canonical forms, so {@code canonical(f).equals(canonical(g))} is a structural equality
 * test. Constants are never changed.
 */
public final class Canonicalizer {
  private static final Comparator<ScalarAffineTerm> AFFINE_ORDER =
      Comparator.comparing(ScalarAffineTerm::getVariable);

  // Expects terms whose variables were already put in increasing order.
  private static final Comparator<ScalarQuadraticTerm> QUADRATIC_ORDER =
      Comparator.comparing(ScalarQuadraticTerm::getVariable1)
          .thenComparing(ScalarQuadraticTerm::getVariable2);

  private static final Comparator<VectorAffineTerm> VECTOR_AFFINE_ORDER =
      Comparator.comparingInt(VectorAffineTerm::getOutputIndex)
          .thenComparing(VectorAffineTerm::getScalarTerm, AFFINE_ORDER);

  private static final Comparator<VectorQuadraticTerm> VECTOR_QUADRATIC_ORDER =
      Comparator.comparingInt(VectorQuadraticTerm::getOutputIndex)
          .thenComparing(VectorQuadraticTerm::getScalarTerm, QUADRATIC_ORDER);

  private Canonicalizer() {}

  /** Returns the canonical form of {@code f}, a function of the same kind. */
  @SuppressWarnings("unchecked")
  public static <F extends Function> F canonical(F f) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
      case VECTOR_OF_VARIABLES:
        return f;
      case SCALAR_AFFINE:
        return (F) canonical((ScalarAffineFunction) f);
      case VECTOR_AFFINE:
        return (F) canonical((VectorAffineFunction) f);
      case SCALAR_QUADRATIC:
        return (F) canonical((ScalarQuadraticFunction) f);
      case VECTOR_QUADRATIC:
        return (F) canonical((VectorQuadraticFunction) f);
    }
    throw new AssertionError(f.getKind());
  }

  public static ScalarAffineFunction canonical(ScalarAffineFunction f) {
    return new ScalarAffineFunction(canonicalAffineTerms(f.getTerms()), f.getConstant());
  }

  public static VectorAffineFunction canonical(VectorAffineFunction f) {
    return new VectorAffineFunction(canonicalVectorAffineTerms(f.getTerms()), f.getConstants());
  }

  public static ScalarQuadraticFunction canonical(ScalarQuadraticFunction f) {
    List<ScalarQuadraticTerm> ordered = new ArrayList<>(f.getQuadraticTerms().size());
    for (ScalarQuadraticTerm term : f.getQuadraticTerms()) {
      ordered.add(term.ordered());
    }
    return new ScalarQuadraticFunction(
        canonicalAffineTerms(f.getAffineTerms()),
        sortAndMerge(
            ordered,
            QUADRATIC_ORDER,
            ScalarQuadraticTerm::getCoefficient,
            ScalarQuadraticTerm::withCoefficient),
        f.getConstant());
  }

  public static VectorQuadraticFunction canonical(VectorQuadraticFunction f) {
    List<VectorQuadraticTerm> ordered = new ArrayList<>(f.getQuadraticTerms().size());
    for (VectorQuadraticTerm term : f.getQuadraticTerms()) {
      ordered.add(
          VectorQuadraticTerm.create(term.getOutputIndex(), term.getScalarTerm().ordered()));
    }
    return new VectorQuadraticFunction(
        canonicalVectorAffineTerms(f.getAffineTerms()),
        sortAndMerge(
            ordered,
            VECTOR_QUADRATIC_ORDER,
            t -> t.getScalarTerm().getCoefficient(),
            (t, c) ->
                VectorQuadraticTerm.create(
                    t.getOutputIndex(), t.getScalarTerm().withCoefficient(c))),
        f.getConstants());
  }

  /** Returns true if {@code f} is already in canonical form. */
  public static boolean isCanonical(Function f) {
    return canonical(f).equals(f);
  }

  private static ImmutableList<ScalarAffineTerm> canonicalAffineTerms(
      List<ScalarAffineTerm> terms) {
    return sortAndMerge(
        terms, AFFINE_ORDER, ScalarAffineTerm::getCoefficient, ScalarAffineTerm::withCoefficient);
  }

  private static ImmutableList<VectorAffineTerm> canonicalVectorAffineTerms(
      List<VectorAffineTerm> terms) {
    return sortAndMerge(
        terms,
        VECTOR_AFFINE_ORDER,
        t -> t.getScalarTerm().getCoefficient(),
        (t, c) ->
            VectorAffineTerm.create(t.getOutputIndex(), t.getScalarTerm().withCoefficient(c)));
  }

  /** Replaces a term's coefficient, keeping its key. */
  private interface CoefficientSetter<T> {
    T apply(T term, double coefficient);
  }

  private static <T> ImmutableList<T> sortAndMerge(
      List<T> terms,
      Comparator<T> order,
      ToDoubleFunction<T> coefficient,
      CoefficientSetter<T> setCoefficient) {
    List<T> sorted = new ArrayList<>(terms);
    sorted.sort(order);
    ImmutableList.Builder<T> merged = ImmutableList.builderWithExpectedSize(sorted.size());
    T current = null;
    double sum = 0.0;
    for (T term : sorted) {
      if (current != null && order.compare(current, term) == 0) {
        sum += coefficient.applyAsDouble(term);
        continue;
      }
      if (current != null && sum != 0.0) {
        merged.add(setCoefficient.apply(current, sum));
      }
      current = term;
      sum = coefficient.applyAsDouble(term);
    }
    if (current != null && sum != 0.0) {
      merged.add(setCoefficient.apply(current, sum));
    }
    return merged.build();
  }
}
