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

package com.google.optmodel.modifications;

import com.google.common.primitives.ImmutableDoubleArray;
import com.google.optmodel.ModelException;
import com.google.optmodel.VariableIndex;
import com.google.optmodel.functions.Function;
import com.google.optmodel.functions.ScalarAffineFunction;
import com.google.optmodel.functions.ScalarAffineTerm;
import com.google.optmodel.functions.ScalarQuadraticFunction;
import com.google.optmodel.functions.VectorAffineFunction;
import com.google.optmodel.functions.VectorAffineTerm;
import com.google.optmodel.functions.VectorQuadraticFunction;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Applies {@link FunctionModification}s to functions.
 *
 * <p>The supported (function kind, modification kind) pairs are:
 *
 * <ul>
 *   <li>scalar affine and scalar quadratic with {@link ScalarConstantChange} and {@link
 *       ScalarCoefficientChange};
 *   <li>vector affine and vector quadratic with {@link VectorConstantChange} and {@link
 *       MultirowChange}.
 * </ul>
 *
 * Coefficient changes act on the affine terms only. Functions are never mutated: the result is a
 * new function of the same kind.
 */
public final class Modifications {
  private Modifications() {}

  /**
   * Returns {@code f} modified by {@code change}.
   *
   * @throws ModelException.UnsupportedModification if {@code change} does not apply to the kind of
   *     {@code f}
   * @throws ModelException.DimensionMismatch if {@code change} refers to rows {@code f} does not
   *     have
   */
  @SuppressWarnings("unchecked")
  public static <F extends Function> F apply(F f, FunctionModification change) {
    switch (f.getKind()) {
      case SCALAR_AFFINE: {
        ScalarAffineFunction saf = (ScalarAffineFunction) f;
        switch (change.getKind()) {
          case SCALAR_CONSTANT_CHANGE:
            return (F)
                new ScalarAffineFunction(
                    saf.getTerms(), ((ScalarConstantChange) change).getNewConstant());
          case SCALAR_COEFFICIENT_CHANGE:
            return (F)
                new ScalarAffineFunction(
                    replaceCoefficient(saf.getTerms(), (ScalarCoefficientChange) change),
                    saf.getConstant());
          default:
            break;
        }
        break;
      }
      case SCALAR_QUADRATIC: {
        ScalarQuadraticFunction sqf = (ScalarQuadraticFunction) f;
        switch (change.getKind()) {
          case SCALAR_CONSTANT_CHANGE:
            return (F)
                new ScalarQuadraticFunction(
                    sqf.getAffineTerms(),
                    sqf.getQuadraticTerms(),
                    ((ScalarConstantChange) change).getNewConstant());
          case SCALAR_COEFFICIENT_CHANGE:
            return (F)
                new ScalarQuadraticFunction(
                    replaceCoefficient(sqf.getAffineTerms(), (ScalarCoefficientChange) change),
                    sqf.getQuadraticTerms(),
                    sqf.getConstant());
          default:
            break;
        }
        break;
      }
      case VECTOR_AFFINE: {
        VectorAffineFunction vaf = (VectorAffineFunction) f;
        switch (change.getKind()) {
          case VECTOR_CONSTANT_CHANGE:
            return (F)
                new VectorAffineFunction(
                    vaf.getTerms(), newConstants(vaf, (VectorConstantChange) change));
          case MULTIROW_CHANGE:
            return (F)
                new VectorAffineFunction(
                    replaceCoefficients(vaf, vaf.getTerms(), (MultirowChange) change),
                    vaf.getConstants());
          default:
            break;
        }
        break;
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction vqf = (VectorQuadraticFunction) f;
        switch (change.getKind()) {
          case VECTOR_CONSTANT_CHANGE:
            return (F)
                new VectorQuadraticFunction(
                    vqf.getAffineTerms(),
                    vqf.getQuadraticTerms(),
                    newConstants(vqf, (VectorConstantChange) change));
          case MULTIROW_CHANGE:
            return (F)
                new VectorQuadraticFunction(
                    replaceCoefficients(vqf, vqf.getAffineTerms(), (MultirowChange) change),
                    vqf.getQuadraticTerms(),
                    vqf.getConstants());
          default:
            break;
        }
        break;
      }
      default:
        break;
    }
    throw new ModelException.UnsupportedModification("apply", change.getKind(), f.getKind());
  }

  /** Returns true if {@code change} can be applied to a function of the kind of {@code f}. */
  public static boolean supports(Function f, FunctionModification change) {
    switch (change.getKind()) {
      case SCALAR_CONSTANT_CHANGE:
      case SCALAR_COEFFICIENT_CHANGE:
        switch (f.getKind()) {
          case SCALAR_AFFINE:
          case SCALAR_QUADRATIC:
            return true;
          default:
            return false;
        }
      case VECTOR_CONSTANT_CHANGE:
      case MULTIROW_CHANGE:
        switch (f.getKind()) {
          case VECTOR_AFFINE:
          case VECTOR_QUADRATIC:
            return true;
          default:
            return false;
        }
    }
    throw new AssertionError(change.getKind());
  }

  /** Returns {@code change} with its variable replaced by {@code rename(variable)}. */
  public static FunctionModification mapVariables(
      FunctionModification change, UnaryOperator<VariableIndex> rename) {
    switch (change.getKind()) {
      case SCALAR_CONSTANT_CHANGE:
      case VECTOR_CONSTANT_CHANGE:
        return change;
      case SCALAR_COEFFICIENT_CHANGE: {
        ScalarCoefficientChange c = (ScalarCoefficientChange) change;
        return ScalarCoefficientChange.create(rename.apply(c.getVariable()), c.getNewCoefficient());
      }
      case MULTIROW_CHANGE: {
        MultirowChange c = (MultirowChange) change;
        return MultirowChange.create(rename.apply(c.getVariable()), c.getNewCoefficients());
      }
    }
    throw new AssertionError(change.getKind());
  }

  private static ImmutableDoubleArray newConstants(Function f, VectorConstantChange change) {
    ImmutableDoubleArray constants = change.getNewConstants();
    if (constants.length() != f.getOutputDimension()) {
      throw new ModelException.DimensionMismatch(
          "apply", f.getOutputDimension(), constants.length());
    }
    return constants;
  }

  // The first term on the variable takes the new coefficient, later ones are dropped.
  private static List<ScalarAffineTerm> replaceCoefficient(
      List<ScalarAffineTerm> terms, ScalarCoefficientChange change) {
    VariableIndex variable = change.getVariable();
    double coefficient = change.getNewCoefficient();
    List<ScalarAffineTerm> result = new ArrayList<>(terms.size() + 1);
    boolean found = false;
    for (ScalarAffineTerm term : terms) {
      if (!term.getVariable().equals(variable)) {
        result.add(term);
      } else if (!found) {
        found = true;
        if (coefficient != 0.0) {
          result.add(term.withCoefficient(coefficient));
        }
      }
    }
    if (!found && coefficient != 0.0) {
      result.add(ScalarAffineTerm.create(coefficient, variable));
    }
    return result;
  }

  private static List<VectorAffineTerm> replaceCoefficients(
      Function f, List<VectorAffineTerm> terms, MultirowChange change) {
    Map<Integer, Double> coefficients = change.getNewCoefficients();
    for (int row : coefficients.keySet()) {
      if (row >= f.getOutputDimension()) {
        throw new ModelException.DimensionMismatch(
            "apply", "row " + row + " out of range for dimension " + f.getOutputDimension());
      }
    }
    VariableIndex variable = change.getVariable();
    Set<Integer> done = new HashSet<>();
    List<VectorAffineTerm> result = new ArrayList<>(terms.size() + coefficients.size());
    for (VectorAffineTerm term : terms) {
      int row = term.getOutputIndex();
      if (!term.getScalarTerm().getVariable().equals(variable)
          || !coefficients.containsKey(row)) {
        result.add(term);
      } else if (done.add(row)) {
        double coefficient = coefficients.get(row);
        if (coefficient != 0.0) {
          result.add(
              VectorAffineTerm.create(row, term.getScalarTerm().withCoefficient(coefficient)));
        }
      }
    }
    for (Map.Entry<Integer, Double> entry : coefficients.entrySet()) {
      if (!done.contains(entry.getKey()) && entry.getValue() != 0.0) {
        result.add(
            VectorAffineTerm.create(
                entry.getKey(), ScalarAffineTerm.create(entry.getValue(), variable)));
      }
    }
    return result;
  }
}
