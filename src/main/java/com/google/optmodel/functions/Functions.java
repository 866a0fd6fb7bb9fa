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
import com.google.optmodel.ModelException;
import com.google.optmodel.VariableIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/** Static operations on functions: evaluation, substitution, lifting and stacking. */
public final class Functions {
  /** Default relative tolerance of {@link #isApprox(Function, Function)}. */
  public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-8;

  /** Default absolute tolerance of {@link #isApprox(Function, Function)}. */
  public static final double DEFAULT_ABSOLUTE_TOLERANCE = 0.0;

  private Functions() {}

  // Evaluation.

  /** Returns the value of {@code f} when each variable {@code x} is {@code value(x)}. */
  public static double evaluate(ScalarFunction f, ToDoubleFunction<VariableIndex> value) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
        return value.applyAsDouble(((SingleVariable) f).getVariable());
      case SCALAR_AFFINE: {
        ScalarAffineFunction saf = (ScalarAffineFunction) f;
        return saf.getConstant() + evaluateAffine(saf.getTerms(), value);
      }
      case SCALAR_QUADRATIC: {
        ScalarQuadraticFunction sqf = (ScalarQuadraticFunction) f;
        double result = sqf.getConstant() + evaluateAffine(sqf.getAffineTerms(), value);
        for (ScalarQuadraticTerm term : sqf.getQuadraticTerms()) {
          result += evaluateTerm(term, value);
        }
        return result;
      }
      default:
        throw new AssertionError(f.getKind());
    }
  }

  /** Returns the row values of {@code f}; the result has {@code f.getOutputDimension()} entries. */
  public static double[] evaluate(VectorFunction f, ToDoubleFunction<VariableIndex> value) {
    switch (f.getKind()) {
      case VECTOR_OF_VARIABLES: {
        List<VariableIndex> variables = ((VectorOfVariables) f).getVariables();
        double[] out = new double[variables.size()];
        for (int i = 0; i < out.length; ++i) {
          out[i] = value.applyAsDouble(variables.get(i));
        }
        return out;
      }
      case VECTOR_AFFINE: {
        VectorAffineFunction vaf = (VectorAffineFunction) f;
        double[] out = vaf.getConstants().toArray();
        for (VectorAffineTerm term : vaf.getTerms()) {
          out[term.getOutputIndex()] += evaluateTerm(term.getScalarTerm(), value);
        }
        return out;
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction vqf = (VectorQuadraticFunction) f;
        double[] out = vqf.getConstants().toArray();
        for (VectorAffineTerm term : vqf.getAffineTerms()) {
          out[term.getOutputIndex()] += evaluateTerm(term.getScalarTerm(), value);
        }
        for (VectorQuadraticTerm term : vqf.getQuadraticTerms()) {
          out[term.getOutputIndex()] += evaluateTerm(term.getScalarTerm(), value);
        }
        return out;
      }
      default:
        throw new AssertionError(f.getKind());
    }
  }

  private static double evaluateAffine(
      List<ScalarAffineTerm> terms, ToDoubleFunction<VariableIndex> value) {
    double result = 0.0;
    for (ScalarAffineTerm term : terms) {
      result += evaluateTerm(term, value);
    }
    return result;
  }

  private static double evaluateTerm(ScalarAffineTerm term, ToDoubleFunction<VariableIndex> value) {
    return term.getCoefficient() * value.applyAsDouble(term.getVariable());
  }

  private static double evaluateTerm(
      ScalarQuadraticTerm term, ToDoubleFunction<VariableIndex> value) {
    double product =
        term.getCoefficient()
            * value.applyAsDouble(term.getVariable1())
            * value.applyAsDouble(term.getVariable2());
    return term.isDiagonal() ? product / 2 : product;
  }

  // Substitution.

  /** Returns {@code f} with every variable {@code x} replaced by {@code rename(x)}. */
  @SuppressWarnings("unchecked")
  public static <F extends Function> F mapVariables(F f, UnaryOperator<VariableIndex> rename) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
        return (F) new SingleVariable(rename.apply(((SingleVariable) f).getVariable()));
      case VECTOR_OF_VARIABLES: {
        List<VariableIndex> variables = new ArrayList<>();
        for (VariableIndex variable : ((VectorOfVariables) f).getVariables()) {
          variables.add(rename.apply(variable));
        }
        return (F) new VectorOfVariables(variables);
      }
      case SCALAR_AFFINE: {
        ScalarAffineFunction saf = (ScalarAffineFunction) f;
        return (F) new ScalarAffineFunction(mapAffine(saf.getTerms(), rename), saf.getConstant());
      }
      case VECTOR_AFFINE: {
        VectorAffineFunction vaf = (VectorAffineFunction) f;
        return (F)
            new VectorAffineFunction(mapVectorAffine(vaf.getTerms(), rename), vaf.getConstants());
      }
      case SCALAR_QUADRATIC: {
        ScalarQuadraticFunction sqf = (ScalarQuadraticFunction) f;
        List<ScalarQuadraticTerm> quadratic = new ArrayList<>();
        for (ScalarQuadraticTerm term : sqf.getQuadraticTerms()) {
          quadratic.add(mapQuadratic(term, rename));
        }
        return (F)
            new ScalarQuadraticFunction(
                mapAffine(sqf.getAffineTerms(), rename), quadratic, sqf.getConstant());
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction vqf = (VectorQuadraticFunction) f;
        List<VectorQuadraticTerm> quadratic = new ArrayList<>();
        for (VectorQuadraticTerm term : vqf.getQuadraticTerms()) {
          quadratic.add(
              VectorQuadraticTerm.create(
                  term.getOutputIndex(), mapQuadratic(term.getScalarTerm(), rename)));
        }
        return (F)
            new VectorQuadraticFunction(
                mapVectorAffine(vqf.getAffineTerms(), rename), quadratic, vqf.getConstants());
      }
    }
    throw new AssertionError(f.getKind());
  }

  /**
   * Returns {@code f} with every variable replaced by its image in {@code variableMap}.
   *
   * @throws IllegalArgumentException if a variable of {@code f} has no image
   */
  public static <F extends Function> F mapVariables(
      F f, Map<VariableIndex, VariableIndex> variableMap) {
    return mapVariables(
        f,
        variable -> {
          VariableIndex image = variableMap.get(variable);
          Preconditions.checkArgument(image != null, "no image for variable %s", variable);
          return image;
        });
  }

  private static ImmutableList<ScalarAffineTerm> mapAffine(
      List<ScalarAffineTerm> terms, UnaryOperator<VariableIndex> rename) {
    ImmutableList.Builder<ScalarAffineTerm> builder = ImmutableList.builder();
    for (ScalarAffineTerm term : terms) {
      builder.add(ScalarAffineTerm.create(term.getCoefficient(), rename.apply(term.getVariable())));
    }
    return builder.build();
  }

  private static ImmutableList<VectorAffineTerm> mapVectorAffine(
      List<VectorAffineTerm> terms, UnaryOperator<VariableIndex> rename) {
    ImmutableList.Builder<VectorAffineTerm> builder = ImmutableList.builder();
    for (VectorAffineTerm term : terms) {
      ScalarAffineTerm scalar = term.getScalarTerm();
      builder.add(
          VectorAffineTerm.create(
              term.getOutputIndex(),
              ScalarAffineTerm.create(
                  scalar.getCoefficient(), rename.apply(scalar.getVariable()))));
    }
    return builder.build();
  }

  private static ScalarQuadraticTerm mapQuadratic(
      ScalarQuadraticTerm term, UnaryOperator<VariableIndex> rename) {
    return ScalarQuadraticTerm.create(
        term.getCoefficient(),
        rename.apply(term.getVariable1()),
        rename.apply(term.getVariable2()));
  }

  // Lifting.

  /** Returns {@code 1 * variable + 0}. */
  public static ScalarAffineFunction toScalarAffine(VariableIndex variable) {
    return toScalarAffine(ScalarAffineTerm.create(1.0, variable));
  }

  /** Returns the function made of the single term {@code term}. */
  public static ScalarAffineFunction toScalarAffine(ScalarAffineTerm term) {
    return new ScalarAffineFunction(ImmutableList.of(term), 0.0);
  }

  public static ScalarAffineFunction toScalarAffine(SingleVariable f) {
    return toScalarAffine(f.getVariable());
  }

  /** Returns the affine function whose row i is {@code 1 * variables[i]}. */
  public static VectorAffineFunction toVectorAffine(VectorOfVariables f) {
    List<VariableIndex> variables = f.getVariables();
    List<VectorAffineTerm> terms = new ArrayList<>(variables.size());
    for (int i = 0; i < variables.size(); ++i) {
      terms.add(VectorAffineTerm.create(i, ScalarAffineTerm.create(1.0, variables.get(i))));
    }
    return new VectorAffineFunction(terms, new double[variables.size()]);
  }

  /** Returns {@code f} as a vector function of dimension 1. */
  public static VectorAffineFunction toVectorAffine(ScalarAffineFunction f) {
    List<VectorAffineTerm> terms = new ArrayList<>(f.getTerms().size());
    for (ScalarAffineTerm term : f.getTerms()) {
      terms.add(VectorAffineTerm.create(0, term));
    }
    return new VectorAffineFunction(terms, ImmutableDoubleArray.of(f.getConstant()));
  }

  /** Returns {@code f} with an empty list of quadratic terms. */
  public static ScalarQuadraticFunction toScalarQuadratic(ScalarAffineFunction f) {
    return new ScalarQuadraticFunction(f.getTerms(), ImmutableList.of(), f.getConstant());
  }

  /** Returns {@code f} as a vector function of dimension 1. */
  public static VectorQuadraticFunction toVectorQuadratic(ScalarQuadraticFunction f) {
    List<VectorAffineTerm> affine = new ArrayList<>(f.getAffineTerms().size());
    for (ScalarAffineTerm term : f.getAffineTerms()) {
      affine.add(VectorAffineTerm.create(0, term));
    }
    List<VectorQuadraticTerm> quadratic = new ArrayList<>(f.getQuadraticTerms().size());
    for (ScalarQuadraticTerm term : f.getQuadraticTerms()) {
      quadratic.add(VectorQuadraticTerm.create(0, term));
    }
    return new VectorQuadraticFunction(
        affine, quadratic, ImmutableDoubleArray.of(f.getConstant()));
  }

  /** Returns {@code f} with an empty list of quadratic terms. */
  public static VectorQuadraticFunction toVectorQuadratic(VectorAffineFunction f) {
    return new VectorQuadraticFunction(f.getTerms(), ImmutableList.of(), f.getConstants());
  }

  /**
   * Returns any affine-compatible function as a vector affine function.
   *
   * @throws ModelException.TypeMismatch if {@code f} is quadratic
   */
  public static VectorAffineFunction toVectorAffine(Function f) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
        return toVectorAffine(toScalarAffine((SingleVariable) f));
      case VECTOR_OF_VARIABLES:
        return toVectorAffine((VectorOfVariables) f);
      case SCALAR_AFFINE:
        return toVectorAffine((ScalarAffineFunction) f);
      case VECTOR_AFFINE:
        return (VectorAffineFunction) f;
      default:
        throw new ModelException.TypeMismatch(
            "toVectorAffine", VectorAffineFunction.class, f.getClass());
    }
  }

  /** Returns the constants of {@code f}, zeros for the variable-only kinds. */
  public static ImmutableDoubleArray constants(Function f) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
      case VECTOR_OF_VARIABLES:
        return ImmutableDoubleArray.copyOf(new double[f.getOutputDimension()]);
      case SCALAR_AFFINE:
        return ImmutableDoubleArray.of(((ScalarAffineFunction) f).getConstant());
      case VECTOR_AFFINE:
        return ((VectorAffineFunction) f).getConstants();
      case SCALAR_QUADRATIC:
        return ImmutableDoubleArray.of(((ScalarQuadraticFunction) f).getConstant());
      case VECTOR_QUADRATIC:
        return ((VectorQuadraticFunction) f).getConstants();
    }
    throw new AssertionError(f.getKind());
  }

  // Stacking.

  /**
   * Stacks affine functions vertically.
   *
   * <p>The rows of {@code functions[k]} are shifted by the sum of the dimensions of the functions
   * before it.
   */
  public static VectorAffineFunction concatenate(Function... functions) {
    List<VectorAffineTerm> terms = new ArrayList<>();
    ImmutableDoubleArray.Builder constants = ImmutableDoubleArray.builder();
    int offset = 0;
    for (Function function : functions) {
      VectorAffineFunction f = toVectorAffine(function);
      for (VectorAffineTerm term : f.getTerms()) {
        terms.add(term.withOutputIndex(offset + term.getOutputIndex()));
      }
      constants.addAll(f.getConstants());
      offset += f.getOutputDimension();
    }
    return new VectorAffineFunction(terms, constants.build());
  }

  // Rows.

  public static ScalarFunctionIterator<SingleVariable, VectorOfVariables> eachScalar(
      VectorOfVariables f) {
    return new ScalarFunctionIterator<>(f);
  }

  public static ScalarFunctionIterator<ScalarAffineFunction, VectorAffineFunction> eachScalar(
      VectorAffineFunction f) {
    return new ScalarFunctionIterator<>(f);
  }

  public static ScalarFunctionIterator<ScalarQuadraticFunction, VectorQuadraticFunction>
      eachScalar(VectorQuadraticFunction f) {
    return new ScalarFunctionIterator<>(f);
  }

  // Variable removal.

  /**
   * Returns {@code f} without the terms and entries referencing {@code variable}.
   *
   * @throws IllegalArgumentException if {@code f} is the {@link SingleVariable} of {@code variable}
   */
  public static <F extends Function> F removeVariable(F f, VariableIndex variable) {
    return filterVariables(v -> !v.equals(variable), f);
  }

  /**
   * Returns {@code f} keeping only the terms whose variables all satisfy {@code keep}.
   *
   * <p>Dropping an entry of a {@link VectorOfVariables} reduces its dimension.
   *
   * @throws IllegalArgumentException if {@code f} is a {@link SingleVariable} whose variable is
   *     dropped
   */
  @SuppressWarnings("unchecked")
  public static <F extends Function> F filterVariables(Predicate<VariableIndex> keep, F f) {
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
        Preconditions.checkArgument(
            keep.test(((SingleVariable) f).getVariable()),
            "cannot remove the variable of %s",
            f);
        return f;
      case VECTOR_OF_VARIABLES: {
        List<VariableIndex> variables = new ArrayList<>();
        for (VariableIndex variable : ((VectorOfVariables) f).getVariables()) {
          if (keep.test(variable)) {
            variables.add(variable);
          }
        }
        return (F) new VectorOfVariables(variables);
      }
      case SCALAR_AFFINE: {
        ScalarAffineFunction saf = (ScalarAffineFunction) f;
        return (F) new ScalarAffineFunction(filterAffine(saf.getTerms(), keep), saf.getConstant());
      }
      case VECTOR_AFFINE: {
        VectorAffineFunction vaf = (VectorAffineFunction) f;
        return (F)
            new VectorAffineFunction(filterVectorAffine(vaf.getTerms(), keep), vaf.getConstants());
      }
      case SCALAR_QUADRATIC: {
        ScalarQuadraticFunction sqf = (ScalarQuadraticFunction) f;
        List<ScalarQuadraticTerm> quadratic = new ArrayList<>();
        for (ScalarQuadraticTerm term : sqf.getQuadraticTerms()) {
          if (keep.test(term.getVariable1()) && keep.test(term.getVariable2())) {
            quadratic.add(term);
          }
        }
        return (F)
            new ScalarQuadraticFunction(
                filterAffine(sqf.getAffineTerms(), keep), quadratic, sqf.getConstant());
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction vqf = (VectorQuadraticFunction) f;
        List<VectorQuadraticTerm> quadratic = new ArrayList<>();
        for (VectorQuadraticTerm term : vqf.getQuadraticTerms()) {
          ScalarQuadraticTerm scalar = term.getScalarTerm();
          if (keep.test(scalar.getVariable1()) && keep.test(scalar.getVariable2())) {
            quadratic.add(term);
          }
        }
        return (F)
            new VectorQuadraticFunction(
                filterVectorAffine(vqf.getAffineTerms(), keep), quadratic, vqf.getConstants());
      }
    }
    throw new AssertionError(f.getKind());
  }

  private static List<ScalarAffineTerm> filterAffine(
      List<ScalarAffineTerm> terms, Predicate<VariableIndex> keep) {
    List<ScalarAffineTerm> kept = new ArrayList<>(terms.size());
    for (ScalarAffineTerm term : terms) {
      if (keep.test(term.getVariable())) {
        kept.add(term);
      }
    }
    return kept;
  }

  private static List<VectorAffineTerm> filterVectorAffine(
      List<VectorAffineTerm> terms, Predicate<VariableIndex> keep) {
    List<VectorAffineTerm> kept = new ArrayList<>(terms.size());
    for (VectorAffineTerm term : terms) {
      if (keep.test(term.getScalarTerm().getVariable())) {
        kept.add(term);
      }
    }
    return kept;
  }

  // Approximate comparison.

  /** Same as {@link #isApprox(Function, Function, double, double)} with the default tolerances. */
  public static boolean isApprox(Function f, Function g) {
    return isApprox(f, g, DEFAULT_RELATIVE_TOLERANCE, DEFAULT_ABSOLUTE_TOLERANCE);
  }

  /**
   * Returns true if {@code f} and {@code g} have the same kind and dimension and their canonical
   * coefficients and constants agree within {@code max(absoluteTolerance, relativeTolerance *
   * max(|a|, |b|))}. A term present on one side only is compared against zero.
   */
  public static boolean isApprox(
      Function f, Function g, double relativeTolerance, double absoluteTolerance) {
    if (f.getKind() != g.getKind() || f.getOutputDimension() != g.getOutputDimension()) {
      return false;
    }
    ImmutableDoubleArray fConstants = constants(f);
    ImmutableDoubleArray gConstants = constants(g);
    for (int i = 0; i < fConstants.length(); ++i) {
      if (!isClose(fConstants.get(i), gConstants.get(i), relativeTolerance, absoluteTolerance)) {
        return false;
      }
    }
    Map<List<Object>, Double> fCoefficients = coefficientsByKey(Canonicalizer.canonical(f));
    Map<List<Object>, Double> gCoefficients = coefficientsByKey(Canonicalizer.canonical(g));
    Set<List<Object>> keys = new HashSet<>(fCoefficients.keySet());
    keys.addAll(gCoefficients.keySet());
    for (List<Object> key : keys) {
      double a = fCoefficients.getOrDefault(key, 0.0);
      double b = gCoefficients.getOrDefault(key, 0.0);
      if (!isClose(a, b, relativeTolerance, absoluteTolerance)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isClose(
      double a, double b, double relativeTolerance, double absoluteTolerance) {
    return Math.abs(a - b)
        <= Math.max(absoluteTolerance, relativeTolerance * Math.max(Math.abs(a), Math.abs(b)));
  }

  // Keys are ("a", row, variable) or ("q", row, variable1, variable2); variables count 1.0.
  private static Map<List<Object>, Double> coefficientsByKey(Function f) {
    Map<List<Object>, Double> coefficients = new HashMap<>();
    switch (f.getKind()) {
      case SINGLE_VARIABLE:
        coefficients.put(ImmutableList.of("a", 0, ((SingleVariable) f).getVariable()), 1.0);
        break;
      case VECTOR_OF_VARIABLES: {
        List<VariableIndex> variables = ((VectorOfVariables) f).getVariables();
        for (int i = 0; i < variables.size(); ++i) {
          coefficients.merge(ImmutableList.of("a", i, variables.get(i)), 1.0, Double::sum);
        }
        break;
      }
      case SCALAR_AFFINE:
        putAffine(coefficients, 0, ((ScalarAffineFunction) f).getTerms());
        break;
      case VECTOR_AFFINE:
        for (VectorAffineTerm term : ((VectorAffineFunction) f).getTerms()) {
          putAffine(coefficients, term.getOutputIndex(), ImmutableList.of(term.getScalarTerm()));
        }
        break;
      case SCALAR_QUADRATIC: {
        ScalarQuadraticFunction sqf = (ScalarQuadraticFunction) f;
        putAffine(coefficients, 0, sqf.getAffineTerms());
        putQuadratic(coefficients, 0, sqf.getQuadraticTerms());
        break;
      }
      case VECTOR_QUADRATIC: {
        VectorQuadraticFunction vqf = (VectorQuadraticFunction) f;
        for (VectorAffineTerm term : vqf.getAffineTerms()) {
          putAffine(coefficients, term.getOutputIndex(), ImmutableList.of(term.getScalarTerm()));
        }
        for (VectorQuadraticTerm term : vqf.getQuadraticTerms()) {
          putQuadratic(coefficients, term.getOutputIndex(), ImmutableList.of(term.getScalarTerm()));
        }
        break;
      }
    }
    return coefficients;
  }

  private static void putAffine(
      Map<List<Object>, Double> coefficients, int row, List<ScalarAffineTerm> terms) {
    for (ScalarAffineTerm term : terms) {
      coefficients.put(ImmutableList.of("a", row, term.getVariable()), term.getCoefficient());
    }
  }

  private static void putQuadratic(
      Map<List<Object>, Double> coefficients, int row, List<ScalarQuadraticTerm> terms) {
    for (ScalarQuadraticTerm term : terms) {
      coefficients.put(
          ImmutableList.of("q", row, term.getVariable1(), term.getVariable2()),
          term.getCoefficient());
    }
  }
}
