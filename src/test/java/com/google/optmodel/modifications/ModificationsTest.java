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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.optmodel.ModelException;
import com.google.optmodel.VariableIndex;
import com.google.optmodel.functions.ScalarAffineFunction;
import com.google.optmodel.functions.ScalarAffineTerm;
import com.google.optmodel.functions.ScalarQuadraticFunction;
import com.google.optmodel.functions.ScalarQuadraticTerm;
import com.google.optmodel.functions.SingleVariable;
import com.google.optmodel.functions.VectorAffineFunction;
import com.google.optmodel.functions.VectorAffineTerm;
import com.google.optmodel.functions.VectorQuadraticFunction;
import com.google.optmodel.functions.VectorQuadraticTerm;
import org.junit.jupiter.api.Test;

/** Tests the application of modifications to functions. */
public final class ModificationsTest {
  private final VariableIndex x = VariableIndex.of(1);
  private final VariableIndex y = VariableIndex.of(2);

  private static ScalarAffineTerm term(double coefficient, VariableIndex variable) {
    return ScalarAffineTerm.create(coefficient, variable);
  }

  private static VectorAffineTerm term(int row, double coefficient, VariableIndex variable) {
    return VectorAffineTerm.create(row, ScalarAffineTerm.create(coefficient, variable));
  }

  @Test
  public void testScalarCoefficientChange_insertThenRemove() {
    ScalarAffineFunction f = new ScalarAffineFunction(ImmutableList.of(term(1, x)), 0.0);

    ScalarAffineFunction g = Modifications.apply(f, ScalarCoefficientChange.create(y, 2.0));
    assertThat(g.getTerms()).containsExactly(term(1, x), term(2, y)).inOrder();

    ScalarAffineFunction h = Modifications.apply(g, ScalarCoefficientChange.create(y, 0.0));
    assertThat(h).isEqualTo(f);
  }

  @Test
  public void testScalarCoefficientChange_updatesInPlace() {
    ScalarAffineFunction f =
        new ScalarAffineFunction(ImmutableList.of(term(1, x), term(2, y), term(3, x)), 1.0);

    ScalarAffineFunction g = Modifications.apply(f, ScalarCoefficientChange.create(x, 4.0));

    assertThat(g)
        .isEqualTo(new ScalarAffineFunction(ImmutableList.of(term(4, x), term(2, y)), 1.0));
    assertThat(f.getTerms()).hasSize(3);
  }

  @Test
  public void testScalarCoefficientChange_absentZeroIsNoop() {
    ScalarAffineFunction f = new ScalarAffineFunction(ImmutableList.of(term(1, x)), 0.0);

    assertThat(Modifications.apply(f, ScalarCoefficientChange.create(y, 0.0))).isEqualTo(f);
  }

  @Test
  public void testScalarCoefficientChange_quadraticActsOnAffinePart() {
    ScalarQuadraticFunction f =
        new ScalarQuadraticFunction(
            ImmutableList.of(term(1, x)),
            ImmutableList.of(ScalarQuadraticTerm.create(1, x, x)),
            0.0);

    ScalarQuadraticFunction g = Modifications.apply(f, ScalarCoefficientChange.create(x, 0.0));

    assertThat(g.getAffineTerms()).isEmpty();
    assertThat(g.getQuadraticTerms()).isEqualTo(f.getQuadraticTerms());
  }

  @Test
  public void testConstantChanges() {
    ScalarAffineFunction saf = new ScalarAffineFunction(ImmutableList.of(term(1, x)), 0.0);
    ScalarQuadraticFunction sqf =
        new ScalarQuadraticFunction(ImmutableList.of(), ImmutableList.of(), 1.0);
    VectorAffineFunction vaf =
        new VectorAffineFunction(ImmutableList.of(term(1, 2, x)), new double[] {0, 0});
    VectorQuadraticFunction vqf =
        new VectorQuadraticFunction(
            ImmutableList.of(),
            ImmutableList.of(VectorQuadraticTerm.create(0, ScalarQuadraticTerm.create(1, x, y))),
            new double[] {1});

    assertThat(Modifications.apply(saf, ScalarConstantChange.create(5.0)).getConstant())
        .isEqualTo(5.0);
    assertThat(Modifications.apply(saf, ScalarConstantChange.create(5.0)).getTerms())
        .isEqualTo(saf.getTerms());
    assertThat(Modifications.apply(sqf, ScalarConstantChange.create(-1.0)).getConstant())
        .isEqualTo(-1.0);
    assertThat(Modifications.apply(vaf, VectorConstantChange.create(4, 5)).getConstants().toArray())
        .isEqualTo(new double[] {4, 5});
    assertThat(Modifications.apply(vqf, VectorConstantChange.create(2)).getQuadraticTerms())
        .isEqualTo(vqf.getQuadraticTerms());
  }

  @Test
  public void testVectorConstantChange_wrongLength() {
    VectorAffineFunction f = new VectorAffineFunction(ImmutableList.of(), new double[] {0, 0});

    assertThrows(
        ModelException.DimensionMismatch.class,
        () -> Modifications.apply(f, VectorConstantChange.create(1, 2, 3)));
  }

  @Test
  public void testMultirowChange() {
    VectorAffineFunction f =
        new VectorAffineFunction(
            ImmutableList.of(
                term(0, 1, x), term(1, 2, x), term(1, 7, x), term(2, 3, x), term(0, 4, y)),
            new double[] {0, 0, 0, 0});
    MultirowChange change =
        MultirowChange.create(x, new int[] {0, 1, 3}, new double[] {0.0, 5.0, 6.0});

    VectorAffineFunction g = Modifications.apply(f, change);

    assertThat(g.getTerms())
        .containsExactly(term(1, 5, x), term(2, 3, x), term(0, 4, y), term(3, 6, x))
        .inOrder();
  }

  @Test
  public void testMultirowChange_vectorQuadratic() {
    VectorQuadraticFunction f =
        new VectorQuadraticFunction(
            ImmutableList.of(term(0, 1, x)),
            ImmutableList.of(VectorQuadraticTerm.create(1, ScalarQuadraticTerm.create(1, x, x))),
            new double[] {0, 0});

    VectorQuadraticFunction g =
        Modifications.apply(f, MultirowChange.create(x, new int[] {1}, new double[] {2.0}));

    assertThat(g.getAffineTerms()).containsExactly(term(0, 1, x), term(1, 2, x)).inOrder();
    assertThat(g.getQuadraticTerms()).isEqualTo(f.getQuadraticTerms());
  }

  @Test
  public void testMultirowChange_rowOutOfRange() {
    VectorAffineFunction f = new VectorAffineFunction(ImmutableList.of(), new double[] {0, 0});

    assertThrows(
        ModelException.DimensionMismatch.class,
        () -> Modifications.apply(f, MultirowChange.create(x, new int[] {2}, new double[] {1})));
  }

  @Test
  public void testMultirowChange_mismatchedArrays() {
    assertThrows(
        IllegalArgumentException.class,
        () -> MultirowChange.create(x, new int[] {0, 1}, new double[] {1}));
  }

  @Test
  public void testMultirowChange_negativeRow() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> MultirowChange.create(x, ImmutableMap.of(0, 1.0, -1, 2.0)));
    assertThat(e).hasMessageThat().isEqualTo("negative row -1");
    assertThrows(
        IllegalArgumentException.class,
        () -> MultirowChange.create(x, new int[] {-1}, new double[] {2.0}));
  }

  @Test
  public void testUnsupportedCombinations() {
    ScalarAffineFunction saf = new ScalarAffineFunction(ImmutableList.of(), 0.0);
    VectorAffineFunction vaf = new VectorAffineFunction(ImmutableList.of(), new double[] {0});
    SingleVariable single = new SingleVariable(x);

    assertThrows(
        ModelException.UnsupportedModification.class,
        () -> Modifications.apply(saf, VectorConstantChange.create(1)));
    assertThrows(
        ModelException.UnsupportedModification.class,
        () -> Modifications.apply(vaf, ScalarCoefficientChange.create(x, 1)));
    assertThrows(
        ModelException.UnsupportedModification.class,
        () -> Modifications.apply(single, ScalarConstantChange.create(1)));
    assertThat(Modifications.supports(saf, ScalarConstantChange.create(1))).isTrue();
    assertThat(Modifications.supports(saf, VectorConstantChange.create(1))).isFalse();
    assertThat(Modifications.supports(single, ScalarCoefficientChange.create(x, 1))).isFalse();
    assertThat(Modifications.supports(vaf, MultirowChange.create(x, new int[0], new double[0])))
        .isTrue();
  }

  @Test
  public void testMapVariables() {
    VariableIndex z = VariableIndex.of(3);
    ScalarConstantChange constant = ScalarConstantChange.create(1.0);

    assertThat(Modifications.mapVariables(constant, v -> z)).isSameInstanceAs(constant);
    assertThat(Modifications.mapVariables(ScalarCoefficientChange.create(x, 2.0), v -> z))
        .isEqualTo(ScalarCoefficientChange.create(z, 2.0));
    assertThat(
            Modifications.mapVariables(
                MultirowChange.create(x, new int[] {1}, new double[] {2.0}), v -> z))
        .isEqualTo(MultirowChange.create(z, new int[] {1}, new double[] {2.0}));
  }
}
