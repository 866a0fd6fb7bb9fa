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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.VariableIndex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Tests the canonical form of functions. */
public final class CanonicalizerTest {
  private final VariableIndex x = VariableIndex.of(1);
  private final VariableIndex y = VariableIndex.of(2);
  private final VariableIndex z = VariableIndex.of(3);

  private static ScalarAffineTerm term(double coefficient, VariableIndex variable) {
    return ScalarAffineTerm.create(coefficient, variable);
  }

  private ScalarAffineFunction cancelling() {
    return new ScalarAffineFunction(
        ImmutableList.of(term(2, y), term(1, x), term(3, z), term(-2, x), term(-3, z)), 5.0);
  }

  @Test
  public void testCanonical_mergesAndDropsZeros() {
    ScalarAffineFunction f = Canonicalizer.canonical(cancelling());

    assertThat(f.getTerms()).containsExactly(term(-1, x), term(2, y)).inOrder();
    assertThat(f.getConstant()).isEqualTo(5.0);
  }

  @Test
  public void testCanonical_idempotent() {
    ScalarAffineFunction once = Canonicalizer.canonical(cancelling());

    assertThat(Canonicalizer.canonical(once)).isEqualTo(once);
    assertThat(Canonicalizer.isCanonical(once)).isTrue();
    assertThat(Canonicalizer.isCanonical(cancelling())).isFalse();
  }

  @Test
  public void testCanonical_orderIndependent() {
    List<ScalarAffineTerm> terms = new ArrayList<>(cancelling().getTerms());
    ScalarAffineFunction expected = Canonicalizer.canonical(cancelling());
    Random random = new Random(12345);
    for (int i = 0; i < 20; ++i) {
      Collections.shuffle(terms, random);
      assertThat(Canonicalizer.canonical(new ScalarAffineFunction(terms, 5.0)))
          .isEqualTo(expected);
    }
  }

  @Test
  public void testCanonical_preservesValue() {
    ScalarAffineFunction f = cancelling();
    ScalarAffineFunction g = Canonicalizer.canonical(f);
    double[][] points = {{0, 0, 0}, {1.5, -2, 4}, {-3, 0.25, 7}};
    for (double[] point : points) {
      assertThat(Functions.evaluate(g, v -> point[(int) v.getValue() - 1]))
          .isWithin(1e-12)
          .of(Functions.evaluate(f, v -> point[(int) v.getValue() - 1]));
    }
  }

  @Test
  public void testCanonical_quadraticPairIsUnordered() {
    ScalarQuadraticFunction f =
        new ScalarQuadraticFunction(
            ImmutableList.of(term(0, z)),
            ImmutableList.of(
                ScalarQuadraticTerm.create(2, x, y),
                ScalarQuadraticTerm.create(3, y, x),
                ScalarQuadraticTerm.create(1, x, x),
                ScalarQuadraticTerm.create(4, z, y),
                ScalarQuadraticTerm.create(-4, y, z)),
            1.0);

    ScalarQuadraticFunction g = Canonicalizer.canonical(f);

    assertThat(g.getAffineTerms()).isEmpty();
    assertThat(g.getQuadraticTerms())
        .containsExactly(ScalarQuadraticTerm.create(1, x, x), ScalarQuadraticTerm.create(5, x, y))
        .inOrder();
    assertThat(g.getConstant()).isEqualTo(1.0);
  }

  @Test
  public void testCanonical_vectorAffineSortsByRowThenVariable() {
    VectorAffineFunction f =
        new VectorAffineFunction(
            ImmutableList.of(
                VectorAffineTerm.create(1, term(1, y)),
                VectorAffineTerm.create(0, term(1, z)),
                VectorAffineTerm.create(0, term(2, x)),
                VectorAffineTerm.create(1, term(-1, y)),
                VectorAffineTerm.create(1, term(4, x))),
            new double[] {0, 7});

    VectorAffineFunction g = Canonicalizer.canonical(f);

    assertThat(g.getTerms())
        .containsExactly(
            VectorAffineTerm.create(0, term(2, x)),
            VectorAffineTerm.create(0, term(1, z)),
            VectorAffineTerm.create(1, term(4, x)))
        .inOrder();
    assertThat(g.getConstants().toArray()).isEqualTo(new double[] {0, 7});
  }

  @Test
  public void testCanonical_vectorQuadratic() {
    VectorQuadraticFunction f =
        new VectorQuadraticFunction(
            ImmutableList.of(
                VectorAffineTerm.create(1, term(1, x)), VectorAffineTerm.create(1, term(1, x))),
            ImmutableList.of(
                VectorQuadraticTerm.create(1, ScalarQuadraticTerm.create(1, y, x)),
                VectorQuadraticTerm.create(0, ScalarQuadraticTerm.create(2, x, y)),
                VectorQuadraticTerm.create(1, ScalarQuadraticTerm.create(1, x, y))),
            new double[] {0, 0});

    VectorQuadraticFunction g = Canonicalizer.canonical(f);

    assertThat(g.getAffineTerms()).containsExactly(VectorAffineTerm.create(1, term(2, x)));
    assertThat(g.getQuadraticTerms())
        .containsExactly(
            VectorQuadraticTerm.create(0, ScalarQuadraticTerm.create(2, x, y)),
            VectorQuadraticTerm.create(1, ScalarQuadraticTerm.create(2, x, y)))
        .inOrder();
  }

  @Test
  public void testCanonical_variablesUnchanged() {
    SingleVariable single = new SingleVariable(x);
    VectorOfVariables vector = VectorOfVariables.of(y, x, y);

    assertThat(Canonicalizer.canonical(single)).isSameInstanceAs(single);
    assertThat(Canonicalizer.canonical(vector)).isSameInstanceAs(vector);
  }

  @Test
  public void testCanonical_emptyFunction() {
    ScalarAffineFunction f = new ScalarAffineFunction(ImmutableList.of(term(0, x)), 2.0);

    assertThat(Canonicalizer.canonical(f))
        .isEqualTo(new ScalarAffineFunction(ImmutableList.of(), 2.0));
  }
}
