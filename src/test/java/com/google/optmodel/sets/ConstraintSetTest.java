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

package com.google.optmodel.sets;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public final class ConstraintSetTest {
  @Test
  public void testScalarSets() {
    assertThat(LessThan.create(1.0)).isEqualTo(LessThan.create(1.0));
    assertThat(LessThan.create(1.0)).isNotEqualTo(LessThan.create(2.0));
    assertThat(GreaterThan.create(0.5).getLower()).isEqualTo(0.5);
    assertThat(EqualTo.create(3.0).getDimension()).isEqualTo(1);
    assertThat(Interval.create(1.0, 4.0).getUpper()).isEqualTo(4.0);
    assertThat(LessThan.create(1.0).supportsDimensionUpdate()).isFalse();
  }

  @Test
  public void testInterval_rejectsEmpty() {
    assertThrows(IllegalArgumentException.class, () -> Interval.create(2.0, 1.0));
  }

  @Test
  public void testVectorSets_dimensionUpdate() {
    assertThat(Nonnegatives.create(3).supportsDimensionUpdate()).isTrue();
    assertThat(Nonnegatives.create(3).updateDimension(2)).isEqualTo(Nonnegatives.create(2));
    assertThat(Zeros.create(4).updateDimension(1)).isEqualTo(Zeros.create(1));

    SecondOrderCone cone = SecondOrderCone.create(3);
    assertThat(cone.supportsDimensionUpdate()).isFalse();
    assertThat(cone.getDimension()).isEqualTo(3);
    assertThrows(UnsupportedOperationException.class, () -> cone.updateDimension(2));
  }
}
