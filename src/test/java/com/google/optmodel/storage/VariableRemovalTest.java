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

package com.google.optmodel.storage;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.VariableIndex;
import com.google.optmodel.functions.ScalarAffineFunction;
import com.google.optmodel.functions.ScalarAffineTerm;
import com.google.optmodel.functions.ScalarQuadraticFunction;
import com.google.optmodel.functions.ScalarQuadraticTerm;
import com.google.optmodel.functions.SingleVariable;
import com.google.optmodel.functions.VectorAffineFunction;
import com.google.optmodel.functions.VectorAffineTerm;
import com.google.optmodel.functions.VectorOfVariables;
import com.google.optmodel.sets.GreaterThan;
import com.google.optmodel.sets.Nonnegatives;
import com.google.optmodel.sets.SecondOrderCone;
import com.google.optmodel.sets.Zeros;
import org.junit.jupiter.api.Test;

/** Tests the cascade of a variable removal through the constraints of a partition. */
public final class VariableRemovalTest {
  private final VariableIndex x = VariableIndex.of(1);
  private final VariableIndex y = VariableIndex.of(2);
  private final VariableIndex z = VariableIndex.of(3);

  @Test
  public void testRemoveVariable_singletonGroupDeleted() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> c =
        partition.add(VectorOfVariables.of(x), SecondOrderCone.create(1));

    ImmutableList<ConstraintIndex<VectorOfVariables, SecondOrderCone>> deleted =
        partition.removeVariable(x);

    assertThat(deleted).containsExactly(c);
    assertThat(partition.isValid(c)).isFalse();
    assertThat(partition.isEmpty()).isTrue();
  }

  @Test
  public void testRemoveVariable_fixedDimensionGroupRefused() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> c =
        partition.add(VectorOfVariables.of(x, y, z), SecondOrderCone.create(3));

    ModelException.DeleteNotAllowed e =
        assertThrows(ModelException.DeleteNotAllowed.class, () -> partition.removeVariable(x));

    assertThat(e.getVariable()).isEqualTo(x);
    assertThat(e).hasMessageThat().startsWith("removeVariable: cannot delete variable x1");
    assertThat(partition.getFunction(c)).isEqualTo(VectorOfVariables.of(x, y, z));
    assertThat(partition.getSet(c)).isEqualTo(SecondOrderCone.create(3));
  }

  @Test
  public void testRemoveVariable_repeatedVariableGroupRefused() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> c =
        partition.add(VectorOfVariables.of(x, x), SecondOrderCone.create(2));

    ModelException.DeleteNotAllowed e =
        assertThrows(ModelException.DeleteNotAllowed.class, () -> partition.removeVariable(x));

    assertThat(e.getVariable()).isEqualTo(x);
    assertThat(partition.isValid(c)).isTrue();
    assertThat(partition.get(c))
        .isEqualTo(Constraint.create(VectorOfVariables.of(x, x), SecondOrderCone.create(2)));
  }

  @Test
  public void testRemoveVariable_repeatedVariableGroupShrinksToEmpty() {
    ConstraintPartition<VectorOfVariables, Nonnegatives> partition =
        new ConstraintPartition<>(VectorOfVariables.class, Nonnegatives.class);
    ConstraintIndex<VectorOfVariables, Nonnegatives> c =
        partition.add(VectorOfVariables.of(x, x), Nonnegatives.create(2));

    assertThat(partition.removeVariable(x)).isEmpty();

    assertThat(partition.get(c))
        .isEqualTo(Constraint.create(VectorOfVariables.of(), Nonnegatives.create(0)));
  }

  @Test
  public void testFilterVariables_fixedDimensionGroupRefused() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> c =
        partition.add(VectorOfVariables.of(x, y, z), SecondOrderCone.create(3));

    ModelException.DeleteNotAllowed e =
        assertThrows(
            ModelException.DeleteNotAllowed.class,
            () -> partition.filterVariables(v -> !v.equals(y)));

    assertThat(e.getVariable()).isEqualTo(y);
    assertThat(e).hasMessageThat().startsWith("filterVariables: cannot delete variable x2");
    assertThat(partition.getFunction(c)).isEqualTo(VectorOfVariables.of(x, y, z));
  }

  @Test
  public void testFilterVariables_repeatedVariableGroupDeleted() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> c =
        partition.add(VectorOfVariables.of(x, x), SecondOrderCone.create(2));

    assertThat(partition.filterVariables(v -> !v.equals(x))).containsExactly(c);
    assertThat(partition.isEmpty()).isTrue();
  }

  @Test
  public void testRemoveVariable_refusalLeavesOtherConstraintsUntouched() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> single =
        partition.add(VectorOfVariables.of(x), SecondOrderCone.create(1));
    ConstraintIndex<VectorOfVariables, SecondOrderCone> group =
        partition.add(VectorOfVariables.of(y, x), SecondOrderCone.create(2));

    assertThrows(ModelException.DeleteNotAllowed.class, () -> partition.removeVariable(x));

    assertThat(partition.isValid(single)).isTrue();
    assertThat(partition.getFunction(single)).isEqualTo(VectorOfVariables.of(x));
    assertThat(partition.getFunction(group)).isEqualTo(VectorOfVariables.of(y, x));
    assertThat(partition.size()).isEqualTo(2);
  }

  @Test
  public void testRemoveVariable_updatableSetShrinks() {
    ConstraintPartition<VectorOfVariables, Nonnegatives> partition =
        new ConstraintPartition<>(VectorOfVariables.class, Nonnegatives.class);
    ConstraintIndex<VectorOfVariables, Nonnegatives> c =
        partition.add(VectorOfVariables.of(x, y, z), Nonnegatives.create(3));
    ConstraintIndex<VectorOfVariables, Nonnegatives> other =
        partition.add(VectorOfVariables.of(y, z), Nonnegatives.create(2));

    ImmutableList<ConstraintIndex<VectorOfVariables, Nonnegatives>> deleted =
        partition.removeVariable(y);

    assertThat(deleted).isEmpty();
    assertThat(partition.get(c))
        .isEqualTo(Constraint.create(VectorOfVariables.of(x, z), Nonnegatives.create(2)));
    assertThat(partition.get(other))
        .isEqualTo(Constraint.create(VectorOfVariables.of(z), Nonnegatives.create(1)));
  }

  @Test
  public void testFilterVariables_groupLosingAllMembersDeleted() {
    ConstraintPartition<VectorOfVariables, SecondOrderCone> partition =
        new ConstraintPartition<>(VectorOfVariables.class, SecondOrderCone.class);
    ConstraintIndex<VectorOfVariables, SecondOrderCone> gone =
        partition.add(VectorOfVariables.of(x, y), SecondOrderCone.create(2));
    ConstraintIndex<VectorOfVariables, SecondOrderCone> kept =
        partition.add(VectorOfVariables.of(z), SecondOrderCone.create(1));

    ImmutableList<ConstraintIndex<VectorOfVariables, SecondOrderCone>> deleted =
        partition.filterVariables(v -> v.equals(z));

    assertThat(deleted).containsExactly(gone);
    assertThat(partition.getIndices()).containsExactly(kept);
  }

  @Test
  public void testRemoveVariable_singleVariableDeleted() {
    ConstraintPartition<SingleVariable, GreaterThan> partition =
        new ConstraintPartition<>(SingleVariable.class, GreaterThan.class);
    ConstraintIndex<SingleVariable, GreaterThan> onX =
        partition.add(new SingleVariable(x), GreaterThan.create(0.0));
    ConstraintIndex<SingleVariable, GreaterThan> onY =
        partition.add(new SingleVariable(y), GreaterThan.create(1.0));

    assertThat(partition.removeVariable(x)).containsExactly(onX);
    assertThat(partition.getIndices()).containsExactly(onY);
  }

  @Test
  public void testRemoveVariable_stripsQuadraticTerms() {
    ConstraintPartition<ScalarQuadraticFunction, GreaterThan> partition =
        new ConstraintPartition<>(ScalarQuadraticFunction.class, GreaterThan.class);
    ScalarQuadraticFunction f =
        new ScalarQuadraticFunction(
            ImmutableList.of(ScalarAffineTerm.create(1, x), ScalarAffineTerm.create(2, y)),
            ImmutableList.of(
                ScalarQuadraticTerm.create(3, x, y),
                ScalarQuadraticTerm.create(4, y, x),
                ScalarQuadraticTerm.create(5, y, y)),
            6.0);
    ConstraintIndex<ScalarQuadraticFunction, GreaterThan> c =
        partition.add(f, GreaterThan.create(0.0));

    assertThat(partition.removeVariable(x)).isEmpty();

    assertThat(partition.getFunction(c))
        .isEqualTo(
            new ScalarQuadraticFunction(
                ImmutableList.of(ScalarAffineTerm.create(2, y)),
                ImmutableList.of(ScalarQuadraticTerm.create(5, y, y)),
                6.0));
  }

  @Test
  public void testRemoveVariable_vectorAffineKeepsDimension() {
    ConstraintPartition<VectorAffineFunction, Zeros> partition =
        new ConstraintPartition<>(VectorAffineFunction.class, Zeros.class);
    VectorAffineFunction f =
        new VectorAffineFunction(
            ImmutableList.of(
                VectorAffineTerm.create(0, ScalarAffineTerm.create(1, x)),
                VectorAffineTerm.create(1, ScalarAffineTerm.create(2, y))),
            new double[] {3, 4});
    ConstraintIndex<VectorAffineFunction, Zeros> c = partition.add(f, Zeros.create(2));

    assertThat(partition.removeVariable(x)).isEmpty();

    assertThat(partition.getFunction(c))
        .isEqualTo(
            new VectorAffineFunction(
                ImmutableList.of(VectorAffineTerm.create(1, ScalarAffineTerm.create(2, y))),
                new double[] {3, 4}));
    assertThat(partition.getSet(c)).isEqualTo(Zeros.create(2));
  }

  @Test
  public void testRemoveVariable_unreferencedVariableChangesNothing() {
    ConstraintPartition<ScalarAffineFunction, GreaterThan> partition =
        new ConstraintPartition<>(ScalarAffineFunction.class, GreaterThan.class);
    ScalarAffineFunction f =
        new ScalarAffineFunction(ImmutableList.of(ScalarAffineTerm.create(1, x)), 0.0);
    ConstraintIndex<ScalarAffineFunction, GreaterThan> c =
        partition.add(f, GreaterThan.create(0.0));

    assertThat(partition.removeVariable(z)).isEmpty();
    assertThat(partition.getFunction(c)).isSameInstanceAs(f);
  }
}
