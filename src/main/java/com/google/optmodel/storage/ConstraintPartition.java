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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.VariableIndex;
import com.google.optmodel.functions.Function;
import com.google.optmodel.functions.Functions;
import com.google.optmodel.functions.SingleVariable;
import com.google.optmodel.functions.VectorOfVariables;
import com.google.optmodel.modifications.FunctionModification;
import com.google.optmodel.modifications.Modifications;
import com.google.optmodel.sets.ConstraintSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Storage of all the constraints {@code F}-in-{@code S} of a model.
 *
 * <p>Constraints live in a dense array of entries. The value {@code v} of a constraint index is
 * translated to its slot in that array by {@code slots[v - 1]}, so lookups never hash. Deleting a
 * constraint leaves a hole in the entry array and marks its index as deleted; the array is
 * compacted once holes outnumber live entries, which amortizes the cost of a deletion over the
 * deletions of this partition. Index values come from a counter that is never reset, so a deleted
 * index stays invalid for the lifetime of the partition, {@link #clear()} included.
 *
 * <p>Every operation checks its arguments before changing anything: a call that throws leaves the
 * partition as it was. This class is not thread-safe.
 */
public final class ConstraintPartition<F extends Function, S extends ConstraintSet> {
  private static final Logger logger = Logger.getLogger(ConstraintPartition.class.getName());

  private static final int DELETED = -1;

  /** A constraint index with the constraint it currently holds. */
  private static final class Entry<F extends Function, S extends ConstraintSet> {
    final ConstraintIndex<F, S> index;
    Constraint<F, S> constraint;

    Entry(ConstraintIndex<F, S> index, Constraint<F, S> constraint) {
      this.index = index;
      this.constraint = constraint;
    }
  }

  private final Class<F> functionType;
  private final Class<S> setType;
  private final ArrayList<Entry<F, S>> entries;
  private int[] slots;
  private long lastValue;
  private int size;
  private int holes;

  public ConstraintPartition(Class<F> functionType, Class<S> setType) {
    this.functionType = Preconditions.checkNotNull(functionType);
    this.setType = Preconditions.checkNotNull(setType);
    this.entries = new ArrayList<>();
    this.slots = new int[8];
    this.lastValue = 0;
    this.size = 0;
    this.holes = 0;
  }

  public Class<F> getFunctionType() {
    return functionType;
  }

  public Class<S> getSetType() {
    return setType;
  }

  /** Returns true if this partition stores {@code functionType}-in-{@code setType} constraints. */
  public boolean supportsConstraint(Class<?> functionType, Class<?> setType) {
    return this.functionType.equals(functionType) && this.setType.equals(setType);
  }

  // Adding constraints.

  /**
   * Adds the constraint {@code function in set} and returns its index.
   *
   * @throws ModelException.TypeMismatch if the function or the set is not of the partition's types
   * @throws ModelException.DimensionMismatch if the function and the set have different dimensions
   */
  public ConstraintIndex<F, S> add(F function, S set) {
    checkConstraint("add", function, set);
    return addUnchecked(function, set);
  }

  /** Adds the constraints {@code functions[i] in sets[i]} and returns their indices in order. */
  public ImmutableList<ConstraintIndex<F, S>> addAll(List<F> functions, List<S> sets) {
    Preconditions.checkArgument(
        functions.size() == sets.size(), "functions and sets have mismatched lengths");
    for (int i = 0; i < functions.size(); ++i) {
      checkConstraint("addAll", functions.get(i), sets.get(i));
    }
    ImmutableList.Builder<ConstraintIndex<F, S>> indices = ImmutableList.builder();
    for (int i = 0; i < functions.size(); ++i) {
      indices.add(addUnchecked(functions.get(i), sets.get(i)));
    }
    return indices.build();
  }

  private ConstraintIndex<F, S> addUnchecked(F function, S set) {
    long value = lastValue + 1;
    if (value > Integer.MAX_VALUE) {
      throw new IllegalStateException("too many constraint indices issued");
    }
    if (value > slots.length) {
      slots = Arrays.copyOf(slots, (int) Math.min(Integer.MAX_VALUE, 2L * slots.length));
    }
    lastValue = value;
    ConstraintIndex<F, S> index = new ConstraintIndex<>(functionType, setType, value);
    slots[(int) (value - 1)] = entries.size();
    entries.add(new Entry<>(index, Constraint.create(function, set)));
    size++;
    return index;
  }

  private void checkConstraint(String methodName, Function function, ConstraintSet set) {
    Preconditions.checkNotNull(function);
    Preconditions.checkNotNull(set);
    if (!functionType.isInstance(function)) {
      throw new ModelException.TypeMismatch(methodName, functionType, function.getClass());
    }
    if (!setType.isInstance(set)) {
      throw new ModelException.TypeMismatch(methodName, setType, set.getClass());
    }
    if (function.getOutputDimension() != set.getDimension()) {
      throw new ModelException.DimensionMismatch(
          methodName, set.getDimension(), function.getOutputDimension());
    }
  }

  // Queries.

  /** Returns true if {@code index} was issued by this partition and not deleted since. */
  public boolean isValid(ConstraintIndex<?, ?> index) {
    return findSlot(index) != DELETED;
  }

  /** Returns the function of the constraint {@code index}. */
  public F getFunction(ConstraintIndex<F, S> index) {
    return entry("getFunction", index).constraint.getFunction();
  }

  /** Returns the set of the constraint {@code index}. */
  public S getSet(ConstraintIndex<F, S> index) {
    return entry("getSet", index).constraint.getSet();
  }

  /** Returns the constraint {@code index}. */
  public Constraint<F, S> get(ConstraintIndex<F, S> index) {
    return entry("get", index).constraint;
  }

  /** Returns the number of constraints. */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Returns the indices of the constraints, in the order they were added. */
  public ImmutableList<ConstraintIndex<F, S>> getIndices() {
    ImmutableList.Builder<ConstraintIndex<F, S>> indices =
        ImmutableList.builderWithExpectedSize(size);
    for (Entry<F, S> entry : entries) {
      if (entry != null) {
        indices.add(entry.index);
      }
    }
    return indices.build();
  }

  /** Returns the types of the constraints stored: none when empty, otherwise {@code (F, S)}. */
  public ImmutableList<ConstraintType> getConstraintTypes() {
    if (isEmpty()) {
      return ImmutableList.of();
    }
    return ImmutableList.of(ConstraintType.create(functionType, setType));
  }

  // Updates.

  /** Replaces the function of the constraint {@code index}. */
  public void setFunction(ConstraintIndex<F, S> index, F function) {
    Entry<F, S> entry = entry("setFunction", index);
    S set = entry.constraint.getSet();
    checkConstraint("setFunction", function, set);
    entry.constraint = Constraint.create(function, set);
  }

  /** Replaces the set of the constraint {@code index}. */
  public void setSet(ConstraintIndex<F, S> index, S set) {
    Entry<F, S> entry = entry("setSet", index);
    F function = entry.constraint.getFunction();
    checkConstraint("setSet", function, set);
    entry.constraint = Constraint.create(function, set);
  }

  /**
   * Applies {@code change} to the function of the constraint {@code index}.
   *
   * @throws ModelException.InvalidIndex if {@code index} is not valid
   * @throws ModelException.UnsupportedModification if {@code change} does not apply to {@code F}
   */
  public void modify(ConstraintIndex<F, S> index, FunctionModification change) {
    Entry<F, S> entry = entry("modify", index);
    F function = Modifications.apply(entry.constraint.getFunction(), change);
    entry.constraint = Constraint.create(function, entry.constraint.getSet());
  }

  /** Deletes the constraint {@code index}; the index is never valid again. */
  public void delete(ConstraintIndex<F, S> index) {
    int slot = slot("delete", index);
    entries.set(slot, null);
    slots[(int) (index.getValue() - 1)] = DELETED;
    size--;
    holes++;
    logger.fine(() -> "Deleted " + index + " from " + describe());
    if (holes > size) {
      compact();
    }
  }

  /** Deletes all the constraints. Indices issued before stay invalid. */
  public void clear() {
    logger.fine(() -> "Clearing " + size + " constraints of " + describe());
    entries.clear();
    Arrays.fill(slots, 0, (int) lastValue, DELETED);
    size = 0;
    holes = 0;
  }

  private void compact() {
    int next = 0;
    for (int slot = 0; slot < entries.size(); ++slot) {
      Entry<F, S> entry = entries.get(slot);
      if (entry != null) {
        entries.set(next, entry);
        slots[(int) (entry.index.getValue() - 1)] = next;
        next++;
      }
    }
    logger.fine(() -> "Compacting " + describe() + " from " + entries.size() + " to " + size);
    entries.subList(next, entries.size()).clear();
    holes = 0;
  }

  // Variable removal.

  /**
   * Removes {@code variable} from every constraint.
   *
   * <p>Terms on {@code variable} are dropped. {@code variable} is removed from every {@link
   * VectorOfVariables}, whose set dimension shrinks accordingly. The constraints {@link
   * SingleVariable} {@code variable} and {@link VectorOfVariables} {@code [variable]} are deleted.
   *
   * @return the indices of the deleted constraints
   * @throws ModelException.DeleteNotAllowed if {@code variable} belongs to a {@link
   *     VectorOfVariables} of more than one entry, {@code [variable, variable]} included, and a set
   *     that does not support dimension update
   */
  public ImmutableList<ConstraintIndex<F, S>> removeVariable(VariableIndex variable) {
    Preconditions.checkNotNull(variable);
    return filterVariables("removeVariable", v -> !v.equals(variable), false);
  }

  /**
   * Removes the variables that do not satisfy {@code keep} from every constraint, with the same
   * rules as {@link #removeVariable}, except that a {@link VectorOfVariables} losing all of its
   * entries is deleted whatever its size.
   *
   * @return the indices of the deleted constraints
   */
  public ImmutableList<ConstraintIndex<F, S>> filterVariables(Predicate<VariableIndex> keep) {
    return filterVariables("filterVariables", keep, true);
  }

  // With deleteEmptied, a group losing all of its entries is deleted; otherwise only a group of
  // one entry is.
  private ImmutableList<ConstraintIndex<F, S>> filterVariables(
      String methodName, Predicate<VariableIndex> keep, boolean deleteEmptied) {
    List<Entry<F, S>> changed = new ArrayList<>();
    List<Constraint<F, S>> replacements = new ArrayList<>();
    ImmutableList.Builder<ConstraintIndex<F, S>> deleted = ImmutableList.builder();
    for (Entry<F, S> entry : entries) {
      if (entry == null) {
        continue;
      }
      F function = entry.constraint.getFunction();
      S set = entry.constraint.getSet();
      switch (function.getKind()) {
        case SINGLE_VARIABLE:
          if (!keep.test(((SingleVariable) function).getVariable())) {
            deleted.add(entry.index);
          }
          break;
        case VECTOR_OF_VARIABLES: {
          List<VariableIndex> variables = ((VectorOfVariables) function).getVariables();
          VariableIndex firstRemoved = null;
          int kept = 0;
          for (VariableIndex v : variables) {
            if (keep.test(v)) {
              kept++;
            } else if (firstRemoved == null) {
              firstRemoved = v;
            }
          }
          if (firstRemoved == null) {
            break;
          }
          if (variables.size() == 1 || (deleteEmptied && kept == 0)) {
            deleted.add(entry.index);
          } else if (!set.supportsDimensionUpdate()) {
            throw new ModelException.DeleteNotAllowed(
                methodName,
                firstRemoved,
                "it is constrained with other variables in a VectorOfVariables-in-"
                    + setType.getSimpleName()
                    + " constraint");
          } else {
            F reduced = Functions.filterVariables(keep, function);
            changed.add(entry);
            replacements.add(
                Constraint.create(reduced, setType.cast(set.updateDimension(kept))));
          }
          break;
        }
        default: {
          F reduced = Functions.filterVariables(keep, function);
          if (!reduced.equals(function)) {
            changed.add(entry);
            replacements.add(Constraint.create(reduced, set));
          }
          break;
        }
      }
    }
    // Nothing was mutated above, so a refusal leaves the partition untouched.
    for (int i = 0; i < changed.size(); ++i) {
      changed.get(i).constraint = replacements.get(i);
    }
    ImmutableList<ConstraintIndex<F, S>> result = deleted.build();
    for (ConstraintIndex<F, S> index : result) {
      delete(index);
    }
    if (!changed.isEmpty() || !result.isEmpty()) {
      logger.fine(
          () ->
              "Variable removal in "
                  + describe()
                  + ": updated "
                  + changed.size()
                  + ", deleted "
                  + result.size());
    }
    return result;
  }

  // Index translation.

  private Entry<F, S> entry(String methodName, ConstraintIndex<?, ?> index) {
    return entries.get(slot(methodName, index));
  }

  private int slot(String methodName, ConstraintIndex<?, ?> index) {
    int slot = findSlot(index);
    if (slot == DELETED) {
      throw new ModelException.InvalidIndex(methodName, index);
    }
    return slot;
  }

  private int findSlot(ConstraintIndex<?, ?> index) {
    if (index == null
        || !index.getFunctionType().equals(functionType)
        || !index.getSetType().equals(setType)
        || index.getValue() < 1
        || index.getValue() > lastValue) {
      return DELETED;
    }
    return slots[(int) (index.getValue() - 1)];
  }

  private String describe() {
    return functionType.getSimpleName() + "-in-" + setType.getSimpleName();
  }

  @Override
  public String toString() {
    return "ConstraintPartition<" + describe() + ">(" + size + " constraints)";
  }
}
