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

package com.google.optmodel;

/**
 * Base class of the errors raised by the function algebra and the constraint storage.
 *
 * <p>The message is always {@code "<method>: <detail>"}.
 */
public class ModelException extends RuntimeException {
  public ModelException(String methodName, String msg) {
    super(methodName + ": " + msg);
  }

  /** Exception thrown when a constraint index was never issued, was deleted, or is foreign. */
  public static class InvalidIndex extends ModelException {
    public InvalidIndex(String methodName, Object index) {
      super(methodName, "invalid constraint index " + index);
    }
  }

  /** Exception thrown when a modification does not apply to the kind of the function. */
  public static class UnsupportedModification extends ModelException {
    public UnsupportedModification(String methodName, Object change, Object functionKind) {
      super(methodName, "cannot apply " + change + " to a function of kind " + functionKind);
    }
  }

  /** Exception thrown when removing a variable would corrupt a fixed-dimension constraint. */
  public static class DeleteNotAllowed extends ModelException {
    private final VariableIndex variable;

    public DeleteNotAllowed(String methodName, VariableIndex variable, String msg) {
      super(methodName, "cannot delete variable " + variable + ": " + msg);
      this.variable = variable;
    }

    /** Returns the variable whose removal was refused. */
    public VariableIndex getVariable() {
      return variable;
    }
  }

  /** Exception thrown when a function or set is not of the kind a partition stores. */
  public static class TypeMismatch extends ModelException {
    public TypeMismatch(String methodName, Class<?> expected, Class<?> actual) {
      super(
          methodName,
          "expected " + expected.getSimpleName() + " but got " + actual.getSimpleName());
    }
  }

  /** Exception thrown when two dimensions that must agree differ. */
  public static class DimensionMismatch extends ModelException {
    public DimensionMismatch(String methodName, int expected, int actual) {
      super(methodName, "expected dimension " + expected + " but got " + actual);
    }

    public DimensionMismatch(String methodName, String msg) {
      super(methodName, msg);
    }
  }
}
