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

/**
 * An algebraic function of the decision variables.
 *
 * <p>The set of implementations is closed, see {@link FunctionKind}. Functions are immutable and
 * compared structurally: two functions are equal when they hold the same terms in the same order.
 * Use {@link Canonicalizer#canonical} before comparing functions built in different ways.
 */
public interface Function {
  /** Returns the kind of the function. */
  FunctionKind getKind();

  /** Returns the number of rows of the function, 1 for scalar functions. */
  int getOutputDimension();
}
