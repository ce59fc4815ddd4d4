/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lambdagraph.ir;

import com.google.common.base.Preconditions;

/**
 * The position an edge occupies on the node it starts from: either the function position ({@link
 * #FN}) or the index of one of the node's inputs ({@link #input}).
 */
public final class Role {

  /** The role of the edge to the function a computation applies. */
  public static final Role FN = new Role(-1);

  private static final Role[] SMALL_INPUTS = new Role[8];

  static {
    for (int i = 0; i < SMALL_INPUTS.length; i++) {
      SMALL_INPUTS[i] = new Role(i);
    }
  }

  /** -1 for FN, otherwise the input index. */
  private final int index;

  private Role(int index) {
    this.index = index;
  }

  /** Returns the role of the edge to input {@code index}. */
  public static Role input(int index) {
    Preconditions.checkArgument(index >= 0, "Invalid input index %s", index);
    return (index < SMALL_INPUTS.length) ? SMALL_INPUTS[index] : new Role(index);
  }

  public boolean isFn() {
    return index < 0;
  }

  /** Returns the input index; only valid if this is not {@link #FN}. */
  public int index() {
    Preconditions.checkState(index >= 0, "FN has no index");
    return index;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Role role && role.index == index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public String toString() {
    return isFn() ? "FN" : "IN(" + index + ")";
  }
}
