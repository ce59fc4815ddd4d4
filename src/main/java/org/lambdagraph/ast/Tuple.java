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

package org.lambdagraph.ast;

import com.google.common.collect.ImmutableList;
import org.lambdagraph.util.StringUtil;

/** A tuple constructor. */
public record Tuple(ImmutableList<Expr> values) implements Expr {

  public static Tuple of(Expr... values) {
    return new Tuple(ImmutableList.copyOf(values));
  }

  @Override
  public <R, A> R accept(Visitor<R, A> visitor, A arg) {
    return visitor.visitTuple(this, arg);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("(", ")", values);
  }
}
