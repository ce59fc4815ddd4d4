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

/**
 * A node of the expression tree produced by the parser. Every Expr is immutable once built.
 *
 * <p>The set of variants is closed: {@link Apply}, {@link Symbol}, {@link Value}, {@link Let},
 * {@link Lambda}, {@link If}, {@link Tuple}, {@link Closure}, and {@link Begin}. Passes over the
 * tree implement {@link Visitor}, which has one method per variant, so a pass that does not handle
 * some kind of node will not compile.
 *
 * <p>{@link Symbol} and {@link Value} are <i>atoms</i>; every other variant is compound.
 */
public interface Expr {

  /** Calls the {@code visitor} method that corresponds to this node's variant. */
  <R, A> R accept(Visitor<R, A> visitor, A arg);

  /** True if this is a {@link Symbol} or a {@link Value}. */
  default boolean isAtom() {
    return false;
  }

  /**
   * A pass over the expression tree. {@code A} is the type of an extra argument threaded through
   * the dispatch (passes that don't need one use {@code Void} and pass null).
   */
  interface Visitor<R, A> {
    R visitApply(Apply node, A arg);

    R visitSymbol(Symbol node, A arg);

    R visitValue(Value node, A arg);

    R visitLet(Let node, A arg);

    R visitLambda(Lambda node, A arg);

    R visitIf(If node, A arg);

    R visitTuple(Tuple node, A arg);

    R visitClosure(Closure node, A arg);

    R visitBegin(Begin node, A arg);
  }
}
