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

package org.lambdagraph.anf;

import com.google.common.flogger.FluentLogger;
import org.lambdagraph.ast.CountingGenSym;
import org.lambdagraph.ast.Expr;
import org.lambdagraph.ast.GenSym;

/** Static-only entry point for converting an expression tree to A-normal form. */
public class ANormalForm {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private ANormalForm() {}

  /**
   * Returns an equivalent expression in A-normal form: every operand is an atom, and every
   * intermediate result is bound, in evaluation order, by a single flat {@link
   * org.lambdagraph.ast.Let} per scope. So {@code f(g(x))} becomes
   *
   * <pre>
   *   let(f/in1#1 = g(x); f(f/in1#1))
   * </pre>
   *
   * <p>Names introduced outside of any lambda come from a new {@link CountingGenSym}.
   */
  public static Expr normalize(Expr node) {
    return normalize(node, new CountingGenSym());
  }

  /**
   * As {@link #normalize(Expr)}, but names introduced outside of any lambda come from {@code gen}.
   */
  public static Expr normalize(Expr node, GenSym gen) {
    logger.atFine().log("Normalizing %s", node);
    Expr result = new ANormalTransformer(gen).transform(node);
    result = new LetCollapser().transform(result);
    logger.atFine().log("Normalized to %s", result);
    return result;
  }
}
