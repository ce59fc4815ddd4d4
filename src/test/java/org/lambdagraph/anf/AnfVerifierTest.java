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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lambdagraph.ast.Apply;
import org.lambdagraph.ast.Begin;
import org.lambdagraph.ast.Closure;
import org.lambdagraph.ast.CountingGenSym;
import org.lambdagraph.ast.If;
import org.lambdagraph.ast.Lambda;
import org.lambdagraph.ast.Let;
import org.lambdagraph.ast.Let.Binding;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.ast.Tuple;
import org.lambdagraph.ast.Value;

@RunWith(JUnit4.class)
public class AnfVerifierTest {

  private static final Symbol F = Symbol.of("f");
  private static final Symbol X = Symbol.of("x");

  @Test
  public void atomicOperandsAreAccepted() {
    AnfVerifier.checkNormalized(
        Let.of(
            new Tuple(ImmutableList.of(X, new Value(2))),
            new Binding(Symbol.of("t"), Apply.of(F, X)),
            new Binding(Symbol.of("u"), new If(X, F, new Value(0))),
            new Binding(Symbol.of("c"), Closure.of(F, X))));
  }

  @Test
  public void compoundOperandIsRejected() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> AnfVerifier.checkNormalized(Apply.of(F, Apply.of(F, X))));
    assertThat(e).hasMessageThat().contains("f(x)");

    assertThrows(
        IllegalStateException.class,
        () -> AnfVerifier.checkNormalized(new If(Apply.of(F, X), X, X)));
    assertThrows(
        IllegalStateException.class,
        () -> AnfVerifier.checkNormalized(Closure.of(Apply.of(F), X)));
  }

  @Test
  public void lambdaBodiesAreChecked() {
    Lambda lambda =
        new Lambda(ImmutableList.of(X), Tuple.of(Tuple.of(X)), new CountingGenSym(), null);

    assertThrows(IllegalStateException.class, () -> AnfVerifier.checkNormalized(lambda));
  }

  @Test
  public void beginIsRejected() {
    assertThrows(IllegalStateException.class, () -> AnfVerifier.checkNormalized(Begin.of(X)));
  }

  @Test
  public void nestedLetIsNotFlat() {
    Symbol a = Symbol.of("a");
    Let inner = Let.of(a, new Binding(a, X));

    assertThrows(
        IllegalStateException.class,
        () -> AnfVerifier.checkFlat(Let.of(a, new Binding(a, inner))));
    assertThrows(IllegalStateException.class, () -> AnfVerifier.checkFlat(Let.of(inner)));
    AnfVerifier.checkFlat(inner);
  }
}
