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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CountingGenSymTest {

  @Test
  public void versionsCountPerName() {
    GenSym gen = new CountingGenSym();

    assertThat(gen.sym("a")).isEqualTo(new Symbol("a", null, 1));
    assertThat(gen.sym("a")).isEqualTo(new Symbol("a", null, 2));
    assertThat(gen.sym("b")).isEqualTo(new Symbol("b", null, 1));
  }

  @Test
  public void derivedSymbols() {
    GenSym gen = new CountingGenSym();
    Symbol add = Symbol.of("add");

    Symbol first = gen.sym(add, "/in1");
    Symbol second = gen.sym(add, "/in1");

    assertThat(first.base()).isSameInstanceAs(add);
    assertThat(first.toString()).isEqualTo("add/in1#1");
    assertThat(second.toString()).isEqualTo("add/in1#2");
    assertThat(gen.sym(add, "/out").version()).isEqualTo(1);
  }

  @Test
  public void generatorsAreIndependent() {
    GenSym gen1 = new CountingGenSym();
    GenSym gen2 = new CountingGenSym();

    gen1.sym("x");
    assertThat(gen2.sym("x").version()).isEqualTo(1);
  }
}
