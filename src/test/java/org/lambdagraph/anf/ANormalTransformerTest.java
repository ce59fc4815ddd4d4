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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lambdagraph.ast.Apply;
import org.lambdagraph.ast.Begin;
import org.lambdagraph.ast.Closure;
import org.lambdagraph.ast.CountingGenSym;
import org.lambdagraph.ast.Expr;
import org.lambdagraph.ast.GenSym;
import org.lambdagraph.ast.If;
import org.lambdagraph.ast.Lambda;
import org.lambdagraph.ast.Let;
import org.lambdagraph.ast.Let.Binding;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.ast.Tuple;
import org.lambdagraph.ast.Value;

@RunWith(JUnit4.class)
public class ANormalTransformerTest {

  private static final Symbol F = Symbol.of("f");
  private static final Symbol G = Symbol.of("g");
  private static final Symbol H = Symbol.of("h");
  private static final Symbol P = Symbol.of("p");
  private static final Symbol X = Symbol.of("x");
  private static final Symbol Y = Symbol.of("y");
  private static final Symbol A = Symbol.of("a");
  private static final Symbol B = Symbol.of("b");

  /** A GenSym that remembers the names it was asked for. */
  private static class RecordingGenSym extends CountingGenSym {
    final List<String> requested = new ArrayList<>();

    @Override
    public Symbol sym(String base) {
      requested.add(base);
      return super.sym(base);
    }
  }

  private static ImmutableList<String> labels(Let let) {
    return let.bindings().stream()
        .map(b -> b.symbol().label())
        .collect(ImmutableList.toImmutableList());
  }

  private static Let asLet(Expr expr) {
    assertThat(expr).isInstanceOf(Let.class);
    return (Let) expr;
  }

  @Test
  public void nestedApplicationIsHoisted() {
    Let let = asLet(ANormalForm.normalize(Apply.of(F, Apply.of(G, X))));

    assertThat(let.bindings()).hasSize(1);
    Binding binding = let.bindings().get(0);
    Symbol t = binding.symbol();
    assertThat(t.label()).isEqualTo("f/in1");
    assertThat(t).isNoneOf(F, G, X);
    assertThat(binding.value()).isEqualTo(Apply.of(G, X));
    assertThat(let.body()).isEqualTo(Apply.of(F, t));
  }

  @Test
  public void conditionIsBoundBeforeIf() {
    Let let = asLet(ANormalForm.normalize(new If(Apply.of(P, X), A, B)));

    assertThat(let.bindings()).hasSize(1);
    Symbol cond = let.bindings().get(0).symbol();
    assertThat(cond.label()).endsWith("/cond");
    assertThat(let.bindings().get(0).value()).isEqualTo(Apply.of(P, X));
    assertThat(let.body()).isEqualTo(new If(cond, A, B));
  }

  @Test
  public void branchesAreTagged() {
    Let let = asLet(ANormalForm.normalize(new If(P, Apply.of(G, X), Apply.of(H, Y))));

    assertThat(labels(let))
        .containsExactly("if/then", "if/else")
        .inOrder();
    assertThat(let.body())
        .isEqualTo(new If(P, let.bindings().get(0).symbol(), let.bindings().get(1).symbol()));
  }

  @Test
  public void deepNestingIsSequenced() {
    Let let = asLet(ANormalForm.normalize(Apply.of(F, Apply.of(G, Apply.of(H, X)))));

    assertThat(let.bindings()).hasSize(2);
    Binding first = let.bindings().get(0);
    Binding second = let.bindings().get(1);
    assertThat(first.symbol().label()).isEqualTo("g/in1");
    assertThat(first.value()).isEqualTo(Apply.of(H, X));
    assertThat(second.symbol().label()).isEqualTo("f/in1");
    assertThat(second.value()).isEqualTo(Apply.of(G, first.symbol()));
    assertThat(let.body()).isEqualTo(Apply.of(F, second.symbol()));
  }

  @Test
  public void atomsAreUnchanged() {
    assertThat(ANormalForm.normalize(X)).isSameInstanceAs(X);
    Value v = new Value(3);
    assertThat(ANormalForm.normalize(v)).isSameInstanceAs(v);
    Apply flat = Apply.of(F, X, new Value(1));
    assertThat(ANormalForm.normalize(flat)).isEqualTo(flat);
  }

  @Test
  public void compoundFunctionPosition() {
    Let let = asLet(ANormalForm.normalize(Apply.of(Apply.of(G, X), Apply.of(H, Y))));

    assertThat(labels(let))
        .containsExactly("g/out", "/in1")
        .inOrder();
    Symbol fn = let.bindings().get(0).symbol();
    assertThat(let.bindings().get(0).value()).isEqualTo(Apply.of(G, X));
    assertThat(let.body()).isEqualTo(Apply.of(fn, let.bindings().get(1).symbol()));
  }

  @Test
  public void namesFollowFunction() {
    Let reserved = asLet(ANormalForm.normalize(Apply.of(Symbol.of("#add"), Apply.of(G, X))));
    assertThat(reserved.bindings().get(0).symbol().label()).isEqualTo("#add/in1");

    Let truncated =
        asLet(ANormalForm.normalize(Apply.of(Symbol.of("add2"), X, Apply.of(G, X))));
    assertThat(truncated.bindings().get(0).symbol().label()).isEqualTo("add/in2");
  }

  @Test
  public void tupleAndClosureNames() {
    Let tuple = asLet(ANormalForm.normalize(Tuple.of(Apply.of(G, X), Y)));
    assertThat(tuple.bindings().get(0).symbol().label()).isEqualTo("tup/in1");
    assertThat(tuple.body()).isEqualTo(Tuple.of(tuple.bindings().get(0).symbol(), Y));

    // The closure's function counts as its first position.
    Let closure = asLet(ANormalForm.normalize(Closure.of(F, X, Apply.of(G, X))));
    assertThat(closure.bindings().get(0).symbol().label()).isEqualTo("closure/in3");
    assertThat(closure.body()).isEqualTo(Closure.of(F, X, closure.bindings().get(0).symbol()));
  }

  @Test
  public void lambdaBodyUsesLambdaGenerator() {
    RecordingGenSym outer = new RecordingGenSym();
    RecordingGenSym inner = new RecordingGenSym();
    Object ref = new Object();
    Lambda lambda =
        new Lambda(ImmutableList.of(P), Apply.of(G, Apply.of(H, P)), inner, ref);

    Let let = asLet(ANormalForm.normalize(Apply.of(F, lambda), outer));

    assertThat(outer.requested).containsExactly("f/in1");
    assertThat(inner.requested).containsExactly("g/in1");
    Expr hoisted = let.bindings().get(0).value();
    assertThat(hoisted).isInstanceOf(Lambda.class);
    Lambda result = (Lambda) hoisted;
    assertThat(result.ref()).isSameInstanceAs(ref);
    assertThat(result.gen()).isSameInstanceAs(inner);
    assertThat(result.args()).containsExactly(P);
    Let body = asLet(result.body());
    assertThat(body.bindings().get(0).value()).isEqualTo(Apply.of(H, P));
  }

  @Test
  public void lambdaInFunctionPositionIsNamedLambda() {
    Lambda lambda = new Lambda(ImmutableList.of(P), P, new CountingGenSym(), null);

    Let let = asLet(ANormalForm.normalize(Apply.of(lambda, X)));

    assertThat(let.bindings().get(0).symbol().label()).isEqualTo("lambda");
    assertThat(let.body()).isEqualTo(Apply.of(let.bindings().get(0).symbol(), X));
  }

  @Test
  public void letInFunctionPositionIsNamedLet() {
    Symbol v = Symbol.of("v");
    Let fnLet = Let.of(v, new Binding(v, G));

    Let let = asLet(ANormalForm.normalize(Apply.of(fnLet, X)));

    assertThat(labels(let))
        .containsExactly("v", "let")
        .inOrder();
    assertThat(let.body()).isEqualTo(Apply.of(let.bindings().get(1).symbol(), X));
  }

  @Test
  public void letBindingsAreNormalizedInPlace() {
    Symbol v = Symbol.of("v");
    Let source = Let.of(v, new Binding(v, Apply.of(F, Apply.of(G, X))));

    Let let = asLet(ANormalForm.normalize(source));

    assertThat(let.bindings()).hasSize(2);
    Symbol t = let.bindings().get(0).symbol();
    Symbol v1 = let.bindings().get(1).symbol();
    assertThat(let.bindings().get(0).value()).isEqualTo(Apply.of(G, X));
    assertThat(let.bindings().get(1).value()).isEqualTo(Apply.of(F, t));
    assertThat(v1.label()).isEqualTo("v");
    assertThat(v1).isNotEqualTo(v);
    assertThat(let.body()).isEqualTo(v1);
  }

  @Test
  public void letBindingsAreRenamed() {
    Symbol v = Symbol.of("v");
    Symbol derived = new Symbol("/out", F, 4);
    Let source = Let.of(Apply.of(v, derived), new Binding(v, G), new Binding(derived, X));

    Let let = asLet(ANormalForm.normalize(source));

    assertThat(let.bindings().get(0)).isEqualTo(new Binding(new Symbol("v", null, 1), G));
    assertThat(let.bindings().get(1)).isEqualTo(new Binding(new Symbol("/out", F, 1), X));
    assertThat(let.body())
        .isEqualTo(Apply.of(new Symbol("v", null, 1), new Symbol("/out", F, 1)));
  }

  @Test
  public void localLetDoesNotCaptureSiblingOperand() {
    Symbol add = Symbol.of("add");
    // add(let(x = 5; x), x)
    Expr source = Apply.of(add, Let.of(X, new Binding(X, new Value(5))), X);

    Expr result = ANormalForm.normalize(source);

    Map<Symbol, Object> env = new HashMap<>(ExprEvaluator.BUILTINS);
    env.put(X, 1);
    assertThat(ExprEvaluator.evaluate(source, env)).isEqualTo(6);
    assertThat(ExprEvaluator.evaluate(result, env)).isEqualTo(6);
  }

  @Test
  public void innerLetShadowsOnlyItsOwnBody() {
    Symbol add = Symbol.of("add");
    // let(x = 1; add(let(x = 10; add(x, x)), x))
    Expr source =
        Let.of(
            Apply.of(add, Let.of(Apply.of(add, X, X), new Binding(X, new Value(10))), X),
            new Binding(X, new Value(1)));

    Let let = asLet(ANormalForm.normalize(source));

    assertThat(ExprEvaluator.evaluate(let, ExprEvaluator.BUILTINS)).isEqualTo(21);
    Set<Symbol> bound = new HashSet<>();
    for (Binding binding : let.bindings()) {
      assertThat(bound.add(binding.symbol())).isTrue();
    }
  }

  @Test
  public void lambdaSeesRenamedOuterBinding() {
    Symbol add = Symbol.of("add");
    // let(x = 1; (lambda(p) add(let(x = 10; x), x))(100))
    Lambda lambda =
        new Lambda(
            ImmutableList.of(P),
            Apply.of(add, Let.of(X, new Binding(X, new Value(10))), X),
            new CountingGenSym(),
            null);
    Expr source = Let.of(Apply.of(lambda, new Value(100)), new Binding(X, new Value(1)));

    Expr result = ANormalForm.normalize(source);

    assertThat(ExprEvaluator.evaluate(result, ExprEvaluator.BUILTINS)).isEqualTo(11);
  }

  @Test
  public void lambdaArgumentShadowsOuterBinding() {
    Symbol add = Symbol.of("add");
    // let(x = 1; add((lambda(x) x)(7), x))
    Lambda lambda = new Lambda(ImmutableList.of(X), X, new CountingGenSym(), null);
    Expr source =
        Let.of(Apply.of(add, Apply.of(lambda, new Value(7)), X), new Binding(X, new Value(1)));

    Let let = asLet(ANormalForm.normalize(source));

    assertThat(ExprEvaluator.evaluate(let, ExprEvaluator.BUILTINS)).isEqualTo(8);
    Lambda normalizedLambda =
        let.bindings().stream()
            .map(Binding::value)
            .filter(Lambda.class::isInstance)
            .map(Lambda.class::cast)
            .findFirst()
            .orElseThrow();
    assertThat(normalizedLambda.body()).isEqualTo(X);
  }

  @Test
  public void beginDropsLeadingAtoms() {
    assertThat(ANormalForm.normalize(Begin.of(X, new Value(1), Apply.of(F, Y))))
        .isEqualTo(Apply.of(F, Y));
  }

  @Test
  public void beginIsSequenced() {
    Let let = asLet(ANormalForm.normalize(Begin.of(Apply.of(F, X), Y, Apply.of(G, Y))));

    assertThat(let.bindings()).hasSize(2);
    assertThat(labels(let))
        .containsExactly("_", "_")
        .inOrder();
    assertThat(let.bindings().get(0).value()).isEqualTo(Apply.of(F, X));
    assertThat(let.bindings().get(1).value()).isEqualTo(Apply.of(G, Y));
    assertThat(let.bindings().get(0).symbol()).isNotEqualTo(let.bindings().get(1).symbol());
    assertThat(let.body()).isEqualTo(let.bindings().get(1).symbol());
  }

  @Test
  public void transformerAloneLeavesNestedLets() {
    GenSym gen = new CountingGenSym();
    Expr result = new ANormalTransformer(gen).transform(Apply.of(F, Apply.of(G, Apply.of(H, X))));

    Let let = asLet(result);
    assertThat(let.bindings()).hasSize(1);
    assertThat(let.bindings().get(0).value()).isInstanceOf(Let.class);
    AnfVerifier.checkNormalized(result);
  }
}
