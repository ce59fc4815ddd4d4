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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.lambdagraph.ast.Apply;
import org.lambdagraph.ast.Begin;
import org.lambdagraph.ast.Closure;
import org.lambdagraph.ast.Expr;
import org.lambdagraph.ast.If;
import org.lambdagraph.ast.Lambda;
import org.lambdagraph.ast.Let;
import org.lambdagraph.ast.Let.Binding;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.ast.Tuple;
import org.lambdagraph.ast.Value;

/**
 * Flattens nested {@link Let}s, working bottom-up. If a binding's value is a Let, its bindings are
 * spliced in ahead of it and the binding keeps only the inner body; if a Let's body is a Let, the
 * two binding lists are concatenated. Evaluation order is unchanged.
 *
 * <p>After this pass no Let has a Let as a binding value or as its body.
 *
 * <p>Bindings are moved without renaming, so the result only means the same as the input if no
 * two of the spliced Lets bind the same symbol and no spliced binding shadows a variable used
 * further out. {@link ANormalTransformer} output always satisfies this.
 */
public class LetCollapser implements Expr.Visitor<Expr, Void> {

  public Expr transform(Expr node) {
    return node.accept(this, null);
  }

  private ImmutableList<Expr> transformAll(List<Expr> nodes) {
    return nodes.stream().map(this::transform).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Expr visitLet(Let node, Void unused) {
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    for (Binding b : node.bindings()) {
      Expr value = transform(b.value());
      if (value instanceof Let inner) {
        bindings.addAll(inner.bindings());
        value = inner.body();
      }
      bindings.add(new Binding(b.symbol(), value));
    }
    Expr body = transform(node.body());
    if (body instanceof Let inner) {
      bindings.addAll(inner.bindings());
      body = inner.body();
    }
    return new Let(bindings.build(), body);
  }

  @Override
  public Expr visitSymbol(Symbol node, Void unused) {
    return node;
  }

  @Override
  public Expr visitValue(Value node, Void unused) {
    return node;
  }

  @Override
  public Expr visitLambda(Lambda node, Void unused) {
    return node.withBody(transform(node.body()));
  }

  @Override
  public Expr visitApply(Apply node, Void unused) {
    return new Apply(transform(node.fn()), transformAll(node.args()));
  }

  @Override
  public Expr visitTuple(Tuple node, Void unused) {
    return new Tuple(transformAll(node.values()));
  }

  @Override
  public Expr visitIf(If node, Void unused) {
    return new If(transform(node.cond()), transform(node.ifTrue()), transform(node.ifFalse()));
  }

  @Override
  public Expr visitClosure(Closure node, Void unused) {
    // The captured values are already atoms.
    return node;
  }

  @Override
  public Expr visitBegin(Begin node, Void unused) {
    return new Begin(transformAll(node.stmts()));
  }
}
