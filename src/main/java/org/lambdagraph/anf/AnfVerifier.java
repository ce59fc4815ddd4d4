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

import com.google.common.base.Preconditions;
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
 * Checks the shape of a tree returned by {@link ANormalForm#normalize}. Each check throws an
 * IllegalStateException describing the first violation it finds.
 */
public class AnfVerifier {

  private AnfVerifier() {}

  /**
   * Throws if any operand of an {@link Apply}, {@link If}, {@link Tuple}, or {@link Closure} in
   * {@code node} is not an atom, or if {@code node} contains a {@link Begin}.
   */
  public static void checkNormalized(Expr node) {
    node.accept(NORMALIZED, null);
  }

  /** Throws if any {@link Let} in {@code node} has a Let as a binding value or as its body. */
  public static void checkFlat(Expr node) {
    node.accept(FLAT, null);
  }

  private static void checkAtoms(Expr parent, List<Expr> operands) {
    for (Expr operand : operands) {
      Preconditions.checkState(
          operand.isAtom(), "Operand %s of %s is not an atom", operand, parent);
    }
  }

  /** Walks every node, calling {@link #check} on each compound one before visiting its children. */
  private abstract static class Walker implements Expr.Visitor<Void, Void> {

    abstract void check(Expr node);

    private void walk(List<Expr> nodes) {
      nodes.forEach(n -> n.accept(this, null));
    }

    @Override
    public Void visitApply(Apply node, Void unused) {
      check(node);
      node.fn().accept(this, null);
      walk(node.args());
      return null;
    }

    @Override
    public Void visitSymbol(Symbol node, Void unused) {
      return null;
    }

    @Override
    public Void visitValue(Value node, Void unused) {
      return null;
    }

    @Override
    public Void visitLet(Let node, Void unused) {
      check(node);
      for (Binding b : node.bindings()) {
        b.value().accept(this, null);
      }
      node.body().accept(this, null);
      return null;
    }

    @Override
    public Void visitLambda(Lambda node, Void unused) {
      check(node);
      node.body().accept(this, null);
      return null;
    }

    @Override
    public Void visitIf(If node, Void unused) {
      check(node);
      walk(List.of(node.cond(), node.ifTrue(), node.ifFalse()));
      return null;
    }

    @Override
    public Void visitTuple(Tuple node, Void unused) {
      check(node);
      walk(node.values());
      return null;
    }

    @Override
    public Void visitClosure(Closure node, Void unused) {
      check(node);
      node.fn().accept(this, null);
      walk(node.args());
      return null;
    }

    @Override
    public Void visitBegin(Begin node, Void unused) {
      check(node);
      walk(node.stmts());
      return null;
    }
  }

  private static final Walker NORMALIZED =
      new Walker() {
        @Override
        void check(Expr node) {
          if (node instanceof Apply apply) {
            checkAtoms(node, List.of(apply.fn()));
            checkAtoms(node, apply.args());
          } else if (node instanceof If ifNode) {
            checkAtoms(node, List.of(ifNode.cond(), ifNode.ifTrue(), ifNode.ifFalse()));
          } else if (node instanceof Tuple tuple) {
            checkAtoms(node, tuple.values());
          } else if (node instanceof Closure closure) {
            checkAtoms(node, List.of(closure.fn()));
            checkAtoms(node, closure.args());
          } else if (node instanceof Begin) {
            throw new IllegalStateException("Unexpected " + node);
          }
        }
      };

  private static final Walker FLAT =
      new Walker() {
        @Override
        void check(Expr node) {
          if (node instanceof Let let) {
            for (Binding b : let.bindings()) {
              Preconditions.checkState(
                  !(b.value() instanceof Let), "Binding of %s is a nested let", b.symbol());
            }
            Preconditions.checkState(!(let.body() instanceof Let), "Body of %s is a let", let);
          }
        }
      };
}
