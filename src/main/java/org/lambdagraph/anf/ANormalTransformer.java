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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.lambdagraph.ast.Apply;
import org.lambdagraph.ast.Begin;
import org.lambdagraph.ast.Closure;
import org.lambdagraph.ast.Expr;
import org.lambdagraph.ast.GenSym;
import org.lambdagraph.ast.If;
import org.lambdagraph.ast.Lambda;
import org.lambdagraph.ast.Let;
import org.lambdagraph.ast.Let.Binding;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.ast.Tuple;
import org.lambdagraph.ast.Value;

/**
 * Rewrites an expression so that every operand (function, argument, condition or branch, tuple
 * element, closure capture) is an atom. Each compound operand is replaced by a fresh symbol that
 * is bound to it by an enclosing {@link Let}.
 *
 * <p>For example {@code f(g(x))} becomes {@code let(f/in1 = g(x); f(f/in1))}.
 *
 * <p>Each visit method takes a {@link Stash}, which is null if the caller can accept a compound
 * result in place (the top level, and the bodies and binding values of {@link Let} and {@link
 * Lambda}). Otherwise the result is bound to a new symbol, appended to the stash's bindings, and
 * the symbol is returned instead.
 *
 * <p>Every symbol bound by a {@link Let} is replaced by a fresh one, so that no two bindings in the
 * result share a symbol. This lets {@link LetCollapser} move bindings into an enclosing Let without
 * capturing a reference to some other variable with the same name.
 *
 * <p>The result may contain {@link Let}s nested in binding values or bodies; {@link LetCollapser}
 * flattens them.
 */
public class ANormalTransformer implements Expr.Visitor<Expr, ANormalTransformer.@Nullable Stash> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Tags for the condition and branches of an {@link If}, in order. */
  private static final ImmutableList<String> IF_TAGS = ImmutableList.of("cond", "then", "else");

  /** Used to create every symbol this transformer introduces. */
  private final GenSym gen;

  /** Maps each Let-bound symbol currently in scope to the symbol that replaces it. */
  private final Map<Symbol, Symbol> renamed;

  /**
   * Replacement symbols chosen by the transformers of enclosing scopes. They may be referenced from
   * this scope, so new replacements must not reuse them.
   */
  private final ImmutableSet<Symbol> reserved;

  public ANormalTransformer(GenSym gen) {
    this(gen, new HashMap<>(), ImmutableSet.of());
  }

  private ANormalTransformer(
      GenSym gen, Map<Symbol, Symbol> renamed, ImmutableSet<Symbol> reserved) {
    this.gen = Preconditions.checkNotNull(gen);
    this.renamed = renamed;
    this.reserved = reserved;
  }

  /**
   * Where a non-atomic result should be saved: a binding will be appended to {@code bindings},
   * with a symbol named {@code name} (or a default chosen by the node's visit method if {@code
   * name} is null).
   */
  public static final class Stash {
    final @Nullable String name;
    final List<Binding> bindings;

    Stash(@Nullable String name, List<Binding> bindings) {
      this.name = name;
      this.bindings = bindings;
    }
  }

  /** Transforms {@code node} in a position that accepts a compound result. */
  public Expr transform(Expr node) {
    return transform(node, null);
  }

  Expr transform(Expr node, @Nullable Stash stash) {
    return node.accept(this, stash);
  }

  /**
   * If {@code stash} is null returns {@code result}; otherwise binds {@code result} to a new
   * symbol and returns the symbol.
   */
  private Expr stash(@Nullable Stash stash, Expr result, String defaultName) {
    if (stash == null) {
      return result;
    }
    Symbol sym = newSym(stash.name != null ? stash.name : defaultName);
    logger.atFinest().log("hoisting %s as %s", result, sym);
    stash.bindings.add(new Binding(sym, result));
    return sym;
  }

  /**
   * Transforms each of the operands in {@code positions}, stashing the compound ones, and rebuilds
   * the node by calling {@code constructor} with the (now atomic) results.
   *
   * @param baseName if null, the first element of {@code positions} is a function and the base
   *     name for the other operands will be derived from it; otherwise all positions are treated
   *     alike
   * @param tags the tag of each (non-function) operand, or null to use {@code in1}, {@code in2},
   *     ...
   */
  private Expr transformArguments(
      List<Expr> positions,
      Function<ImmutableList<Expr>, Expr> constructor,
      @Nullable Stash stash,
      @Nullable String baseName,
      @Nullable List<String> tags) {
    List<Binding> bindings = new ArrayList<>();
    ImmutableList.Builder<Expr> newArgs = ImmutableList.builder();
    List<Expr> args = positions;
    if (baseName == null) {
      Expr fn = transform(positions.get(0), new Stash(null, bindings));
      newArgs.add(fn);
      baseName = NameDerivation.baseName(fn);
      args = positions.subList(1, positions.size());
    }
    assert tags == null || tags.size() == args.size();
    for (int i = 0; i < args.size(); i++) {
      String tag = (tags == null) ? NameDerivation.defaultTag(i) : tags.get(i);
      String inputName = NameDerivation.operandName(baseName, tag);
      newArgs.add(transform(args.get(i), new Stash(inputName, bindings)));
    }
    Expr app = constructor.apply(newArgs.build());
    Expr result = bindings.isEmpty() ? app : new Let(ImmutableList.copyOf(bindings), app);
    return stash(stash, result, NameDerivation.outName(baseName));
  }

  @Override
  public Expr visitApply(Apply node, @Nullable Stash stash) {
    List<Expr> positions = new ArrayList<>(node.args().size() + 1);
    positions.add(node.fn());
    positions.addAll(node.args());
    return transformArguments(
        positions, args -> new Apply(args.get(0), args.subList(1, args.size())), stash, null, null);
  }

  @Override
  public Expr visitSymbol(Symbol node, @Nullable Stash stash) {
    return renamed.getOrDefault(node, node);
  }

  @Override
  public Expr visitValue(Value node, @Nullable Stash stash) {
    return node;
  }

  @Override
  public Expr visitLambda(Lambda node, @Nullable Stash stash) {
    // The body gets its own transformer so that new names come from the lambda's scope. It sees
    // the enclosing replacements, except for those shadowed by the lambda's arguments.
    Map<Symbol, Symbol> visible = new HashMap<>(renamed);
    visible.keySet().removeAll(node.args());
    ANormalTransformer inner =
        new ANormalTransformer(node.gen(), visible, ImmutableSet.copyOf(visible.values()));
    return stash(stash, node.withBody(inner.transform(node.body())), "lambda");
  }

  @Override
  public Expr visitIf(If node, @Nullable Stash stash) {
    return transformArguments(
        ImmutableList.of(node.cond(), node.ifTrue(), node.ifFalse()),
        args -> new If(args.get(0), args.get(1), args.get(2)),
        stash,
        "if",
        IF_TAGS);
  }

  @Override
  public Expr visitLet(Let node, @Nullable Stash stash) {
    return stash(stash, transformLet(node, true), "let");
  }

  /**
   * Transforms each binding value and the body in place. If {@code rename} is true each bound
   * symbol is replaced by a fresh one, which is used for references to it from later bindings and
   * from the body.
   */
  private Let transformLet(Let node, boolean rename) {
    Map<Symbol, Symbol> saved = new HashMap<>(renamed);
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    for (Binding b : node.bindings()) {
      Expr value = transform(b.value());
      Symbol sym = b.symbol();
      if (rename) {
        sym = freshCopy(sym);
        renamed.put(b.symbol(), sym);
      }
      bindings.add(new Binding(sym, value));
    }
    Let result = new Let(bindings.build(), transform(node.body()));
    renamed.clear();
    renamed.putAll(saved);
    return result;
  }

  /** Returns a new symbol named {@code base} that is not one of the {@link #reserved} symbols. */
  private Symbol newSym(String base) {
    Symbol result;
    do {
      result = gen.sym(base);
    } while (reserved.contains(result));
    return result;
  }

  /** Returns a new symbol with the same label and base as {@code sym}. */
  private Symbol freshCopy(Symbol sym) {
    if (sym.base() == null) {
      Symbol result = newSym(sym.label());
      return result.equals(sym) ? newSym(sym.label()) : result;
    }
    Symbol result;
    do {
      result = gen.sym(sym.base(), sym.label());
    } while (reserved.contains(result) || result.equals(sym));
    return result;
  }

  @Override
  public Expr visitTuple(Tuple node, @Nullable Stash stash) {
    return transformArguments(node.values(), Tuple::new, stash, "tup", null);
  }

  @Override
  public Expr visitClosure(Closure node, @Nullable Stash stash) {
    List<Expr> positions = new ArrayList<>(node.args().size() + 1);
    positions.add(node.fn());
    positions.addAll(node.args());
    return transformArguments(
        positions,
        args -> new Closure(args.get(0), args.subList(1, args.size())),
        stash,
        "closure",
        null);
  }

  @Override
  public Expr visitBegin(Begin node, @Nullable Stash stash) {
    // Atoms other than the last have no effect, so they can be dropped.
    ImmutableList<Expr> all = node.stmts();
    List<Expr> stmts = new ArrayList<>();
    for (Expr stmt : all.subList(0, all.size() - 1)) {
      if (!stmt.isAtom()) {
        stmts.add(stmt);
      }
    }
    stmts.add(all.get(all.size() - 1));
    if (stmts.size() == 1) {
      return transform(stmts.get(0), stash);
    }
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    Symbol last = null;
    for (Expr stmt : stmts) {
      last = newSym("_");
      bindings.add(new Binding(last, stmt));
    }
    // These symbols are already fresh.
    return stash(stash, transformLet(new Let(bindings.build(), last), false), "let");
  }
}
