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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A name. Symbols are usually minted by a {@link GenSym}, which assigns each one a version that
 * makes it unique within the generator's scope; symbols created by the parser have version 0.
 *
 * <p>A symbol may be derived from another symbol (e.g. the copy of a node's tag when a graph is
 * duplicated), in which case {@code base} is the original and {@code label} is the relation that
 * connects them (such as {@code "+"}).
 */
public record Symbol(String label, @Nullable Symbol base, int version) implements Expr {

  public Symbol {
    Preconditions.checkNotNull(label);
    Preconditions.checkArgument(version >= 0);
  }

  /** Returns an unversioned, underived symbol with the given label. */
  public static Symbol of(String label) {
    return new Symbol(label, null, 0);
  }

  /**
   * Returns the label of the innermost base symbol, i.e. the name this symbol was ultimately
   * derived from.
   */
  public String rootLabel() {
    Symbol s = this;
    while (s.base != null) {
      s = s.base;
    }
    return s.label;
  }

  @Override
  public boolean isAtom() {
    return true;
  }

  @Override
  public <R, A> R accept(Visitor<R, A> visitor, A arg) {
    return visitor.visitSymbol(this, arg);
  }

  @Override
  public String toString() {
    String s = (base == null) ? label : base + label;
    return (version == 0) ? s : s + "#" + version;
  }
}
