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

/**
 * Sequential local bindings. The bindings are evaluated in order, each one may refer to the
 * symbols bound before it, and {@code body} is evaluated last.
 */
public record Let(ImmutableList<Binding> bindings, Expr body) implements Expr {

  /** Binds {@code symbol} to the result of {@code value}. */
  public record Binding(Symbol symbol, Expr value) {
    @Override
    public String toString() {
      return symbol + " = " + value;
    }
  }

  public static Let of(Expr body, Binding... bindings) {
    return new Let(ImmutableList.copyOf(bindings), body);
  }

  @Override
  public <R, A> R accept(Visitor<R, A> visitor, A arg) {
    return visitor.visitLet(this, arg);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("let(", "; " + body + ")", bindings);
  }
}
