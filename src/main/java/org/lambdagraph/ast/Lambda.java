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
import org.jspecify.annotations.Nullable;
import org.lambdagraph.util.StringUtil;

/**
 * A nested function. Each Lambda has its own {@link GenSym}, which is used for any names created
 * while transforming its body.
 *
 * <p>{@code ref} is an opaque provenance reference (e.g. to the source definition); it is ignored
 * by all passes except that they copy it to the Lambdas they rebuild.
 */
public record Lambda(ImmutableList<Symbol> args, Expr body, GenSym gen, @Nullable Object ref)
    implements Expr {

  /** Returns a Lambda with the same arguments, generator, and provenance but a different body. */
  public Lambda withBody(Expr newBody) {
    return new Lambda(args, newBody, gen, ref);
  }

  @Override
  public <R, A> R accept(Visitor<R, A> visitor, A arg) {
    return visitor.visitLambda(this, arg);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("lambda(", ") " + body, args);
  }
}
