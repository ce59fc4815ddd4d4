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

/**
 * Mints fresh symbols. Each GenSym is scoped to one lexical unit (a function or graph); symbols
 * returned by the same GenSym are distinct from each other and from any symbol the parser created
 * in that scope.
 */
public interface GenSym {

  /** Returns a fresh symbol whose name is derived from {@code base}. */
  Symbol sym(String base);

  /**
   * Returns a fresh symbol derived from the existing symbol {@code base}, marked with {@code
   * relation} to indicate how the two are related.
   */
  Symbol sym(Symbol base, String relation);
}
