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

import java.util.HashMap;
import java.util.Map;

/**
 * A simple {@link GenSym} that keeps a counter for each name it has been asked for, and uses the
 * next value of the counter as the new symbol's version. Since parser-created symbols have version
 * 0 and the counters start at 1, the results never collide with them.
 */
public class CountingGenSym implements GenSym {

  /** Maps each printed base name to the last version assigned for it. */
  private final Map<String, Integer> counters = new HashMap<>();

  private int next(String key) {
    return counters.merge(key, 1, Integer::sum);
  }

  @Override
  public Symbol sym(String base) {
    return new Symbol(base, null, next(base));
  }

  @Override
  public Symbol sym(Symbol base, String relation) {
    return new Symbol(relation, base, next(base + relation));
  }
}
