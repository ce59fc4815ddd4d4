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

import java.util.regex.Pattern;
import org.lambdagraph.ast.Expr;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.ast.Value;

/**
 * Static-only class that chooses the readable base names used for the symbols {@link
 * ANormalTransformer} introduces. The choices only affect how generated names print, never what
 * the program computes.
 */
public class NameDerivation {

  private NameDerivation() {}

  /** Names starting with this character are used verbatim. */
  public static final char RESERVED_MARKER = '#';

  /** Labels containing this character are paths (usually names we generated ourselves). */
  private static final char PATH_SEPARATOR = '/';

  private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z_]");

  /** Returns the base name to use for the operands of an application of {@code fn}. */
  public static String baseName(Expr fn) {
    if (fn instanceof Symbol symbol) {
      return baseName(symbol.rootLabel());
    } else if (fn instanceof Value value) {
      return baseName(String.valueOf(value.value()));
    }
    // Compound expressions in function position are hoisted before we get here.
    return "";
  }

  /**
   * Returns the base name for a label: empty if it is a path, the whole label if it starts with
   * {@link #RESERVED_MARKER}, and otherwise the label up to its first non-identifier character.
   */
  public static String baseName(String label) {
    if (label.indexOf(PATH_SEPARATOR) >= 0) {
      return "";
    } else if (!label.isEmpty() && label.charAt(0) == RESERVED_MARKER) {
      return label;
    }
    return NON_IDENTIFIER.split(label, 2)[0];
  }

  /** Returns the name for the operand with the given tag, e.g. {@code "f/in2"}. */
  public static String operandName(String base, String tag) {
    return base + PATH_SEPARATOR + tag;
  }

  /** Returns the name for the result of an operation, e.g. {@code "f/out"}. */
  public static String outName(String base) {
    return operandName(base, "out");
  }

  /** Returns the default tag ({@code "in1"}, {@code "in2"}, ...) for operand {@code index}. */
  public static String defaultTag(int index) {
    return "in" + (index + 1);
  }
}
