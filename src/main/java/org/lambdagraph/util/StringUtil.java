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

package org.lambdagraph.util;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Static-only class with methods for printing expressions and graph elements. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling {@code String.valueOf()} on each element of the given list,
   * separating them with {@code ", "}, and adding the given prefix and suffix.
   */
  public static String joinElements(String prefix, String suffix, List<?> elements) {
    return elements.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  private static final Pattern NEEDS_ESCAPE = Pattern.compile("[\"\b\t\n\f\r\\\\]");

  private static String escapeChar(MatchResult mr, String s) {
    return switch (s.charAt(mr.start())) {
      case '\"' -> "\\\\\"";
      case '\\' -> "\\\\\\\\";
      case '\b' -> "\\\\b";
      case '\t' -> "\\\\t";
      case '\n' -> "\\\\n";
      case '\f' -> "\\\\f";
      case '\r' -> "\\\\r";
      default -> throw new AssertionError();
    };
  }

  /** Given a string, return an equivalent quoted string literal. */
  public static String escape(String s) {
    if (s == null) {
      return "null";
    }
    Matcher m = NEEDS_ESCAPE.matcher(s);
    String escaped = m.replaceAll(mr -> escapeChar(mr, s));
    return "\"" + escaped + "\"";
  }

  /**
   * Call {@link String#valueOf} but swallow any errors; intended for formatting error messages when
   * the structure being printed is already known to be in a bad state.
   */
  public static String safeToString(Object x) {
    try {
      return String.valueOf(x);
    } catch (RuntimeException | AssertionError nested) {
      return "(can't print)";
    }
  }
}
