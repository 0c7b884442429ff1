// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.devtools.build.packageid.values;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Reading and writing of {@code name=value} lines. */
final class ValueLines {
  /** Values equal to this literal never reach a hash. */
  static final String NONE = "None";

  static final Joiner NEWLINE = Joiner.on('\n');

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();
  private static final Splitter ASSIGNMENT_SPLITTER = Splitter.on('=').limit(2).trimResults();

  private static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\n\r");
  private static final CharMatcher NAME_BREAKERS = CharMatcher.anyOf("=\n\r");
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private ValueLines() {}

  /**
   * Returns why {@code name=value} would not read back unchanged from an indented text section, or
   * {@code null} if it would.
   */
  @Nullable
  static String invalidEntry(String name, String value) {
    if (name.isBlank()) {
      return "Empty name";
    }
    if (!isTrimmed(name)) {
      return "Name has surrounding whitespace";
    }
    if (NAME_BREAKERS.matchesAnyOf(name)) {
      return "Name contains '=' or a line break";
    }
    if (name.startsWith("#") || name.startsWith("[")) {
      return "Name starts with '#' or '['";
    }
    if (!isTrimmed(value)) {
      return "Value has surrounding whitespace";
    }
    if (LINE_BREAKS.matchesAnyOf(value)) {
      return "Value contains a line break";
    }
    return null;
  }

  // Both trims are applied on the way back in: String.trim() per section line, WHITESPACE per part.
  private static boolean isTrimmed(String text) {
    return text.equals(text.trim()) && text.equals(WHITESPACE.trimFrom(text));
  }

  /** Fails with {@link IllegalArgumentException} where {@link #invalidEntry} finds a problem. */
  static void checkEntry(String name, String value) {
    String problem = invalidEntry(name, value);
    checkArgument(problem == null, "%s: '%s=%s'", problem, name, value);
  }

  /** Parses non-blank lines of {@code text} into (name, value) pairs, in order. */
  static ImmutableList<Map.Entry<String, String>> parse(String text)
      throws MalformedValuesException {
    ImmutableList.Builder<Map.Entry<String, String>> result = ImmutableList.builder();
    for (String line : LINE_SPLITTER.split(text)) {
      List<String> parts = ASSIGNMENT_SPLITTER.splitToList(line);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        throw new MalformedValuesException("Expected name=value", line);
      }
      String problem = invalidEntry(parts.get(0), parts.get(1));
      if (problem != null) {
        throw new MalformedValuesException(problem, line);
      }
      result.add(Map.entry(parts.get(0), parts.get(1)));
    }
    return result.build();
  }

  /** {@code name=value} lines of {@code values}, in iteration order. */
  static ImmutableList<String> lines(Map<String, String> values) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    values.forEach((name, value) -> result.add(name + "=" + value));
    return result.build();
  }

  /** Like {@link #lines} but skipping {@link #NONE} values. */
  static String identityBlock(Map<String, String> values) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    values.forEach(
        (name, value) -> {
          if (!NONE.equals(value)) {
            result.add(name + "=" + value);
          }
        });
    return NEWLINE.join(result.build());
  }
}
