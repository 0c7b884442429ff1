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

package com.google.devtools.build.packageid;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the ini-like canonical text of a {@link BuildIdentity}: {@code [section]}
 * headers, each followed by its body indented by four spaces.
 */
final class IdentitySections {
  static final String SETTINGS = "settings";
  static final String REQUIRES = "requires";
  static final String OPTIONS = "options";
  static final String FULL_SETTINGS = "full_settings";
  static final String FULL_REQUIRES = "full_requires";
  static final String FULL_OPTIONS = "full_options";
  static final String SCOPE = "scope";

  /** Section order of the canonical text. Part of the format; never reorder. */
  static final ImmutableList<String> ORDER =
      ImmutableList.of(
          SETTINGS, REQUIRES, OPTIONS, FULL_SETTINGS, FULL_REQUIRES, FULL_OPTIONS, SCOPE);

  private static final String INDENT = "    ";

  private final ImmutableMap<String, ImmutableList<String>> sections;

  private IdentitySections(ImmutableMap<String, ImmutableList<String>> sections) {
    this.sections = sections;
  }

  /**
   * Splits {@code text} into sections. Blank lines and {@code #} comments are ignored and body
   * lines are trimmed.
   *
   * @throws MalformedIdentityFileException if a section is unknown, repeated or missing, or if
   *     content precedes the first header
   */
  static IdentitySections parse(String text) throws MalformedIdentityFileException {
    Map<String, ImmutableList.Builder<String>> bodies = new LinkedHashMap<>();
    ImmutableList.Builder<String> current = null;
    for (String rawLine : text.lines().collect(toImmutableList())) {
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("[") && line.endsWith("]")) {
        String name = line.substring(1, line.length() - 1).trim();
        if (!ORDER.contains(name)) {
          throw new MalformedIdentityFileException("Unrecognized section [" + name + "]", name);
        }
        if (bodies.containsKey(name)) {
          throw new MalformedIdentityFileException("Duplicated section [" + name + "]", name);
        }
        current = ImmutableList.builder();
        bodies.put(name, current);
      } else if (current == null) {
        throw new MalformedIdentityFileException(
            "Content before the first section: '" + line + "'", ORDER.get(0));
      } else {
        current.add(line);
      }
    }

    ImmutableMap.Builder<String, ImmutableList<String>> sections = ImmutableMap.builder();
    for (String name : ORDER) {
      ImmutableList.Builder<String> body = bodies.get(name);
      if (body == null) {
        throw new MalformedIdentityFileException("Missing section [" + name + "]", name);
      }
      sections.put(name, body.build());
    }
    return new IdentitySections(sections.buildOrThrow());
  }

  ImmutableList<String> lines(String section) {
    return sections.get(section);
  }

  String body(String section) {
    return Joiner.on('\n').join(lines(section));
  }

  /**
   * Renders sections in {@link #ORDER}. Every header but the first is preceded by a blank line. A
   * {@code null} body omits the body entirely, while an empty body still leaves an empty line.
   */
  static String dump(Map<String, String> bodies) {
    List<String> result = new ArrayList<>();
    for (String name : ORDER) {
      result.add(result.isEmpty() ? "[" + name + "]" : "\n[" + name + "]");
      String body = bodies.get(name);
      if (body != null) {
        result.add(indent(body));
      }
    }
    return Joiner.on('\n').join(result);
  }

  private static String indent(String text) {
    return Joiner.on('\n').join(text.lines().map(line -> INDENT + line).iterator());
  }
}
