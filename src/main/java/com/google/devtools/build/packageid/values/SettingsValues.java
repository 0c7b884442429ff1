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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.hash.HashCode;
import com.google.devtools.build.packageid.ContentHasher;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * A snapshot of build settings: platform, compiler and architecture configuration as {@code
 * name=value} pairs. Sub-settings use dotted names such as {@code compiler.version}.
 *
 * <p>Immutable; the pruning helpers return new snapshots.
 */
public final class SettingsValues {
  public static final SettingsValues EMPTY = new SettingsValues(ImmutableSortedMap.of());

  private final ImmutableSortedMap<String, String> values;

  private SettingsValues(ImmutableSortedMap<String, String> values) {
    this.values = values;
  }

  /**
   * Creates settings from {@code name -> value} entries.
   *
   * @throws IllegalArgumentException if an entry cannot be written as a {@code name=value} line
   *     that reads back unchanged: a blank name, a name with surrounding whitespace, {@code =} or a
   *     line break, a name starting with {@code #} or {@code [}, or a value with surrounding
   *     whitespace or a line break
   */
  public static SettingsValues of(Map<String, String> values) {
    values.forEach(ValueLines::checkEntry);
    return new SettingsValues(ImmutableSortedMap.copyOf(values));
  }

  /** Parses one {@code name=value} pair per non-blank line. Later duplicates win. */
  public static SettingsValues parse(String text) throws MalformedValuesException {
    TreeMap<String, String> values = new TreeMap<>();
    for (Map.Entry<String, String> entry : ValueLines.parse(text)) {
      values.put(entry.getKey(), entry.getValue());
    }
    return new SettingsValues(ImmutableSortedMap.copyOfSorted(values));
  }

  public SettingsValues copy() {
    return new SettingsValues(values);
  }

  /**
   * Returns a snapshot without the named settings. A name also drops its sub-settings: removing
   * {@code compiler} removes {@code compiler.version}.
   */
  public SettingsValues without(String... names) {
    ImmutableSet<String> removed = ImmutableSet.copyOf(names);
    return new SettingsValues(
        ImmutableSortedMap.copyOfSorted(
            Maps.filterKeys(
                values,
                name ->
                    removed.stream()
                        .noneMatch(r -> name.equals(r) || name.startsWith(r + ".")))));
  }

  @Nullable
  public String get(String name) {
    return values.get(name);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public HashCode identityHash() {
    return identityHash(ContentHasher.SHA1);
  }

  /**
   * Hashes the sorted {@code name=value} lines. {@code None} values are skipped, so that adding a
   * {@code None} choice to a setting leaves existing ids untouched.
   */
  public HashCode identityHash(ContentHasher hasher) {
    return hasher.hashString(ValueLines.identityBlock(values));
  }

  public String canonicalDump() {
    return ValueLines.NEWLINE.join(lines());
  }

  public ImmutableList<String> lines() {
    return ValueLines.lines(values);
  }

  public ImmutableSortedMap<String, String> toStructured() {
    return values;
  }

  public static SettingsValues fromStructured(Map<String, String> data) {
    return of(data);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SettingsValues && values.equals(((SettingsValues) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "SettingsValues" + values;
  }
}
