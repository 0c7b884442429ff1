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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.HashCode;
import com.google.devtools.build.packageid.ContentHasher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A snapshot of feature-flag values: the package's own options ({@code shared=True}) and the
 * options it sets on its dependencies ({@code Boost:threading=multi}).
 *
 * <p>Options set on dependencies are indirect: they were inherited rather than declared by the
 * package, and {@link #clearIndirect} drops them from the identity snapshot.
 */
public final class OptionsValues {
  public static final OptionsValues EMPTY = new OptionsValues(QualifiedValues.EMPTY);

  private final QualifiedValues values;

  private OptionsValues(QualifiedValues values) {
    this.values = values;
  }

  public static OptionsValues parse(String text) throws MalformedValuesException {
    return new OptionsValues(QualifiedValues.parse(text));
  }

  /**
   * Creates options from {@code name -> value} and {@code Pkg:name -> value} entries.
   *
   * @throws IllegalArgumentException if an entry cannot be written as a line that reads back
   *     unchanged, as for {@link SettingsValues#of}
   */
  public static OptionsValues of(Map<String, String> values) {
    return new OptionsValues(QualifiedValues.fromFlatMap(values));
  }

  public OptionsValues copy() {
    return new OptionsValues(values);
  }

  /** Returns a copy without any option set on a dependency. */
  public OptionsValues clearIndirect() {
    return new OptionsValues(values.withoutPackages());
  }

  @Nullable
  public String get(String name) {
    return values.own.get(name);
  }

  /** The options set on {@code pkg}, empty if none. */
  public ImmutableSortedMap<String, String> getPackageOptions(String pkg) {
    return values.byPackage.getOrDefault(pkg, ImmutableSortedMap.of());
  }

  public HashCode identityHash(@Nullable Set<String> relevanceFilter) {
    return identityHash(relevanceFilter, ContentHasher.SHA1);
  }

  /**
   * Hashes the own options block followed by one block per dependency, dependencies in name order.
   * With a relevance filter only the listed dependencies take part. {@code None} values are
   * skipped.
   */
  public HashCode identityHash(@Nullable Set<String> relevanceFilter, ContentHasher hasher) {
    List<String> blocks = new ArrayList<>();
    blocks.add(ValueLines.identityBlock(values.own));
    values.byPackage.forEach(
        (pkg, packageValues) -> {
          if (relevanceFilter == null || relevanceFilter.contains(pkg)) {
            blocks.add(ValueLines.identityBlock(packageValues));
          }
        });
    return hasher.hashString(ValueLines.NEWLINE.join(blocks));
  }

  public String canonicalDump() {
    return ValueLines.NEWLINE.join(lines());
  }

  public ImmutableList<String> lines() {
    return values.lines();
  }

  public ImmutableMap<String, String> toStructured() {
    return values.toFlatMap();
  }

  public static OptionsValues fromStructured(Map<String, String> data) {
    return of(data);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OptionsValues && values.equals(((OptionsValues) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "OptionsValues{" + values + "}";
  }
}
