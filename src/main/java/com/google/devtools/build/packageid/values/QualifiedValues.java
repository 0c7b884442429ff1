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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.TreeMap;

/**
 * Values of the package itself plus values qualified by another package name, written {@code
 * name=value} and {@code Pkg:name=value} respectively.
 */
final class QualifiedValues {
  static final QualifiedValues EMPTY =
      new QualifiedValues(ImmutableSortedMap.of(), ImmutableSortedMap.of());

  private static final char QUALIFIER = ':';

  final ImmutableSortedMap<String, String> own;
  final ImmutableSortedMap<String, ImmutableSortedMap<String, String>> byPackage;

  QualifiedValues(
      ImmutableSortedMap<String, String> own,
      ImmutableSortedMap<String, ImmutableSortedMap<String, String>> byPackage) {
    this.own = own;
    this.byPackage = byPackage;
  }

  static QualifiedValues parse(String text) throws MalformedValuesException {
    Builder builder = new Builder();
    for (Map.Entry<String, String> entry : ValueLines.parse(text)) {
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /** Reads the flat form produced by {@link #toFlatMap}. */
  static QualifiedValues fromFlatMap(Map<String, String> data) {
    Builder builder = new Builder();
    data.forEach(builder::put);
    return builder.build();
  }

  QualifiedValues withoutPackages() {
    return new QualifiedValues(own, ImmutableSortedMap.of());
  }

  /** Own values first, then each package's values, packages in name order. */
  ImmutableList<String> lines() {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    result.addAll(ValueLines.lines(own));
    byPackage.forEach(
        (pkg, values) ->
            values.forEach((name, value) -> result.add(pkg + QUALIFIER + name + "=" + value)));
    return result.build();
  }

  ImmutableMap<String, String> toFlatMap() {
    ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
    result.putAll(own);
    byPackage.forEach(
        (pkg, values) ->
            values.forEach((name, value) -> result.put(pkg + QUALIFIER + name, value)));
    return result.buildOrThrow();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof QualifiedValues)) {
      return false;
    }
    QualifiedValues that = (QualifiedValues) o;
    return own.equals(that.own) && byPackage.equals(that.byPackage);
  }

  @Override
  public int hashCode() {
    return 31 * own.hashCode() + byPackage.hashCode();
  }

  @Override
  public String toString() {
    return own + " " + byPackage;
  }

  /** Accumulates values; later assignments of the same name win. */
  static final class Builder {
    private final TreeMap<String, String> own = new TreeMap<>();
    private final TreeMap<String, TreeMap<String, String>> byPackage = new TreeMap<>();

    /**
     * Puts {@code value} under {@code key}, which is either {@code name} or {@code Pkg:name}.
     *
     * @throws IllegalArgumentException if the pair cannot be written as a text line
     */
    @CanIgnoreReturnValue
    Builder put(String key, String value) {
      ValueLines.checkEntry(key, value);
      int index = key.indexOf(QUALIFIER);
      if (index < 0) {
        own.put(key, value);
      } else {
        byPackage
            .computeIfAbsent(key.substring(0, index), pkg -> new TreeMap<>())
            .put(key.substring(index + 1), value);
      }
      return this;
    }

    QualifiedValues build() {
      ImmutableSortedMap.Builder<String, ImmutableSortedMap<String, String>> packages =
          ImmutableSortedMap.naturalOrder();
      byPackage.forEach(
          (pkg, values) -> packages.put(pkg, ImmutableSortedMap.copyOfSorted(values)));
      return new QualifiedValues(ImmutableSortedMap.copyOfSorted(own), packages.buildOrThrow());
    }
  }
}
