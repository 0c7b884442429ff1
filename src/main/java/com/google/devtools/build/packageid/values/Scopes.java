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
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Free-form scope values of a build: {@code dev=True} for the consumer, {@code Pkg:dev=False} for a
 * single package. Recorded with an identity but never hashed.
 */
public final class Scopes {
  public static final Scopes EMPTY = new Scopes(QualifiedValues.EMPTY);

  private static final String DEV = "dev";

  private final QualifiedValues values;

  private Scopes(QualifiedValues values) {
    this.values = values;
  }

  public static Scopes parse(String text) throws MalformedValuesException {
    return new Scopes(QualifiedValues.parse(text));
  }

  public static Scopes of(Map<String, String> values) {
    return new Scopes(QualifiedValues.fromFlatMap(values));
  }

  @Nullable
  public String get(String name) {
    return values.own.get(name);
  }

  @Nullable
  public String get(String pkg, String name) {
    Map<String, String> packageValues = values.byPackage.get(pkg);
    return packageValues == null ? null : packageValues.get(name);
  }

  public boolean isEmpty() {
    return values.own.isEmpty() && values.byPackage.isEmpty();
  }

  /** Whether the consumer scope has {@code dev=True}. */
  public boolean isDev() {
    return Boolean.parseBoolean(get(DEV));
  }

  public String canonicalDump() {
    return ValueLines.NEWLINE.join(lines());
  }

  public ImmutableList<String> lines() {
    return values.lines();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Scopes && values.equals(((Scopes) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Scopes{" + values + "}";
  }
}
