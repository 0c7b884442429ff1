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

package com.google.devtools.build.packageid.ref;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Names one built package: {@code name/version[@user/channel][:package_identity]}.
 *
 * <p>References are immutable, totally ordered and round-trip through their text form, so they
 * serve both as map keys and as sort keys. {@code user} and {@code channel} are either both set or
 * both absent.
 *
 * <p>Name, version, user and channel are at most {@value #MAX_COMPONENT_LENGTH} characters long,
 * the limit of the package repositories these references are exchanged with. A full 40-character
 * commit hash fits as a version; longer digests belong in the package identity, which is unbounded.
 */
@AutoValue
public abstract class ComponentRef implements Comparable<ComponentRef> {

  public static final int MAX_COMPONENT_LENGTH = 51;

  private static final String COMPONENT =
      "[A-Za-z0-9_][A-Za-z0-9_+.-]{0," + (MAX_COMPONENT_LENGTH - 1) + "}";
  private static final String PACKAGE_IDENTITY = "[A-Za-z0-9_.+-]+";

  private static final Pattern COMPONENT_PATTERN = Pattern.compile(COMPONENT);
  private static final Pattern PACKAGE_IDENTITY_PATTERN = Pattern.compile(PACKAGE_IDENTITY);
  private static final Pattern REFERENCE_PATTERN =
      Pattern.compile(
          String.format(
              "(%1$s)/(%1$s)(?:@(%1$s)/(%1$s))?(?::(%2$s))?", COMPONENT, PACKAGE_IDENTITY));

  private static final Ordering<String> NULLS_FIRST = Ordering.<String>natural().nullsFirst();

  public abstract String name();

  public abstract String version();

  @Nullable
  public abstract String user();

  @Nullable
  public abstract String channel();

  @Nullable
  public abstract String packageIdentity();

  public static ComponentRef create(String name, String version) {
    return create(name, version, null, null, null);
  }

  public static ComponentRef create(
      String name,
      String version,
      @Nullable String user,
      @Nullable String channel,
      @Nullable String packageIdentity) {
    checkArgument(COMPONENT_PATTERN.matcher(name).matches(), "Invalid name: %s", name);
    checkArgument(COMPONENT_PATTERN.matcher(version).matches(), "Invalid version: %s", version);
    checkArgument(
        (user == null) == (channel == null),
        "user and channel must be set together: %s, %s",
        user,
        channel);
    checkArgument(
        user == null || COMPONENT_PATTERN.matcher(user).matches(), "Invalid user: %s", user);
    checkArgument(
        channel == null || COMPONENT_PATTERN.matcher(channel).matches(),
        "Invalid channel: %s",
        channel);
    checkArgument(
        packageIdentity == null || PACKAGE_IDENTITY_PATTERN.matcher(packageIdentity).matches(),
        "Invalid package identity: %s",
        packageIdentity);
    return new AutoValue_ComponentRef(name, version, user, channel, packageIdentity);
  }

  /** Parses the text form produced by {@link #toString}. Surrounding whitespace is ignored. */
  public static ComponentRef parse(String text) throws MalformedReferenceException {
    Matcher matcher = REFERENCE_PATTERN.matcher(text.trim());
    if (!matcher.matches()) {
      throw new MalformedReferenceException(text);
    }
    return new AutoValue_ComponentRef(
        matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4), matcher.group(5));
  }

  /** Returns this reference with the package identity dropped. */
  public ComponentRef withoutPackageIdentity() {
    if (packageIdentity() == null) {
      return this;
    }
    return new AutoValue_ComponentRef(name(), version(), user(), channel(), null);
  }

  @Override
  public int compareTo(ComponentRef other) {
    return ComparisonChain.start()
        .compare(name(), other.name())
        .compare(version(), other.version())
        .compare(user(), other.user(), NULLS_FIRST)
        .compare(channel(), other.channel(), NULLS_FIRST)
        .compare(packageIdentity(), other.packageIdentity(), NULLS_FIRST)
        .result();
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder().append(name()).append('/').append(version());
    if (user() != null) {
      sb.append('@').append(user()).append('/').append(channel());
    }
    if (packageIdentity() != null) {
      sb.append(':').append(packageIdentity());
    }
    return sb.toString();
  }
}
