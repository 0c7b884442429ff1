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

package com.google.devtools.build.packageid.requires;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.devtools.build.packageid.ref.ComponentRef;
import com.google.devtools.build.packageid.ref.MalformedReferenceException;
import com.google.devtools.build.packageid.ref.Versions;
import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * The contribution of one dependency to a package identity.
 *
 * <p>The full reference is always kept verbatim. What feeds the hash depends on the variant: a
 * {@link Direct} record contributes its name and stabilized version, an {@link Indirect} record
 * contributes nothing, so that a version change deep in the graph does not invalidate packages
 * that never declared it.
 */
public abstract class RequirementRecord {
  private static final Joiner SLASH = Joiner.on('/');

  private final ComponentRef fullRef;

  private RequirementRecord(ComponentRef fullRef) {
    this.fullRef = checkNotNull(fullRef);
  }

  /**
   * Parses {@code text} as a {@link ComponentRef} and wraps it in a record.
   *
   * @throws MalformedReferenceException if {@code text} is not a valid reference
   */
  public static RequirementRecord parse(String text, boolean indirect)
      throws MalformedReferenceException {
    return of(ComponentRef.parse(text), indirect);
  }

  public static RequirementRecord parse(String text) throws MalformedReferenceException {
    return parse(text, /* indirect= */ false);
  }

  public static RequirementRecord of(ComponentRef ref, boolean indirect) {
    return indirect ? new Indirect(ref) : new Direct(ref);
  }

  public abstract boolean isIndirect();

  @Nullable
  public abstract String name();

  @Nullable
  public abstract String version();

  @Nullable
  public abstract String user();

  @Nullable
  public abstract String channel();

  @Nullable
  public abstract String packageIdentity();

  /**
   * The non-empty identity fields among name, version, user, channel and package identity, in that
   * order, joined by {@code /}. Empty for an indirect record.
   */
  public String identityLine() {
    return SLASH.join(
        Arrays.stream(new String[] {name(), version(), user(), channel(), packageIdentity()})
            .filter(field -> !Strings.isNullOrEmpty(field))
            .collect(ImmutableList.toImmutableList()));
  }

  /** The verbatim reference text. Never pruned. */
  public String toFullText() {
    return fullRef.toString();
  }

  public ComponentRef getFullRef() {
    return fullRef;
  }

  public String getFullName() {
    return fullRef.name();
  }

  public String getFullVersion() {
    return fullRef.version();
  }

  @Nullable
  public String getFullUser() {
    return fullRef.user();
  }

  @Nullable
  public String getFullChannel() {
    return fullRef.channel();
  }

  @Nullable
  public String getFullPackageIdentity() {
    return fullRef.packageIdentity();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ref", fullRef)
        .add("identity", identityLine())
        .toString();
  }

  /** A dependency declared by the package itself. */
  public static final class Direct extends RequirementRecord {
    private final String name;
    private final String version;
    // Not populated by any current path; identityLine() still honors them.
    @Nullable private final String user;
    @Nullable private final String channel;
    @Nullable private final String packageIdentity;

    private Direct(ComponentRef ref) {
      super(ref);
      this.name = ref.name();
      this.version = Versions.stabilize(ref.version());
      this.user = null;
      this.channel = null;
      this.packageIdentity = null;
    }

    @Override
    public boolean isIndirect() {
      return false;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String version() {
      return version;
    }

    @Override
    @Nullable
    public String user() {
      return user;
    }

    @Override
    @Nullable
    public String channel() {
      return channel;
    }

    @Override
    @Nullable
    public String packageIdentity() {
      return packageIdentity;
    }
  }

  /** A dependency inherited transitively. Contributes no identity fields. */
  public static final class Indirect extends RequirementRecord {
    private Indirect(ComponentRef ref) {
      super(ref);
    }

    @Override
    public boolean isIndirect() {
      return true;
    }

    @Override
    @Nullable
    public String name() {
      return null;
    }

    @Override
    @Nullable
    public String version() {
      return null;
    }

    @Override
    @Nullable
    public String user() {
      return null;
    }

    @Override
    @Nullable
    public String channel() {
      return null;
    }

    @Override
    @Nullable
    public String packageIdentity() {
      return null;
    }

    @Override
    public String identityLine() {
      return "";
    }
  }
}
