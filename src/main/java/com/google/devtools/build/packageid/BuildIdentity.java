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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.common.hash.HashCode;
import com.google.devtools.build.packageid.ref.ComponentRef;
import com.google.devtools.build.packageid.ref.MalformedReferenceException;
import com.google.devtools.build.packageid.requires.RequirementManifest;
import com.google.devtools.build.packageid.requires.RequirementSet;
import com.google.devtools.build.packageid.values.MalformedValuesException;
import com.google.devtools.build.packageid.values.OptionsValues;
import com.google.devtools.build.packageid.values.Scopes;
import com.google.devtools.build.packageid.values.SettingsValues;
import com.google.errorprone.annotations.concurrent.LazyInit;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The identity of one unit of build output, reduced on demand to its package id: the cache key
 * under which the built artifact is stored and reused.
 *
 * <p>An identity holds two views of each input. The pruned views ({@link #getSettings}, {@link
 * #getOptions}, {@link #getRequires}) feed the package id; the full views are kept for provenance.
 * Options set on dependencies are cleared from the pruned options, and indirect requirements
 * contribute no version information.
 *
 * <p>Instances are built once per build evaluation and must not be mutated afterwards: the package
 * id is computed on first use and never recomputed. Instances are not thread-safe.
 */
public final class BuildIdentity {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final SettingsValues settings;
  private final SettingsValues fullSettings;
  private final OptionsValues options;
  private final OptionsValues fullOptions;
  private final RequirementSet requires;
  private final RequirementManifest fullRequires;
  @Nullable private final Scopes scope;
  @Nullable private final ImmutableSet<String> relevanceFilter;
  private final ContentHasher hasher;

  @LazyInit @Nullable private HashCode packageIdentity;

  private BuildIdentity(
      SettingsValues settings,
      SettingsValues fullSettings,
      OptionsValues options,
      OptionsValues fullOptions,
      RequirementSet requires,
      RequirementManifest fullRequires,
      @Nullable Scopes scope,
      @Nullable ImmutableSet<String> relevanceFilter,
      ContentHasher hasher) {
    this.settings = checkNotNull(settings);
    this.fullSettings = checkNotNull(fullSettings);
    this.options = checkNotNull(options);
    this.fullOptions = checkNotNull(fullOptions);
    this.requires = checkNotNull(requires);
    this.fullRequires = checkNotNull(fullRequires);
    this.scope = scope;
    this.relevanceFilter = relevanceFilter;
    this.hasher = checkNotNull(hasher);
  }

  public static BuildIdentity create(
      SettingsValues settings,
      OptionsValues options,
      Iterable<ComponentRef> directRequires,
      Iterable<ComponentRef> indirectRequires,
      @Nullable Set<String> relevanceFilter) {
    return create(
        settings, options, directRequires, indirectRequires, relevanceFilter, ContentHasher.SHA1);
  }

  /**
   * Assembles an identity from resolved build inputs.
   *
   * @param directRequires the requirements declared by the package
   * @param indirectRequires the transitive requirements, folded in after the direct ones
   * @param relevanceFilter names of the requirements that take part in the package id, or {@code
   *     null} if all of them do
   * @param hasher content-hash primitive for the package id and its parts
   */
  public static BuildIdentity create(
      SettingsValues settings,
      OptionsValues options,
      Iterable<ComponentRef> directRequires,
      Iterable<ComponentRef> indirectRequires,
      @Nullable Set<String> relevanceFilter,
      ContentHasher hasher) {
    ImmutableList<ComponentRef> direct = ImmutableList.copyOf(directRequires);
    ImmutableList<ComponentRef> indirect = ImmutableList.copyOf(indirectRequires);
    RequirementManifest fullRequires = RequirementManifest.of(direct);
    fullRequires.extend(indirect);
    RequirementSet requires = RequirementSet.create(direct, relevanceFilter);
    requires.addIndirect(indirect);
    return new BuildIdentity(
        settings.copy(),
        settings,
        options.clearIndirect(),
        options,
        requires,
        fullRequires,
        /* scope= */ null,
        relevanceFilter == null ? null : ImmutableSet.copyOf(relevanceFilter),
        hasher);
  }

  public static BuildIdentity parse(String text)
      throws MalformedIdentityFileException, MalformedReferenceException {
    return parse(text, ContentHasher.SHA1);
  }

  /**
   * Parses the output of {@link #canonicalDump}.
   *
   * <p>The requirement records are rebuilt from {@code [full_requires]}; the {@code [requires]}
   * lines only decide which of them are direct and which names were tagged {@code DEV}. When no
   * line is tagged the relevance filter is absent.
   *
   * @throws MalformedIdentityFileException if a section is missing or its body does not parse
   * @throws MalformedReferenceException if a full requirement is not a valid reference
   */
  public static BuildIdentity parse(String text, ContentHasher hasher)
      throws MalformedIdentityFileException, MalformedReferenceException {
    IdentitySections sections = IdentitySections.parse(text);
    RequirementManifest fullRequires =
        RequirementManifest.parse(sections.lines(IdentitySections.FULL_REQUIRES));
    RequirementSet requires =
        RequirementSet.recover(fullRequires, sections.lines(IdentitySections.REQUIRES));
    Scopes scope;
    SettingsValues settings;
    SettingsValues fullSettings;
    OptionsValues options;
    OptionsValues fullOptions;
    String section = IdentitySections.SETTINGS;
    try {
      settings = SettingsValues.parse(sections.body(section));
      section = IdentitySections.FULL_SETTINGS;
      fullSettings = SettingsValues.parse(sections.body(section));
      section = IdentitySections.OPTIONS;
      options = OptionsValues.parse(sections.body(section));
      section = IdentitySections.FULL_OPTIONS;
      fullOptions = OptionsValues.parse(sections.body(section));
      section = IdentitySections.SCOPE;
      scope = Scopes.parse(sections.body(section));
    } catch (MalformedValuesException e) {
      throw new MalformedIdentityFileException(
          "Invalid [" + section + "] section: " + e.getMessage(), section, e);
    }
    return new BuildIdentity(
        settings,
        fullSettings,
        options,
        fullOptions,
        requires,
        fullRequires,
        scope,
        requires.getRelevanceFilter().orElse(null),
        hasher);
  }

  /**
   * Reads and parses the identity file at {@code path}.
   *
   * @throws MissingIdentityFileException if the file cannot be read
   */
  public static BuildIdentity loadFromPath(Path path)
      throws MissingIdentityFileException,
          MalformedIdentityFileException,
          MalformedReferenceException {
    String text;
    try {
      text = Files.readString(path, UTF_8);
    } catch (IOException e) {
      throw new MissingIdentityFileException(path, e);
    }
    logger.atFine().log("Loaded identity file %s", path);
    return parse(text);
  }

  /**
   * Rebuilds an identity from its structured form. Requirements all come back direct, and the
   * relevance filter and scope are absent.
   */
  public static BuildIdentity fromStructured(StructuredIdentity data)
      throws MalformedReferenceException {
    return new BuildIdentity(
        SettingsValues.fromStructured(data.settings()),
        SettingsValues.fromStructured(data.fullSettings()),
        OptionsValues.fromStructured(data.options()),
        OptionsValues.fromStructured(data.fullOptions()),
        RequirementSet.fromStructured(data.requires()),
        RequirementManifest.fromStructured(data.fullRequires()),
        /* scope= */ null,
        /* relevanceFilter= */ null,
        ContentHasher.SHA1);
  }

  /** Returns an identity equal to this one except for its scope. */
  public BuildIdentity withScope(@Nullable Scopes newScope) {
    return new BuildIdentity(
        settings,
        fullSettings,
        options,
        fullOptions,
        requires.copy(),
        fullRequires.copy(),
        newScope,
        relevanceFilter,
        hasher);
  }

  /**
   * The package id: the content hash of the settings, options and requirements hashes, in that
   * order and joined by newlines. The order is part of the id scheme.
   *
   * <p>Computed on first call and cached.
   */
  public HashCode packageIdentity() {
    HashCode result = packageIdentity;
    if (result == null) {
      String parts =
          settings.identityHash(hasher)
              + "\n"
              + options.identityHash(relevanceFilter, hasher)
              + "\n"
              + requires.identityHash(hasher);
      result = hasher.hashString(parts);
      packageIdentity = result;
      logger.atFine().log("Computed package id %s over %d requirements", result, requires.size());
    }
    return result;
  }

  /** {@link #packageIdentity} as a lowercase hex string. */
  public String packageId() {
    return packageIdentity().toString();
  }

  /** The canonical text: seven sections in fixed order, bodies indented by four spaces. */
  public String canonicalDump() {
    Map<String, String> bodies = new HashMap<>();
    bodies.put(IdentitySections.SETTINGS, settings.canonicalDump());
    bodies.put(IdentitySections.REQUIRES, requires.canonicalDump());
    bodies.put(IdentitySections.OPTIONS, options.canonicalDump());
    bodies.put(IdentitySections.FULL_SETTINGS, fullSettings.canonicalDump());
    bodies.put(IdentitySections.FULL_REQUIRES, fullRequires.canonicalDump());
    bodies.put(IdentitySections.FULL_OPTIONS, fullOptions.canonicalDump());
    if (scope != null && !scope.isEmpty()) {
      bodies.put(IdentitySections.SCOPE, scope.canonicalDump());
    }
    return IdentitySections.dump(bodies);
  }

  /** The structured form. Scope is not part of it. */
  public StructuredIdentity toStructured() {
    return new StructuredIdentity(
        settings.toStructured(),
        fullSettings.toStructured(),
        options.toStructured(),
        fullOptions.toStructured(),
        requires.toStructured(),
        fullRequires.toStructured());
  }

  public SettingsValues getSettings() {
    return settings;
  }

  public SettingsValues getFullSettings() {
    return fullSettings;
  }

  public OptionsValues getOptions() {
    return options;
  }

  public OptionsValues getFullOptions() {
    return fullOptions;
  }

  public RequirementSet getRequires() {
    return requires;
  }

  public RequirementManifest getFullRequires() {
    return fullRequires;
  }

  @Nullable
  public Scopes getScope() {
    return scope;
  }

  /**
   * Textual equality: two identities are equal iff their canonical dumps are. Logically equivalent
   * identities with differently formatted parts compare unequal.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof BuildIdentity
        && canonicalDump().equals(((BuildIdentity) o).canonicalDump());
  }

  @Override
  public int hashCode() {
    return canonicalDump().hashCode();
  }

  @Override
  public String toString() {
    return canonicalDump();
  }
}
