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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.flogger.GoogleLogger;
import com.google.common.hash.HashCode;
import com.google.devtools.build.packageid.ContentHasher;
import com.google.devtools.build.packageid.ref.ComponentRef;
import com.google.devtools.build.packageid.ref.MalformedReferenceException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nullable;

/**
 * The requirements of a package, keyed by full {@link ComponentRef}.
 *
 * <p>A relevance filter partitions the keys: when present, only requirements whose name is in the
 * filter feed the hash, the rest are dev requirements that are still listed (tagged {@code DEV})
 * in the canonical dump. When absent, every requirement is relevant.
 *
 * <p>Hashing and dumping always walk the keys in ascending order, so the result does not depend on
 * insertion order.
 */
public final class RequirementSet {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String DEV_MARKER = " DEV";

  private static final Joiner NEWLINE = Joiner.on('\n');
  private static final Splitter NAME_SPLITTER = Splitter.on('/').limit(2);

  private final TreeMap<ComponentRef, RequirementRecord> records = new TreeMap<>();
  @Nullable private final ImmutableSet<String> relevanceFilter;

  private RequirementSet(@Nullable ImmutableSet<String> relevanceFilter) {
    this.relevanceFilter = relevanceFilter;
  }

  /**
   * Creates a set with one direct record per reference in {@code directRefs}.
   *
   * @param relevanceFilter names of the identity-relevant requirements, or {@code null} if all of
   *     them are relevant
   */
  public static RequirementSet create(
      Iterable<ComponentRef> directRefs, @Nullable Set<String> relevanceFilter) {
    RequirementSet result =
        new RequirementSet(relevanceFilter == null ? null : ImmutableSet.copyOf(relevanceFilter));
    for (ComponentRef ref : directRefs) {
      result.records.put(ref, RequirementRecord.of(ref, /* indirect= */ false));
    }
    return result;
  }

  /**
   * Adds one indirect record per reference. An existing entry for the same key is replaced: later
   * calls win.
   */
  public void addIndirect(Iterable<ComponentRef> indirectRefs) {
    for (ComponentRef ref : indirectRefs) {
      RequirementRecord previous =
          records.put(ref, RequirementRecord.of(ref, /* indirect= */ true));
      if (previous != null && !previous.isIndirect()) {
        logger.atFine().log("Direct requirement %s replaced by indirect record", ref);
      }
    }
  }

  /** Returns an independent set with the same records and relevance filter. */
  public RequirementSet copy() {
    RequirementSet result = new RequirementSet(relevanceFilter);
    result.records.putAll(records);
    return result;
  }

  /** Snapshot of the current keys. */
  public ImmutableList<ComponentRef> allRefs() {
    return ImmutableList.copyOf(records.keySet());
  }

  @Nullable
  public RequirementRecord get(ComponentRef ref) {
    return records.get(ref);
  }

  public int size() {
    return records.size();
  }

  public Optional<ImmutableSet<String>> getRelevanceFilter() {
    return Optional.ofNullable(relevanceFilter);
  }

  /** Whether the requirement named by {@code ref} feeds the identity hash. */
  public boolean isRelevant(ComponentRef ref) {
    return relevanceFilter == null || relevanceFilter.contains(ref.name());
  }

  /**
   * Returns the single record whose reference text starts with {@code prefix}. {@code "Boost"}
   * matches both {@code Boost/1.0} and {@code BoostExtra/2.0}, so include the version when the
   * name alone is a prefix of another requirement.
   *
   * @throws AmbiguousRequirementException if zero or several references match
   */
  public RequirementRecord lookupByNamePrefix(String prefix)
      throws AmbiguousRequirementException {
    List<ComponentRef> matches = new ArrayList<>();
    for (ComponentRef ref : records.keySet()) {
      if (ref.toString().startsWith(prefix)) {
        matches.add(ref);
      }
    }
    if (matches.size() != 1) {
      throw new AmbiguousRequirementException(prefix, ImmutableList.copyOf(matches));
    }
    return records.get(matches.get(0));
  }

  public HashCode identityHash() {
    return identityHash(ContentHasher.SHA1);
  }

  /**
   * Hashes the identity lines of the relevant records, one per line in key order. Indirect records
   * still contribute an (empty) line when relevant.
   */
  public HashCode identityHash(ContentHasher hasher) {
    List<String> lines = new ArrayList<>();
    for (Map.Entry<ComponentRef, RequirementRecord> entry : records.entrySet()) {
      if (isRelevant(entry.getKey())) {
        lines.add(entry.getValue().identityLine());
      }
    }
    return hasher.hashString(NEWLINE.join(lines));
  }

  /** One line per record with a non-empty identity line, dev requirements tagged. */
  public String canonicalDump() {
    List<String> lines = new ArrayList<>();
    for (Map.Entry<ComponentRef, RequirementRecord> entry : records.entrySet()) {
      String line = entry.getValue().identityLine();
      if (line.isEmpty()) {
        continue;
      }
      lines.add(isRelevant(entry.getKey()) ? line : line + DEV_MARKER);
    }
    return NEWLINE.join(lines);
  }

  /**
   * Maps the text of every key to the full text of its record. Ignores relevance, and is not the
   * inverse of {@link #canonicalDump}.
   */
  public ImmutableMap<String, String> toStructured() {
    ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
    for (Map.Entry<ComponentRef, RequirementRecord> entry : records.entrySet()) {
      result.put(entry.getKey().toString(), entry.getValue().toFullText());
    }
    return result.buildOrThrow();
  }

  /**
   * Rebuilds a set from {@link #toStructured} output. Every record comes back direct and the
   * relevance filter is lost.
   */
  public static RequirementSet fromStructured(Map<String, String> data)
      throws MalformedReferenceException {
    RequirementSet result = new RequirementSet(null);
    for (Map.Entry<String, String> entry : data.entrySet()) {
      result.records.put(
          ComponentRef.parse(entry.getKey()), RequirementRecord.parse(entry.getValue()));
    }
    return result;
  }

  /**
   * Rebuilds a set from the full requirements and the lines of a dumped {@code [requires]}
   * section.
   *
   * <p>A reference is direct if its direct identity line is among {@code dumpedLines}, consuming
   * one occurrence, and indirect otherwise. The relevance filter is recovered only as far as the
   * {@code DEV} tags allow: with no tagged line it is absent, otherwise it holds every name that
   * was not tagged.
   *
   * <p>Dumped lines only carry the stabilized version, so references that stabilize to the same
   * line cannot be told apart. Such ties go to the references in sorted order: with {@code
   * A/1.0-rc} direct and {@code A/1.0} indirect, {@code A/1.0} comes back direct. The canonical
   * text is unaffected. The identity hash can change, since the empty line of the indirect record
   * moves to the other key.
   */
  public static RequirementSet recover(
      RequirementManifest fullRequires, Iterable<String> dumpedLines) {
    Multiset<String> directLines = HashMultiset.create();
    Set<String> devNames = new HashSet<>();
    for (String rawLine : dumpedLines) {
      String line = rawLine.trim();
      if (line.isEmpty()) {
        continue;
      }
      if (line.endsWith(DEV_MARKER)) {
        line = line.substring(0, line.length() - DEV_MARKER.length());
        devNames.add(NAME_SPLITTER.split(line).iterator().next());
      }
      directLines.add(line);
    }

    ImmutableSet<String> relevanceFilter = null;
    if (!devNames.isEmpty()) {
      ImmutableSet.Builder<String> relevant = ImmutableSet.builder();
      for (ComponentRef ref : fullRequires.sorted()) {
        if (!devNames.contains(ref.name())) {
          relevant.add(ref.name());
        }
      }
      relevanceFilter = relevant.build();
    }

    RequirementSet result = new RequirementSet(relevanceFilter);
    for (ComponentRef ref : fullRequires.sorted()) {
      RequirementRecord direct = RequirementRecord.of(ref, /* indirect= */ false);
      boolean isDirect = directLines.remove(direct.identityLine());
      result.records.put(ref, isDirect ? direct : RequirementRecord.of(ref, /* indirect= */ true));
    }
    if (!directLines.isEmpty()) {
      logger.atWarning().log(
          "Ignoring dumped requirements without a full reference: %s", directLines);
    }
    return result;
  }

  @Override
  public String toString() {
    return "RequirementSet{" + records.keySet() + ", filter=" + relevanceFilter + "}";
  }
}
