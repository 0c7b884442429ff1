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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.devtools.build.packageid.ref.ComponentRef;
import com.google.devtools.build.packageid.ref.MalformedReferenceException;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The complete transitive closure of a package's requirements, as full references. Kept for
 * provenance and persistence only; its content reaches the hash through {@link RequirementSet}.
 *
 * <p>Entries are deduplicated and keep insertion order; serialized forms are sorted.
 */
public final class RequirementManifest implements Iterable<ComponentRef> {
  private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();

  private final LinkedHashSet<ComponentRef> refs = new LinkedHashSet<>();

  private RequirementManifest() {}

  public static RequirementManifest of(Iterable<ComponentRef> refs) {
    RequirementManifest result = new RequirementManifest();
    result.extend(refs);
    return result;
  }

  /**
   * Parses one reference per line. Blank lines are skipped.
   *
   * @throws MalformedReferenceException on the first line that is not a valid reference
   */
  public static RequirementManifest parse(Iterable<String> lines)
      throws MalformedReferenceException {
    RequirementManifest result = new RequirementManifest();
    for (String line : lines) {
      if (!line.isBlank()) {
        result.refs.add(ComponentRef.parse(line));
      }
    }
    return result;
  }

  public static RequirementManifest parse(String text) throws MalformedReferenceException {
    return parse(LINE_SPLITTER.split(text));
  }

  public RequirementManifest copy() {
    return of(refs);
  }

  /** Appends {@code moreRefs} in place, skipping references already present. */
  public void extend(Iterable<ComponentRef> moreRefs) {
    Iterables.addAll(refs, moreRefs);
  }

  public ImmutableSortedSet<ComponentRef> sorted() {
    return ImmutableSortedSet.copyOf(refs);
  }

  public int size() {
    return refs.size();
  }

  public boolean contains(ComponentRef ref) {
    return refs.contains(ref);
  }

  /** Sorted reference texts. */
  public ImmutableList<String> toStructured() {
    return sorted().stream().map(ComponentRef::toString).collect(ImmutableList.toImmutableList());
  }

  public static RequirementManifest fromStructured(List<String> data)
      throws MalformedReferenceException {
    return parse(data);
  }

  /** One full reference per line, sorted. */
  public String canonicalDump() {
    return Joiner.on('\n').join(toStructured());
  }

  @Override
  public Iterator<ComponentRef> iterator() {
    return Iterators.unmodifiableIterator(refs.iterator());
  }

  @Override
  public String toString() {
    return "RequirementManifest" + refs;
  }
}
