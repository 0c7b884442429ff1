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

import com.google.common.collect.ImmutableList;
import com.google.devtools.build.packageid.PackageIdException;
import com.google.devtools.build.packageid.ref.ComponentRef;

/**
 * Thrown by {@link RequirementSet#lookupByNamePrefix} when the prefix matches no requirement or
 * more than one.
 */
public class AmbiguousRequirementException extends PackageIdException {
  private final String prefix;
  private final ImmutableList<ComponentRef> matches;

  public AmbiguousRequirementException(String prefix, ImmutableList<ComponentRef> matches) {
    super(String.format("No match for %s: %s", prefix, matches));
    this.prefix = prefix;
    this.matches = matches;
  }

  public String getPrefix() {
    return prefix;
  }

  /** The references that matched; empty if none did. */
  public ImmutableList<ComponentRef> getMatches() {
    return matches;
  }
}
