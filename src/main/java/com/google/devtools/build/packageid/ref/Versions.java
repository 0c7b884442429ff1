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

import com.google.common.base.CharMatcher;

/** Utility functions for component versions. */
public final class Versions {
  private static final CharMatcher UNSTABLE_MARKERS = CharMatcher.anyOf("-+");

  private Versions() {}

  /**
   * Returns the release identity of {@code version}: everything before the first pre-release
   * ({@code -}) or build metadata ({@code +}) marker. {@code 1.2.0-rc.1+build.7} becomes {@code
   * 1.2.0}.
   *
   * <p>A version that starts with a marker has no release part and is returned unchanged.
   */
  public static String stabilize(String version) {
    int index = UNSTABLE_MARKERS.indexIn(version);
    if (index <= 0) {
      return version;
    }
    return version.substring(0, index);
  }
}
