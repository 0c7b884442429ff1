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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class VersionsTest {

  @Test
  public void stabilize_keepsReleaseVersions() {
    assertThat(Versions.stabilize("1.0")).isEqualTo("1.0");
    assertThat(Versions.stabilize("1.70.0")).isEqualTo("1.70.0");
    assertThat(Versions.stabilize("latest")).isEqualTo("latest");
  }

  @Test
  public void stabilize_dropsPreReleaseAndBuildMarkers() {
    assertThat(Versions.stabilize("1.2.0-rc.1")).isEqualTo("1.2.0");
    assertThat(Versions.stabilize("1.2.0+build.7")).isEqualTo("1.2.0");
    assertThat(Versions.stabilize("1.2.0-rc.1+build.7")).isEqualTo("1.2.0");
  }
}
