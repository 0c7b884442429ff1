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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashCode;
import com.google.devtools.build.packageid.ContentHasher;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link OptionsValues}. */
@RunWith(JUnit4.class)
public final class OptionsValuesTest {

  private static HashCode sha1(String text) {
    return ContentHasher.SHA1.hash(text.getBytes(UTF_8));
  }

  private static OptionsValues sample() throws MalformedValuesException {
    return OptionsValues.parse(
        "zlib:shared=False\nshared=True\nBoost:threading=multi\nfPIC=None\nBoost:magic=on");
  }

  @Test
  public void lines_ownOptionsFirstThenPackagesInOrder() throws Exception {
    assertThat(sample().lines())
        .containsExactly(
            "fPIC=None",
            "shared=True",
            "Boost:magic=on",
            "Boost:threading=multi",
            "zlib:shared=False")
        .inOrder();
  }

  @Test
  public void parse_roundTripsDump() throws Exception {
    OptionsValues options = sample();

    assertThat(OptionsValues.parse(options.canonicalDump())).isEqualTo(options);
  }

  @Test
  public void get_separatesOwnAndPackageOptions() throws Exception {
    OptionsValues options = sample();

    assertThat(options.get("shared")).isEqualTo("True");
    assertThat(options.get("threading")).isNull();
    assertThat(options.getPackageOptions("Boost"))
        .containsExactly("magic", "on", "threading", "multi");
    assertThat(options.getPackageOptions("OpenSSL")).isEmpty();
  }

  @Test
  public void identityHash_noFilterHashesEveryBlock() throws Exception {
    assertThat(sample().identityHash(null))
        .isEqualTo(sha1("shared=True\nmagic=on\nthreading=multi\nshared=False"));
  }

  @Test
  public void identityHash_filterSelectsPackages() throws Exception {
    assertThat(sample().identityHash(ImmutableSet.of("zlib")))
        .isEqualTo(sha1("shared=True\nshared=False"));
    assertThat(sample().identityHash(ImmutableSet.of()))
        .isEqualTo(sha1("shared=True"));
  }

  @Test
  public void clearIndirect_dropsPackageOptions() throws Exception {
    OptionsValues cleared = sample().clearIndirect();

    assertThat(cleared.lines()).containsExactly("fPIC=None", "shared=True").inOrder();
    assertThat(cleared.identityHash(null)).isEqualTo(sha1("shared=True"));
    assertThat(sample().getPackageOptions("Boost")).isNotEmpty();
  }

  @Test
  public void structuredRoundTrip() throws Exception {
    OptionsValues options = sample();

    assertThat(options.toStructured())
        .containsEntry("Boost:threading", "multi");
    assertThat(OptionsValues.fromStructured(options.toStructured())).isEqualTo(options);
  }

  @Test
  public void of_laterAssignmentsWin() throws Exception {
    OptionsValues options = OptionsValues.parse("shared=True\nshared=False");

    assertThat(options.get("shared")).isEqualTo("False");
    assertThat(options).isEqualTo(OptionsValues.of(ImmutableMap.of("shared", "False")));
  }

  @Test
  public void of_rejectsEntriesThatDoNotReadBack() {
    ImmutableList<ImmutableMap<String, String>> unwritable =
        ImmutableList.of(
            ImmutableMap.of("shared", "True "),
            ImmutableMap.of("Boost:threading", "multi\nsingle"),
            ImmutableMap.of("#shared", "True"),
            ImmutableMap.of("[Boost:threading", "multi"),
            ImmutableMap.of("sha=red", "True"),
            ImmutableMap.of("", "True"));
    for (ImmutableMap<String, String> values : unwritable) {
      assertThrows(IllegalArgumentException.class, () -> OptionsValues.of(values));
      assertThrows(IllegalArgumentException.class, () -> Scopes.of(values));
    }
  }

  @Test
  public void parse_rejectsCommentLikeName() {
    assertThrows(MalformedValuesException.class, () -> OptionsValues.parse("#shared=True"));
  }
}
