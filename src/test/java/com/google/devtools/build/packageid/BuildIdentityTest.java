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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.google.devtools.build.packageid.ref.ComponentRef;
import com.google.devtools.build.packageid.ref.MalformedReferenceException;
import com.google.devtools.build.packageid.values.OptionsValues;
import com.google.devtools.build.packageid.values.Scopes;
import com.google.devtools.build.packageid.values.SettingsValues;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BuildIdentity}. */
@RunWith(JUnit4.class)
public final class BuildIdentityTest {

  private static final SettingsValues SETTINGS =
      SettingsValues.of(
          ImmutableMap.of("os", "Linux", "compiler", "gcc", "compiler.version", "11"));
  private static final OptionsValues OPTIONS =
      OptionsValues.of(ImmutableMap.of("shared", "True", "Boost:threading", "multi"));

  private static final String EXPECTED_DUMP =
      Joiner.on('\n')
          .join(
              "[settings]",
              "    compiler=gcc",
              "    compiler.version=11",
              "    os=Linux",
              "",
              "[requires]",
              "    Boost/1.70.0",
              "",
              "[options]",
              "    shared=True",
              "",
              "[full_settings]",
              "    compiler=gcc",
              "    compiler.version=11",
              "    os=Linux",
              "",
              "[full_requires]",
              "    Boost/1.70.0@conan/stable",
              "    zlib/1.2.11",
              "",
              "[full_options]",
              "    shared=True",
              "    Boost:threading=multi",
              "",
              "[scope]");

  private static ImmutableList<ComponentRef> refs(String... texts)
      throws MalformedReferenceException {
    ImmutableList.Builder<ComponentRef> result = ImmutableList.builder();
    for (String text : texts) {
      result.add(ComponentRef.parse(text));
    }
    return result.build();
  }

  private static BuildIdentity boostIdentity() throws MalformedReferenceException {
    return BuildIdentity.create(
        SETTINGS,
        OPTIONS,
        refs("Boost/1.70.0@conan/stable"),
        refs("zlib/1.2.11"),
        /* relevanceFilter= */ null);
  }

  @Test
  public void packageId_knownValue() throws Exception {
    assertThat(boostIdentity().packageId()).isEqualTo("34195402d323695faf096618bb5ec975908344ad");
  }

  @Test
  public void canonicalDump_knownText() throws Exception {
    assertThat(boostIdentity().canonicalDump()).isEqualTo(EXPECTED_DUMP);
  }

  @Test
  public void create_prunesOnlyTheIdentityViews() throws Exception {
    BuildIdentity identity = boostIdentity();

    assertThat(identity.getOptions().getPackageOptions("Boost")).isEmpty();
    assertThat(identity.getFullOptions().getPackageOptions("Boost"))
        .containsExactly("threading", "multi");
    assertThat(identity.getFullRequires().size()).isEqualTo(2);
    assertThat(identity.getRequires().get(ComponentRef.parse("zlib/1.2.11")).isIndirect())
        .isTrue();
    assertThat(identity.getScope()).isNull();
  }

  @Test
  public void packageId_deterministicAcrossInputOrder() throws Exception {
    BuildIdentity first =
        BuildIdentity.create(
            SETTINGS, OPTIONS, refs("A/1.0", "B/1.0"), refs("C/1.0", "D/1.0"), null);
    BuildIdentity second =
        BuildIdentity.create(
            SETTINGS, OPTIONS, refs("B/1.0", "A/1.0"), refs("D/1.0", "C/1.0"), null);

    assertThat(first.packageId()).isEqualTo(second.packageId());
    assertThat(first).isEqualTo(second);
  }

  @Test
  public void packageId_sensitiveToEachInput() throws Exception {
    BuildIdentity base = boostIdentity();
    BuildIdentity otherSettings =
        BuildIdentity.create(
            SETTINGS.without("compiler"),
            OPTIONS,
            refs("Boost/1.70.0@conan/stable"),
            refs("zlib/1.2.11"),
            null);
    BuildIdentity otherOptions =
        BuildIdentity.create(
            SETTINGS,
            OptionsValues.of(ImmutableMap.of("shared", "False")),
            refs("Boost/1.70.0@conan/stable"),
            refs("zlib/1.2.11"),
            null);
    BuildIdentity otherDirect =
        BuildIdentity.create(
            SETTINGS, OPTIONS, refs("Boost/1.71.0@conan/stable"), refs("zlib/1.2.11"), null);
    BuildIdentity otherIndirect =
        BuildIdentity.create(
            SETTINGS, OPTIONS, refs("Boost/1.70.0@conan/stable"), refs("zlib/1.2.13"), null);

    assertThat(otherSettings.packageId()).isNotEqualTo(base.packageId());
    assertThat(otherOptions.packageId()).isNotEqualTo(base.packageId());
    assertThat(otherDirect.packageId()).isNotEqualTo(base.packageId());
    assertThat(otherIndirect.packageId()).isEqualTo(base.packageId());
  }

  @Test
  public void packageId_ignoresDependencyOptions() throws Exception {
    BuildIdentity withoutDependencyOptions =
        BuildIdentity.create(
            SETTINGS,
            OptionsValues.of(ImmutableMap.of("shared", "True")),
            refs("Boost/1.70.0@conan/stable"),
            refs("zlib/1.2.11"),
            null);

    assertThat(withoutDependencyOptions.packageId()).isEqualTo(boostIdentity().packageId());
  }

  @Test
  public void packageIdentity_computedOnce() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    ContentHasher counting =
        bytes -> {
          calls.incrementAndGet();
          return ContentHasher.SHA1.hash(bytes);
        };
    BuildIdentity identity =
        BuildIdentity.create(
            SETTINGS,
            OPTIONS,
            refs("Boost/1.70.0@conan/stable"),
            refs("zlib/1.2.11"),
            null,
            counting);

    String first = identity.packageId();
    int callsAfterFirst = calls.get();
    String second = identity.packageId();

    assertThat(callsAfterFirst).isEqualTo(4);
    assertThat(calls.get()).isEqualTo(callsAfterFirst);
    assertThat(second).isEqualTo(first);
    assertThat(first).isEqualTo(boostIdentity().packageId());
  }

  @Test
  public void parse_roundTripsDump() throws Exception {
    BuildIdentity identity = boostIdentity();

    BuildIdentity parsed = BuildIdentity.parse(identity.canonicalDump());

    assertThat(parsed.canonicalDump()).isEqualTo(identity.canonicalDump());
    assertThat(parsed).isEqualTo(identity);
    assertThat(parsed.packageId()).isEqualTo(identity.packageId());
  }

  @Test
  public void parse_roundTripsDevRequirements() throws Exception {
    BuildIdentity identity =
        BuildIdentity.create(
            SETTINGS,
            OptionsValues.of(ImmutableMap.of("shared", "True", "zlib:shared", "False")),
            refs("A/1.0", "B/2.0-rc.1"),
            refs("C/3.0"),
            ImmutableSet.of("A", "C"));

    BuildIdentity parsed = BuildIdentity.parse(identity.canonicalDump());

    assertThat(identity.canonicalDump()).contains("    B/2.0 DEV");
    assertThat(parsed.canonicalDump()).isEqualTo(identity.canonicalDump());
    assertThat(parsed.getRequires().getRelevanceFilter()).hasValue(ImmutableSet.of("A", "C"));
    assertThat(parsed.packageId()).isEqualTo(identity.packageId());
  }

  @Test
  public void parse_roundTripsNoneValues() throws Exception {
    BuildIdentity identity =
        BuildIdentity.create(
            SettingsValues.of(ImmutableMap.of("os", "Linux", "arch", "None")),
            OptionsValues.EMPTY,
            ImmutableList.of(),
            ImmutableList.of(),
            null);

    BuildIdentity parsed = BuildIdentity.parse(identity.toString());

    assertThat(parsed).isEqualTo(identity);
    assertThat(parsed.getSettings().get("arch")).isEqualTo("None");
  }

  @Test
  public void equals_isTextual() throws Exception {
    BuildIdentity withNone =
        BuildIdentity.create(
            SettingsValues.of(ImmutableMap.of("os", "Linux", "arch", "None")),
            OptionsValues.EMPTY,
            ImmutableList.of(),
            ImmutableList.of(),
            null);
    BuildIdentity withoutNone =
        BuildIdentity.create(
            SettingsValues.of(ImmutableMap.of("os", "Linux")),
            OptionsValues.EMPTY,
            ImmutableList.of(),
            ImmutableList.of(),
            null);

    assertThat(withNone.packageId()).isEqualTo(withoutNone.packageId());
    assertThat(withNone).isNotEqualTo(withoutNone);
  }

  @Test
  public void parse_ignoresCommentsAndBlankLines() throws Exception {
    String text = "# persisted identity\n\n" + EXPECTED_DUMP.replace("\n\n", "\n\n\n");

    assertThat(BuildIdentity.parse(text)).isEqualTo(boostIdentity());
  }

  @Test
  public void parse_unknownSection() {
    String text = EXPECTED_DUMP.replace("[full_options]", "[other_options]");

    MalformedIdentityFileException e =
        assertThrows(MalformedIdentityFileException.class, () -> BuildIdentity.parse(text));
    assertThat(e.getSection()).isEqualTo("other_options");
  }

  @Test
  public void parse_missingSection() {
    String text = EXPECTED_DUMP.replace("\n\n[scope]", "");

    MalformedIdentityFileException e =
        assertThrows(MalformedIdentityFileException.class, () -> BuildIdentity.parse(text));
    assertThat(e.getSection()).isEqualTo("scope");
  }

  @Test
  public void parse_malformedSettingsLine() {
    String text = EXPECTED_DUMP.replace("    os=Linux\n\n[requires]", "    os\n\n[requires]");

    MalformedIdentityFileException e =
        assertThrows(MalformedIdentityFileException.class, () -> BuildIdentity.parse(text));
    assertThat(e.getSection()).isEqualTo("settings");
    assertThat(e).hasCauseThat().isNotNull();
  }

  @Test
  public void parse_malformedFullRequirement() {
    String text = EXPECTED_DUMP.replace("    zlib/1.2.11", "    zlib");

    assertThrows(MalformedReferenceException.class, () -> BuildIdentity.parse(text));
  }

  @Test
  public void withScope_appearsInDumpOnly() throws Exception {
    BuildIdentity identity = boostIdentity();
    BuildIdentity scoped = identity.withScope(Scopes.of(ImmutableMap.of("dev", "True")));

    assertThat(scoped.canonicalDump()).endsWith("[scope]\n    dev=True");
    assertThat(scoped.packageId()).isEqualTo(identity.packageId());
    assertThat(scoped).isNotEqualTo(identity);
    assertThat(identity.getScope()).isNull();
    assertThat(BuildIdentity.parse(scoped.canonicalDump()).getScope().isDev()).isTrue();
  }

  @Test
  public void withScope_emptyScopeDumpsLikeNone() throws Exception {
    BuildIdentity identity = boostIdentity();

    assertThat(identity.withScope(Scopes.EMPTY)).isEqualTo(identity);
  }

  @Test
  public void structured_jsonRoundTrip() throws Exception {
    BuildIdentity identity = boostIdentity();

    StructuredIdentity structured = StructuredIdentity.fromJson(identity.toStructured().toJson());

    assertThat(structured).isEqualTo(identity.toStructured());
    assertThat(structured.fullRequires())
        .containsExactly("Boost/1.70.0@conan/stable", "zlib/1.2.11")
        .inOrder();
    assertThat(structured.options()).containsExactly("shared", "True");
    assertThat(structured.fullOptions()).containsEntry("Boost:threading", "multi");
  }

  @Test
  public void structured_jsonUsesSnakeCaseKeys() throws Exception {
    String json = boostIdentity().toStructured().toJson();

    assertThat(json).contains("\"full_settings\"");
    assertThat(json).contains("\"full_requires\"");
    assertThat(json).doesNotContain("fullSettings");
  }

  @Test
  public void fromJson_missingField() {
    MalformedIdentityFileException e =
        assertThrows(
            MalformedIdentityFileException.class,
            () -> StructuredIdentity.fromJson("{\"settings\": {}}"));
    assertThat(e.getSection()).isEqualTo("full_settings");
  }

  private static JsonObject boostJson() throws Exception {
    return JsonParser.parseString(boostIdentity().toStructured().toJson()).getAsJsonObject();
  }

  @Test
  public void fromJson_nullEntry() throws Exception {
    JsonObject nullSetting = boostJson();
    nullSetting.getAsJsonObject("settings").add("os", JsonNull.INSTANCE);
    JsonObject nullRequirement = boostJson();
    nullRequirement.getAsJsonArray("full_requires").add(JsonNull.INSTANCE);

    MalformedIdentityFileException settingsError =
        assertThrows(
            MalformedIdentityFileException.class,
            () -> StructuredIdentity.fromJson(nullSetting.toString()));
    MalformedIdentityFileException requiresError =
        assertThrows(
            MalformedIdentityFileException.class,
            () -> StructuredIdentity.fromJson(nullRequirement.toString()));

    assertThat(settingsError.getSection()).isEqualTo("settings");
    assertThat(requiresError.getSection()).isEqualTo("full_requires");
  }

  @Test
  public void fromJson_wrongFieldShape() throws Exception {
    JsonObject listRequires = boostJson();
    listRequires.add("requires", new JsonArray());
    JsonObject nestedOption = boostJson();
    nestedOption.getAsJsonObject("options").add("shared", new JsonObject());

    MalformedIdentityFileException requiresError =
        assertThrows(
            MalformedIdentityFileException.class,
            () -> StructuredIdentity.fromJson(listRequires.toString()));
    MalformedIdentityFileException optionsError =
        assertThrows(
            MalformedIdentityFileException.class,
            () -> StructuredIdentity.fromJson(nestedOption.toString()));

    assertThat(requiresError.getSection()).isEqualTo("requires");
    assertThat(optionsError.getSection()).isEqualTo("options");
  }

  @Test
  public void fromJson_notAnObject() {
    MalformedIdentityFileException syntaxError =
        assertThrows(
            MalformedIdentityFileException.class, () -> StructuredIdentity.fromJson("{\"a\""));
    MalformedIdentityFileException arrayError =
        assertThrows(MalformedIdentityFileException.class, () -> StructuredIdentity.fromJson("[]"));

    assertThat(syntaxError.getSection()).isEqualTo("settings");
    assertThat(arrayError.getSection()).isEqualTo("settings");
  }

  @Test
  public void fromStructured_keepsIdentityViews() throws Exception {
    BuildIdentity identity = boostIdentity();

    BuildIdentity restored = BuildIdentity.fromStructured(identity.toStructured());

    assertThat(restored.getSettings()).isEqualTo(identity.getSettings());
    assertThat(restored.getFullOptions()).isEqualTo(identity.getFullOptions());
    assertThat(restored.getFullRequires().canonicalDump())
        .isEqualTo(identity.getFullRequires().canonicalDump());
    assertThat(restored.toStructured()).isEqualTo(identity.toStructured());
    assertThat(restored.getScope()).isNull();
  }

  @Test
  public void loadFromPath() throws Exception {
    FileSystem fs = Jimfs.newFileSystem(Configuration.unix());
    Path file = fs.getPath("/cache/conaninfo.txt");
    Files.createDirectories(file.getParent());
    Files.write(file, EXPECTED_DUMP.getBytes(UTF_8));

    assertThat(BuildIdentity.loadFromPath(file)).isEqualTo(boostIdentity());
  }

  @Test
  public void loadFromPath_missingFile() {
    FileSystem fs = Jimfs.newFileSystem(Configuration.unix());
    Path file = fs.getPath("/cache/missing.txt");

    MissingIdentityFileException e =
        assertThrows(MissingIdentityFileException.class, () -> BuildIdentity.loadFromPath(file));
    assertThat(e.getPath()).isEqualTo(file);
    assertThat(e).hasMessageThat().isEqualTo("Does not exist /cache/missing.txt");
  }
}
