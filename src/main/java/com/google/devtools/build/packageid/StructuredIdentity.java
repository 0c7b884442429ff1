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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.Map;

/**
 * The machine-readable form of a {@link BuildIdentity}.
 *
 * <p>Unlike the canonical text it carries no scope, and {@code requires} maps each reference to its
 * full text without any relevance information.
 *
 * @param settings pruned settings
 * @param fullSettings complete settings
 * @param options pruned options
 * @param fullOptions complete options
 * @param requires reference text to full record text
 * @param fullRequires sorted full reference texts
 */
public record StructuredIdentity(
    Map<String, String> settings,
    Map<String, String> fullSettings,
    Map<String, String> options,
    Map<String, String> fullOptions,
    Map<String, String> requires,
    List<String> fullRequires) {

  private static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .setPrettyPrinting()
          .disableHtmlEscaping()
          .create();

  private static final String FULL_REQUIRES_KEY = "full_requires";
  private static final ImmutableList<String> KEYS =
      ImmutableList.of(
          "settings", "full_settings", "options", "full_options", "requires", FULL_REQUIRES_KEY);

  public StructuredIdentity {
    settings = ImmutableMap.copyOf(requireNonNull(settings, "settings"));
    fullSettings = ImmutableMap.copyOf(requireNonNull(fullSettings, "fullSettings"));
    options = ImmutableMap.copyOf(requireNonNull(options, "options"));
    fullOptions = ImmutableMap.copyOf(requireNonNull(fullOptions, "fullOptions"));
    requires = ImmutableMap.copyOf(requireNonNull(requires, "requires"));
    fullRequires = ImmutableList.copyOf(requireNonNull(fullRequires, "fullRequires"));
  }

  /** Renders the six fields as a JSON object with snake_case keys. */
  public String toJson() {
    return GSON.toJson(this);
  }

  /**
   * Reads the output of {@link #toJson}.
   *
   * @throws MalformedIdentityFileException if the text is not a JSON object, lacks one of the six
   *     fields, or a field is not an object (a list for {@code full_requires}) of strings. For text
   *     that is not a JSON object at all, the reported section is the first field, {@code
   *     settings}.
   */
  public static StructuredIdentity fromJson(String json) throws MalformedIdentityFileException {
    JsonElement element;
    try {
      element = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new MalformedIdentityFileException("Invalid JSON: " + e.getMessage(), KEYS.get(0), e);
    }
    if (!element.isJsonObject()) {
      throw new MalformedIdentityFileException("Expected a JSON object", KEYS.get(0));
    }
    JsonObject object = element.getAsJsonObject();
    for (String key : KEYS) {
      JsonElement member = object.get(key);
      if (member == null || member.isJsonNull()) {
        throw new MalformedIdentityFileException("Missing field " + key, key);
      }
      checkStrings(key, member);
    }
    try {
      return GSON.fromJson(object, StructuredIdentity.class);
    } catch (JsonParseException e) {
      throw new MalformedIdentityFileException("Invalid JSON: " + e.getMessage(), KEYS.get(0), e);
    }
  }

  private static void checkStrings(String key, JsonElement member)
      throws MalformedIdentityFileException {
    Iterable<JsonElement> entries;
    if (key.equals(FULL_REQUIRES_KEY)) {
      if (!member.isJsonArray()) {
        throw new MalformedIdentityFileException("Expected a list in " + key, key);
      }
      entries = member.getAsJsonArray();
    } else {
      if (!member.isJsonObject()) {
        throw new MalformedIdentityFileException("Expected an object in " + key, key);
      }
      entries = member.getAsJsonObject().asMap().values();
    }
    for (JsonElement entry : entries) {
      if (!entry.isJsonPrimitive()) {
        throw new MalformedIdentityFileException("Expected a string in " + key + ": " + entry, key);
      }
    }
  }
}
