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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

/**
 * The content-hash primitive behind every identity hash.
 *
 * <p>Changing the primitive changes every package id ever computed, so the default must stay
 * {@link #SHA1}.
 */
@FunctionalInterface
public interface ContentHasher {

  @SuppressWarnings("deprecation") // SHA-1 is part of the persisted id format.
  ContentHasher SHA1 = bytes -> Hashing.sha1().hashBytes(bytes);

  HashCode hash(byte[] bytes);

  /** Hashes the UTF-8 encoding of {@code text}. */
  default HashCode hashString(String text) {
    return hash(text.getBytes(UTF_8));
  }
}
