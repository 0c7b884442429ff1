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

/**
 * Thrown when the canonical text of an identity is structurally invalid: a section is missing,
 * repeated or unknown, or the body of a section cannot be parsed.
 */
public class MalformedIdentityFileException extends PackageIdException {
  private final String section;

  public MalformedIdentityFileException(String message, String section) {
    super(message);
    this.section = checkNotNull(section);
  }

  public MalformedIdentityFileException(String message, String section, Throwable cause) {
    super(message, cause);
    this.section = checkNotNull(section);
  }

  /**
   * The offending section. Problems found before any section, such as content ahead of the first
   * header, report the first expected section.
   */
  public String getSection() {
    return section;
  }
}
