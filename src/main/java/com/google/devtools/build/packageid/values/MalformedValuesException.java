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

import com.google.devtools.build.packageid.PackageIdException;

/** Thrown when a {@code name=value} line of settings, options or scopes does not parse. */
public class MalformedValuesException extends PackageIdException {
  private final String line;

  public MalformedValuesException(String message, String line) {
    super(message + ": '" + line + "'");
    this.line = line;
  }

  public String getLine() {
    return line;
  }
}
