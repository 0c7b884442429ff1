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

import java.io.IOException;
import java.nio.file.Path;

/** Thrown when a persisted identity file cannot be read. */
public class MissingIdentityFileException extends PackageIdException {
  private final Path path;

  public MissingIdentityFileException(Path path, IOException cause) {
    super("Does not exist " + path, cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
