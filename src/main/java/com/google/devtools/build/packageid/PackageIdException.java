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

/**
 * Base class of the errors raised while computing, parsing or loading a package identity. All of
 * them are terminal for the operation that raised them.
 */
public abstract class PackageIdException extends Exception {

  protected PackageIdException(String message) {
    super(message);
  }

  protected PackageIdException(String message, Throwable cause) {
    super(message, cause);
  }
}
