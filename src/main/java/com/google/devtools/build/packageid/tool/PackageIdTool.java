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

package com.google.devtools.build.packageid.tool;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.build.packageid.BuildIdentity;
import com.google.devtools.build.packageid.PackageIdException;
import com.google.devtools.build.packageid.requires.RequirementRecord;
import java.io.PrintStream;
import java.nio.file.Path;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.PathOptionHandler;

/**
 * Prints the package id, canonical text or structured form of a persisted identity file, or looks
 * up one of its requirements.
 */
public final class PackageIdTool {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int IDENTITY_ERROR_EXIT_CODE = 1;
  static final int USAGE_EXIT_CODE = 2;

  /** What to print for the loaded identity. */
  public enum PrintMode {
    PACKAGE_ID,
    CANONICAL,
    STRUCTURED
  }

  /** Command line options. */
  public static class Options {
    @Option(
        name = "--info",
        required = true,
        handler = PathOptionHandler.class,
        usage = "Path of the identity file to read.")
    public Path info;

    @Option(
        name = "--print",
        usage = "What to print: package_id (default), canonical or structured.")
    public PrintMode print = PrintMode.PACKAGE_ID;

    @Option(
        name = "--lookup",
        usage =
            "Print the full reference of the single requirement whose reference starts with this"
                + " prefix, instead of --print output.")
    public String lookup;
  }

  private PackageIdTool() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return USAGE_EXIT_CODE;
    }

    try {
      BuildIdentity identity = BuildIdentity.loadFromPath(options.info);
      if (options.lookup != null) {
        RequirementRecord record = identity.getRequires().lookupByNamePrefix(options.lookup);
        out.println(record.toFullText());
        return 0;
      }
      switch (options.print) {
        case PACKAGE_ID:
          out.println(identity.packageId());
          break;
        case CANONICAL:
          out.println(identity.canonicalDump());
          break;
        case STRUCTURED:
          out.println(identity.toStructured().toJson());
          break;
      }
      return 0;
    } catch (PackageIdException e) {
      logger.atFine().withCause(e).log("Failed to process %s", options.info);
      err.println("ERROR: " + e.getMessage());
      return IDENTITY_ERROR_EXIT_CODE;
    }
  }
}
