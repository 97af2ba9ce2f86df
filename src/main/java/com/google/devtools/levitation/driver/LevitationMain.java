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
package com.google.devtools.levitation.driver;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.driver.DriverOptions.InvalidOptionsException;
import java.util.function.Function;
import org.kohsuke.args4j.CmdLineException;

/** Entry point of the {@code levitation} build driver. */
public final class LevitationMain {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_WRONG_ARGUMENTS = 1;
  static final int EXIT_BUILD_FAILED = 2;

  private LevitationMain() {}

  public static void main(String[] args) {
    System.exit(run(args, BuildSession::create));
  }

  @VisibleForTesting
  static int run(String[] args, Function<DriverOptions, BuildSession> sessionFactory) {
    DriverOptions options;
    try {
      options = DriverOptions.parse(args);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      System.err.print(DriverOptions.usage());
      return EXIT_WRONG_ARGUMENTS;
    }
    if (options.help) {
      System.out.println("Usage: levitation [options]");
      System.out.print(DriverOptions.usage());
      return EXIT_SUCCESS;
    }

    LoggingSetup.configure(options.getLogLevel());
    logger.atFine().log("%s", options.describe());

    try {
      options.validate();
    } catch (InvalidOptionsException e) {
      logger.atSevere().log("%s", e.getMessage());
      return EXIT_WRONG_ARGUMENTS;
    }

    try (BuildSession session = sessionFactory.apply(options)) {
      return new BuildOrchestrator(session).run() ? EXIT_SUCCESS : EXIT_BUILD_FAILED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atSevere().log("Build interrupted");
      return EXIT_BUILD_FAILED;
    }
  }
}
