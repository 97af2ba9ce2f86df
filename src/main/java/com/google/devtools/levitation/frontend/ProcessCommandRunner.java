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
package com.google.devtools.levitation.frontend;

import com.google.common.flogger.GoogleLogger;
import java.io.IOException;

/**
 * Runs commands as child processes. The child shares the driver's standard streams, so compiler
 * diagnostics reach the user unchanged.
 */
public final class ProcessCommandRunner implements CommandRunner {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  @Override
  public int run(CommandLine command) throws IOException, InterruptedException {
    logger.atFinest().log("Executing: %s", command);
    Process process = new ProcessBuilder(command.arguments()).inheritIO().start();
    try {
      return process.waitFor();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
  }
}
