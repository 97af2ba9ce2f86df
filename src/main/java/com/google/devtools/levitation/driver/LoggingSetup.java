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

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/** Routes all driver logging to the console, at the level chosen on the command line. */
public final class LoggingSetup {
  private LoggingSetup() {}

  public static void configure(Level level) {
    Logger root = Logger.getLogger("");
    for (Handler handler : root.getHandlers()) {
      root.removeHandler(handler);
    }
    ConsoleHandler console = new ConsoleHandler();
    console.setLevel(level);
    console.setFormatter(new DriverFormatter());
    root.addHandler(console);
    root.setLevel(level);
  }

  /** One line per record; only warnings and errors are tagged. */
  static final class DriverFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
      StringBuilder out = new StringBuilder();
      if (record.getLevel().intValue() >= Level.SEVERE.intValue()) {
        out.append("error: ");
      } else if (record.getLevel().intValue() >= Level.WARNING.intValue()) {
        out.append("warning: ");
      }
      out.append(formatMessage(record));
      if (record.getThrown() != null) {
        out.append(": ").append(record.getThrown());
      }
      return out.append(System.lineSeparator()).toString();
    }
  }
}
