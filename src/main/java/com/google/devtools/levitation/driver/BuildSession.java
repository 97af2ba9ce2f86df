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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.levitation.concurrent.TaskScheduler;
import com.google.devtools.levitation.frontend.CompilerFrontend;
import com.google.devtools.levitation.frontend.Frontend;
import com.google.devtools.levitation.util.UnitInterner;

/**
 * Everything a driver run shares: options, the unit pool, the worker pool and the frontend.
 * Created once per process; closing it shuts the worker pool down.
 */
public final class BuildSession implements AutoCloseable {
  private final DriverOptions options;
  private final UnitInterner interner = new UnitInterner();
  private final TaskScheduler scheduler;
  private final Frontend frontend;

  public BuildSession(DriverOptions options, Frontend frontend) {
    this(options, frontend, new TaskScheduler(options.getPoolSize()));
  }

  public BuildSession(DriverOptions options, Frontend frontend, TaskScheduler scheduler) {
    this.options = checkNotNull(options);
    this.frontend = checkNotNull(frontend);
    this.scheduler = checkNotNull(scheduler);
  }

  /** Session driving {@code clang++} as configured by {@code options}. */
  public static BuildSession create(DriverOptions options) {
    return new BuildSession(
        options,
        new CompilerFrontend(
            new CompilerFrontend.Settings(
                options.binDir,
                options.stdlib,
                options.getExtraPreambleArgs(),
                options.getExtraParserArgs(),
                options.getExtraCodeGenArgs(),
                options.getExtraLinkerArgs(),
                options.dryRun)));
  }

  public DriverOptions getOptions() {
    return options;
  }

  public UnitInterner getInterner() {
    return interner;
  }

  public TaskScheduler getScheduler() {
    return scheduler;
  }

  public Frontend getFrontend() {
    return frontend;
  }

  @Override
  public void close() {
    scheduler.close();
  }
}
