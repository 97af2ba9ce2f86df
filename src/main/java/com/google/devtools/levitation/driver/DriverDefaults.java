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

/** Default values of driver options and well known names inside the build root. */
public final class DriverDefaults {
  public static final String SOURCES_ROOT = ".";
  public static final String BUILD_ROOT = "build";
  public static final String HEADERS_DIR = "include";
  public static final String STDLIB = "libstdc++";
  public static final String OUTPUT_EXECUTABLE = "a.out";
  public static final String OUTPUT_OBJECTS_DIR = "a.dir";
  public static final String PREAMBLE_OUTPUT = "preamble.pch";

  private DriverDefaults() {}
}
