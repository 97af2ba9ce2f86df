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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.devtools.levitation.testing.FakeFrontend;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End to end tests of {@link LevitationMain}, with {@link FakeFrontend} as the compiler. */
@RunWith(JUnit4.class)
public final class LevitationMainTest {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final FakeFrontend frontend = new FakeFrontend();
  private Path src;
  private Path build;

  @Before
  public void setUp() throws Exception {
    src = tmp.newFolder("src").toPath();
    build = tmp.getRoot().toPath().resolve("build");
    Files.writeString(src.resolve("main.cppl"), "int main() {}\n", UTF_8);
  }

  @Test
  public void successfulBuild() {
    assertThat(run("-root", src.toString(), "-buildRoot", build.toString(), "-o", out()))
        .isEqualTo(LevitationMain.EXIT_SUCCESS);
    assertThat(frontend.actions()).containsExactly("PARSE main", "OBJ main", "LINK");
  }

  @Test
  public void failedBuild() {
    frontend.failOn("OBJ main");

    assertThat(run("-root", src.toString(), "-buildRoot", build.toString(), "-o", out()))
        .isEqualTo(LevitationMain.EXIT_BUILD_FAILED);
  }

  @Test
  public void unknownOption() {
    assertThat(run("--no-such-option")).isEqualTo(LevitationMain.EXIT_WRONG_ARGUMENTS);
    assertThat(frontend.actions()).isEmpty();
  }

  @Test
  public void invalidOptions() {
    assertThat(run("-root", tmp.getRoot().toPath().resolve("missing").toString()))
        .isEqualTo(LevitationMain.EXIT_WRONG_ARGUMENTS);
    assertThat(frontend.actions()).isEmpty();
  }

  @Test
  public void help() {
    assertThat(run("--help")).isEqualTo(LevitationMain.EXIT_SUCCESS);
    assertThat(frontend.actions()).isEmpty();
  }

  @Test
  public void formatter_tagsWarningsAndErrors() {
    LoggingSetup.DriverFormatter formatter = new LoggingSetup.DriverFormatter();
    String newline = System.lineSeparator();

    assertThat(formatter.format(new LogRecord(Level.SEVERE, "boom")))
        .isEqualTo("error: boom" + newline);
    assertThat(formatter.format(new LogRecord(Level.WARNING, "hmm")))
        .isEqualTo("warning: hmm" + newline);
    assertThat(formatter.format(new LogRecord(Level.INFO, "LINK"))).isEqualTo("LINK" + newline);
  }

  private int run(String... args) {
    return LevitationMain.run(args, options -> new BuildSession(options, frontend));
  }

  private String out() {
    return tmp.getRoot().toPath().resolve("app").toString();
  }
}
