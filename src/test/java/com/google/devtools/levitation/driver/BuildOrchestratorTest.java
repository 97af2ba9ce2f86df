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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.devtools.levitation.deps.DependencyListFile;
import com.google.devtools.levitation.deps.DependencyListFile.DependencyList;
import com.google.devtools.levitation.testing.FakeFrontend;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.rules.Timeout;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link BuildOrchestrator}, running whole builds of a small project on {@link
 * FakeFrontend}.
 *
 * <p>The project: {@code main} needs the definition of {@code b}, whose declaration needs the
 * public unit {@code a}.
 */
@RunWith(JUnit4.class)
public final class BuildOrchestratorTest {
  private static final String A = "@public\ndecl int a();\nint a() { return 1; }\n";
  private static final String B = "@import a\ndecl int b();\nint b() { return a(); }\n";
  private static final String MAIN = "@import-def b\nint main() { return b(); }\n";

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();
  @Rule public final Timeout timeout = Timeout.seconds(60);

  private final FakeFrontend frontend = new FakeFrontend();
  private Path src;
  private Path build;
  private Path output;
  private BuildOrchestrator orchestrator;

  @Before
  public void setUp() throws Exception {
    src = tmp.newFolder("src").toPath();
    build = tmp.getRoot().toPath().resolve("build");
    output = tmp.getRoot().toPath().resolve("out/app");
    writeSource("a", A);
    writeSource("b", B);
    writeSource("main", MAIN);
  }

  @Test
  public void firstBuild_buildsEverythingOnce() throws Exception {
    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions())
        .containsExactly(
            "PARSE a", "PARSE b", "PARSE main", "DECL a", "DECL b", "OBJ a", "OBJ b",
            "OBJ main", "LINK");
    assertThat(frontend.actions().indexOf("DECL a"))
        .isLessThan(frontend.actions().indexOf("DECL b"));
    assertThat(frontend.actions().indexOf("DECL b"))
        .isLessThan(frontend.actions().indexOf("OBJ main"));
    assertThat(frontend.actions().indexOf("LINK")).isEqualTo(frontend.actions().size() - 1);
    assertThat(Files.exists(output)).isTrue();
    assertThat(Files.exists(build.resolve("a.decl-ast.meta"))).isTrue();
    assertThat(orchestrator.getContext().getStatus().hasWarnings()).isFalse();
  }

  @Test
  public void secondBuild_doesNothing() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).isEmpty();
    assertThat(orchestrator.getContext().getUpdatedNodes()).isEmpty();
  }

  @Test
  public void declarationChange_rebuildsDependents() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();
    writeSource("a", "@public\ndecl int a(int x);\nint a(int x) { return x; }\n");

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions())
        .containsExactly("PARSE a", "DECL a", "OBJ a", "DECL b", "OBJ b", "LINK");
  }

  @Test
  public void bodyChange_rebuildsOnlyTheUnit() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();
    writeSource("a", "@public\ndecl int a();\nint a() { return 2; }\n");

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).containsExactly("PARSE a", "DECL a", "OBJ a", "LINK");
  }

  @Test
  public void missingOutput_relinksOnly() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();
    Files.delete(output);

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).containsExactly("LINK");
  }

  @Test
  public void missingArtifact_isRebuiltWithoutRelinkingSameContent() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();
    Files.delete(build.resolve("main.o"));

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).containsExactly("OBJ main");
  }

  @Test
  public void corruptMeta_warnsAndRebuilds() throws Exception {
    assertThat(build(frontend)).isTrue();
    frontend.clearActions();
    Files.writeString(build.resolve("a.o.meta"), "garbage\n", UTF_8);

    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).containsExactly("OBJ a", "LINK");
    assertThat(orchestrator.getContext().getStatus().getWarnings()).hasSize(1);
    assertThat(orchestrator.getContext().getStatus().getWarnings().get(0))
        .startsWith("Failed to read " + build.resolve("a.o.meta"));
  }

  @Test
  public void dependencyCycle_failsBeforeCodeGen() throws Exception {
    writeSource("a", "@import b\ndecl int a();\n");

    assertThat(build(frontend)).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .startsWith("Dependencies solver: Dependency cycle: ");
    assertThat(frontend.actions()).containsExactly("PARSE a", "PARSE b", "PARSE main");
  }

  @Test
  public void unknownDependency_fails() throws Exception {
    writeSource("main", "@import-def nowhere\nint main() {}\n");

    assertThat(build(frontend)).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo(
            "Dependencies solver: Unit 'main' depends on 'nowhere', which is not found.");
  }

  @Test
  public void parseImportFailure_stopsTheBuild() throws Exception {
    frontend.failOn("PARSE b");

    assertThat(build(frontend)).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo("Parse import: phase failed.");
    assertThat(frontend.actions()).containsExactly("PARSE a", "PARSE b", "PARSE main");
  }

  @Test
  public void codeGenFailure_skipsDependentsAndLink() throws Exception {
    frontend.failOn("DECL a");

    assertThat(build(frontend)).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo("Codegen: phase failed.");
    assertThat(frontend.actions()).containsAtLeast("DECL a", "OBJ a");
    assertThat(frontend.actions()).containsNoneOf("DECL b", "OBJ b", "OBJ main", "LINK");
  }

  @Test
  public void codeGenFailure_reportsFirstErrorVerbatim() throws Exception {
    List<LogRecord> errors = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            if (record.getLevel().equals(Level.SEVERE)) {
              errors.add(record);
            }
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Logger logger = Logger.getLogger(BuildOrchestrator.class.getName());
    logger.addHandler(handler);
    frontend.failOn("DECL a");
    try {
      assertThat(build(frontend)).isFalse();
    } finally {
      logger.removeHandler(handler);
    }

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo("Codegen: phase failed.");
    assertThat(frontend.actions()).doesNotContain("LINK");
    assertThat(errors).isNotEmpty();
    assertThat(new LoggingSetup.DriverFormatter().format(Iterables.getLast(errors)))
        .isEqualTo("error: Codegen: phase failed." + System.lineSeparator());
  }

  @Test
  public void unusedDeclaration_isNotBuilt() throws Exception {
    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).doesNotContain("DECL main");
    assertThat(Files.exists(build.resolve("main.decl-ast"))).isFalse();
    assertThat(Files.exists(build.resolve("main.o"))).isTrue();

    frontend.clearActions();
    writeSource("app", "@import main\nint app() { return 0; }\n");
    assertThat(build(frontend)).isTrue();

    assertThat(frontend.actions()).containsAtLeast("PARSE app", "DECL main", "OBJ app", "LINK");
    assertThat(frontend.actions()).containsNoneOf("DECL app", "OBJ main");
    assertThat(Files.exists(build.resolve("main.decl-ast"))).isTrue();
  }

  @Test
  public void linkFailure() throws Exception {
    frontend.failOn("LINK");

    assertThat(build(frontend)).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo("Link: phase failed. LINK failed");
  }

  @Test
  public void preambleChange_rebuildsEverything() throws Exception {
    Path preamble = tmp.newFile("preamble.h").toPath();
    Files.writeString(preamble, "#include <vector>\n", UTF_8);
    assertThat(build(frontend, "-preamble", preamble.toString())).isTrue();
    assertThat(frontend.actions()).contains("PREAMBLE");
    assertThat(Files.exists(build.resolve("preamble.pch"))).isTrue();

    frontend.clearActions();
    assertThat(build(frontend, "-preamble", preamble.toString())).isTrue();
    assertThat(frontend.actions()).isEmpty();

    Files.writeString(preamble, "#include <map>\n", UTF_8);
    assertThat(build(frontend, "-preamble", preamble.toString())).isTrue();
    assertThat(frontend.actions())
        .containsExactly(
            "PREAMBLE", "PARSE a", "PARSE b", "PARSE main", "DECL a", "DECL b", "OBJ a",
            "OBJ b", "OBJ main", "LINK");
    assertThat(orchestrator.getContext().isPreambleUpdated()).isTrue();
  }

  @Test
  public void compileOnly_generatesHeadersOfPublicUnits() throws Exception {
    assertThat(build(frontend, "-c")).isTrue();

    assertThat(frontend.actions()).doesNotContain("LINK");
    assertThat(Files.exists(output)).isFalse();
    Path header = build.resolve("include/a.h");
    assertThat(Files.readString(header, UTF_8))
        .isEqualTo(
            "#ifndef LEVITATION_A_H\n#define LEVITATION_A_H\n\n"
                + A
                + "\n#endif // LEVITATION_A_H\n");
    assertThat(Files.exists(build.resolve("include/b.h"))).isFalse();
    assertThat(Files.exists(build.resolve("include/main.h"))).isFalse();

    frontend.clearActions();
    Files.delete(header);
    assertThat(build(frontend, "-c")).isTrue();
    assertThat(frontend.actions()).isEmpty();
    assertThat(Files.exists(header)).isTrue();
  }

  @Test
  public void declarationsDir_receivesPublicDeclarations() throws Exception {
    Path decls = tmp.getRoot().toPath().resolve("decls");

    assertThat(build(frontend, "-decl-out", decls.toString())).isTrue();

    assertThat(Files.exists(decls.resolve("a.h"))).isTrue();
    assertThat(Files.exists(decls.resolve("b.h"))).isFalse();
  }

  @Test
  public void libraryUnits_areUsedButNotBuilt() throws Exception {
    Path lib = tmp.newFolder("lib").toPath();
    Files.createDirectories(lib.resolve("std"));
    Files.writeString(lib.resolve("std/io.decl-ast"), "decl void print();\n", UTF_8);
    DependencyListFile.write(
        lib.resolve("std/io.ldeps"),
        new DependencyList(ImmutableList.of(), ImmutableList.of(), true, true));
    writeSource("b", "@import a\n@import std/io\ndecl int b();\nint b() { return a(); }\n");

    assertThat(build(frontend, "-I", lib.toString())).isTrue();

    assertThat(frontend.actions()).containsNoneOf("DECL std/io", "OBJ std/io");
    assertThat(frontend.actions()).containsAtLeast("DECL b", "OBJ b", "LINK");
  }

  @Test
  public void libraryUnit_withUnknownDependency_fails() throws Exception {
    Path lib = tmp.newFolder("lib").toPath();
    Files.createDirectories(lib.resolve("std"));
    Files.writeString(lib.resolve("std/io.decl-ast"), "decl void print();\n", UTF_8);
    DependencyListFile.write(
        lib.resolve("std/io.ldeps"),
        new DependencyList(ImmutableList.of("std/missing"), ImmutableList.of(), true, true));
    writeSource("b", "@import a\n@import std/io\ndecl int b();\nint b() { return a(); }\n");

    assertThat(build(frontend, "-I", lib.toString())).isFalse();

    assertThat(orchestrator.getContext().getStatus().getErrorMessage())
        .isEqualTo(
            "Dependencies solver: Unit 'std/io' depends on 'std/missing', which is not found.");
    assertThat(frontend.actions()).containsNoneOf("DECL a", "OBJ a", "LINK");
  }

  @Test
  public void dryRun_stopsAfterParseImportOnCleanTree() throws Exception {
    FakeFrontend dryRun = new FakeFrontend(/* dryRun= */ true);

    assertThat(build(dryRun, "-###")).isTrue();

    assertThat(dryRun.actions()).containsExactly("PARSE a", "PARSE b", "PARSE main");
    assertThat(orchestrator.getContext().getStatus().getWarnings())
        .containsExactly(
            "Dry run: 3 dependency file(s) are not built yet, can't go beyond parse import.");
    assertThat(Files.exists(build)).isFalse();
  }

  @Test
  public void dryRun_assumesRebuiltArtifactsChanged() throws Exception {
    assertThat(build(frontend)).isTrue();
    writeSource("a", "@public\ndecl int a();\nint a() { return 2; }\n");
    FakeFrontend dryRun = new FakeFrontend(/* dryRun= */ true);

    assertThat(build(dryRun, "-###")).isTrue();

    assertThat(dryRun.actions())
        .containsExactly(
            "PARSE a", "DECL a", "OBJ a", "DECL b", "OBJ b", "OBJ main", "LINK");
    assertThat(Files.readString(build.resolve("a.o"), UTF_8)).isEqualTo(A);
  }

  @Test
  public void noSources_warns() throws Exception {
    for (String unit : ImmutableList.of("a", "b", "main")) {
      Files.delete(src.resolve(unit + ".cppl"));
    }

    assertThat(build(frontend)).isTrue();

    assertThat(orchestrator.getContext().getStatus().getWarnings())
        .containsExactly("No '.cppl' files found in '" + src + "'");
    assertThat(frontend.actions()).isEmpty();
  }

  private boolean build(FakeFrontend frontend, String... extraArgs) throws Exception {
    List<String> args = new ArrayList<>();
    args.addAll(
        ImmutableList.of(
            "-root", src.toString(), "-buildRoot", build.toString(), "-o", output.toString(),
            "-j", "3"));
    args.addAll(Arrays.asList(extraArgs));
    DriverOptions options = DriverOptions.parse(args.toArray(new String[0]));
    try (BuildSession session = new BuildSession(options, frontend)) {
      orchestrator = new BuildOrchestrator(session);
      return orchestrator.run();
    }
  }

  private void writeSource(String unit, String content) throws IOException {
    Files.writeString(src.resolve(unit + ".cppl"), content, UTF_8);
  }
}
