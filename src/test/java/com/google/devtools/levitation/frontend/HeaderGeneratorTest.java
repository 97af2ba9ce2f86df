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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.devtools.levitation.meta.SkipFragment;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link HeaderGenerator}. */
@RunWith(JUnit4.class)
public final class HeaderGeneratorTest {
  private static final String SOURCE = "int f() { return 1; }\nint x;\n";

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void cutFragments_replacesBodyWithSemicolon() throws Exception {
    // Cuts " { return 1; }".
    SkipFragment body = new SkipFragment(7, 21, true);

    byte[] cut = HeaderGenerator.cutFragments("a", SOURCE.getBytes(UTF_8), ImmutableList.of(body));

    assertThat(new String(cut, UTF_8)).isEqualTo("int f();\nint x;\n");
  }

  @Test
  public void cutFragments_unsortedFragments() throws Exception {
    byte[] cut =
        HeaderGenerator.cutFragments(
            "a",
            "0123456789".getBytes(UTF_8),
            ImmutableList.of(new SkipFragment(6, 8, false), new SkipFragment(1, 3, false)));

    assertThat(new String(cut, UTF_8)).isEqualTo("034589");
  }

  @Test
  public void cutFragments_outOfRange() {
    FrontendException e =
        assertThrows(
            FrontendException.class,
            () ->
                HeaderGenerator.cutFragments(
                    "a/b",
                    "0123".getBytes(UTF_8),
                    ImmutableList.of(new SkipFragment(2, 5, false))));

    assertThat(e).hasMessageThat().contains("out of range");
  }

  @Test
  public void cutFragments_overlapping() {
    FrontendException e =
        assertThrows(
            FrontendException.class,
            () ->
                HeaderGenerator.cutFragments(
                    "a/b",
                    "0123456789".getBytes(UTF_8),
                    ImmutableList.of(
                        new SkipFragment(1, 5, false), new SkipFragment(4, 6, false))));

    assertThat(e).hasMessageThat().contains("overlaps");
  }

  @Test
  public void includeGuard() {
    assertThat(HeaderGenerator.includeGuard("net/http-server2"))
        .isEqualTo("LEVITATION_NET_HTTP_SERVER2_H");
  }

  @Test
  public void render_withIncludes() throws Exception {
    byte[] header =
        HeaderGenerator.render(
            "a/b",
            "struct B {};".getBytes(UTF_8),
            ImmutableList.of("a/c", "d"),
            ImmutableList.of());

    assertThat(new String(header, UTF_8))
        .isEqualTo(
            "#ifndef LEVITATION_A_B_H\n"
                + "#define LEVITATION_A_B_H\n"
                + "\n"
                + "#include \"a/c.h\"\n"
                + "#include \"d.h\"\n"
                + "\n"
                + "struct B {};\n"
                + "\n"
                + "#endif // LEVITATION_A_B_H\n");
  }

  @Test
  public void generate_writesFile() throws Exception {
    Path source = tmp.newFile("b.cppl").toPath();
    Files.writeString(source, SOURCE, UTF_8);
    Path output = tmp.getRoot().toPath().resolve("include/a/b.h");

    new HeaderGenerator(false)
        .generate(
            "a/b",
            source,
            output,
            ImmutableList.of(),
            ImmutableList.of(new SkipFragment(7, 21, true)));

    assertThat(Files.readString(output, UTF_8))
        .isEqualTo(
            "#ifndef LEVITATION_A_B_H\n"
                + "#define LEVITATION_A_B_H\n"
                + "\n"
                + "int f();\n"
                + "int x;\n"
                + "\n"
                + "#endif // LEVITATION_A_B_H\n");
  }

  @Test
  public void generate_dryRunWritesNothing() throws Exception {
    Path output = tmp.getRoot().toPath().resolve("include/a/b.h");

    new HeaderGenerator(true)
        .generate(
            "a/b", tmp.getRoot().toPath().resolve("missing.cppl"), output, ImmutableList.of(),
            ImmutableList.of());

    assertThat(Files.exists(output)).isFalse();
  }
}
