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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommandLineTest {
  @Test
  public void keyValueArguments() {
    CommandLine command =
        CommandLine.builder("clang++")
            .addKeyValue("-cppl-src-root", Path.of("src"))
            .addKeyValueIfNotEmpty("-stdlib", "")
            .addKeyValueIfNotEmpty("-cppl-include-preamble", null)
            .addKeyValueIfNotEmpty("-cppl-include-preamble", Path.of("p.pch"))
            .addKeyValues("-cppl-include-dependency", ImmutableList.of("a", "b"))
            .build();

    assertThat(command.arguments())
        .containsExactly(
            "clang++",
            "-cppl-src-root=src",
            "-cppl-include-preamble=p.pch",
            "-cppl-include-dependency=a",
            "-cppl-include-dependency=b")
        .inOrder();
  }

  @Test
  public void pathsAndFlags() {
    CommandLine command =
        CommandLine.builder("ld")
            .addPaths(ImmutableList.of(Path.of("a.o"), Path.of("b.o")))
            .addFlagAndValue("-o", Path.of("a.out"))
            .addAll(ImmutableList.of("-lm"))
            .build();

    assertThat(command.getExecutable()).isEqualTo("ld");
    assertThat(command.toString()).isEqualTo("ld a.o b.o -o a.out -lm");
  }

  @Test
  public void emptyExecutable_rejected() {
    assertThrows(IllegalArgumentException.class, () -> CommandLine.builder(""));
  }
}
