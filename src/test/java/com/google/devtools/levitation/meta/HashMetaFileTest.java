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
package com.google.devtools.levitation.meta;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link HashMetaFile} and {@link SourceHasher}. */
@RunWith(JUnit4.class)
public final class HashMetaFileTest {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final HashCode SOURCE = Hashing.sha256().hashBytes("int f();".getBytes(UTF_8));
  private static final HashCode ARTIFACT = Hashing.sha256().hashBytes(new byte[] {1, 2, 3});

  @Test
  public void metaPathFor_appendsSuffix() {
    assertThat(HashMetaFile.metaPathFor(Path.of("build", "a", "b.decl-ast")))
        .isEqualTo(Path.of("build", "a", "b.decl-ast.meta"));
  }

  @Test
  public void writeThenRead_keepsFragmentsInOrder() throws Exception {
    Path file = tmp.getRoot().toPath().resolve("sub/dir/a.decl-ast.meta");
    HashMeta meta =
        new HashMeta(
            SOURCE,
            ARTIFACT,
            ImmutableList.of(new SkipFragment(40, 60, true), new SkipFragment(10, 20, false)));

    HashMetaFile.write(file, meta);

    assertThat(HashMetaFile.read(file)).isEqualTo(meta);
    assertThat(Files.readAllLines(file, UTF_8))
        .containsExactly(
            "source-hash " + SOURCE,
            "artifact-hash " + ARTIFACT,
            "skip 40 60 1",
            "skip 10 20 0")
        .inOrder();
  }

  @Test
  public void read_toleratesBlankLinesAndExtraSpaces() throws Exception {
    Path file = write("\nsource-hash  " + SOURCE + "\n\n  artifact-hash " + ARTIFACT + "  \n");

    assertThat(HashMetaFile.read(file)).isEqualTo(new HashMeta(SOURCE, ARTIFACT));
  }

  @Test
  public void read_missingHash() throws Exception {
    Path file = write("source-hash " + SOURCE + "\n");

    assertThrows(HashMetaFile.MalformedMetaException.class, () -> HashMetaFile.read(file));
  }

  @Test
  public void read_badHex() throws Exception {
    Path file = write("source-hash xyz\nartifact-hash " + ARTIFACT + "\n");

    assertThrows(HashMetaFile.MalformedMetaException.class, () -> HashMetaFile.read(file));
  }

  @Test
  public void read_badFragment() throws Exception {
    assertThrows(
        HashMetaFile.MalformedMetaException.class,
        () -> HashMetaFile.read(withFragment("skip 10 x 0")));
    assertThrows(
        HashMetaFile.MalformedMetaException.class,
        () -> HashMetaFile.read(withFragment("skip 20 10 0")));
    assertThrows(
        HashMetaFile.MalformedMetaException.class,
        () -> HashMetaFile.read(withFragment("skip 10 20 2")));
    assertThrows(
        HashMetaFile.MalformedMetaException.class,
        () -> HashMetaFile.read(withFragment("skip 10 20")));
  }

  @Test
  public void read_unknownRecord() throws Exception {
    assertThrows(
        HashMetaFile.MalformedMetaException.class,
        () -> HashMetaFile.read(withFragment("md5 abc")));
  }

  @Test
  public void read_missingFile() {
    assertThrows(
        NoSuchFileException.class,
        () -> HashMetaFile.read(tmp.getRoot().toPath().resolve("nope.meta")));
  }

  @Test
  public void sourceHasher_hashesContent() throws Exception {
    Path file = write("int f();");

    assertThat(SourceHasher.hashFile(file)).isEqualTo(SOURCE);
    assertThat(SourceHasher.hashFile(file)).isNotEqualTo(ARTIFACT);
    assertThat(SOURCE.bits()).isEqualTo(256);
  }

  private Path withFragment(String line) throws IOException {
    return write("source-hash " + SOURCE + "\nartifact-hash " + ARTIFACT + "\n" + line + "\n");
  }

  private Path write(String content) throws IOException {
    Path file = tmp.newFile().toPath();
    Files.writeString(file, content, UTF_8);
    return file;
  }
}
