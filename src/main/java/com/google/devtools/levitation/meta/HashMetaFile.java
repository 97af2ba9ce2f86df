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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link HashMeta} sidecar files.
 *
 * <p>The format is line based UTF-8 text:
 *
 * <pre>
 * source-hash 5e88...
 * artifact-hash 03ac...
 * skip 120 348 1
 * </pre>
 *
 * Both hash lines are required; {@code skip} lines are optional and kept in order.
 */
public final class HashMetaFile {
  /** File name suffix of a meta file, appended to the artifact's file name. */
  public static final String SUFFIX = ".meta";

  private static final Splitter FIELDS = Splitter.on(' ').omitEmptyStrings().trimResults();

  /** Thrown when a meta file exists but can not be understood. */
  public static final class MalformedMetaException extends IOException {
    MalformedMetaException(Path file, String message) {
      super(file + ": " + message);
    }
  }

  private HashMetaFile() {}

  /** Sidecar path of {@code artifact}: the same path with {@link #SUFFIX} appended. */
  public static Path metaPathFor(Path artifact) {
    return artifact.resolveSibling(artifact.getFileName() + SUFFIX);
  }

  public static HashMeta read(Path file) throws IOException {
    HashCode sourceHash = null;
    HashCode artifactHash = null;
    ImmutableList.Builder<SkipFragment> fragments = ImmutableList.builder();

    int lineNumber = 0;
    for (String line : Files.readAllLines(file, UTF_8)) {
      lineNumber++;
      List<String> fields = FIELDS.splitToList(line);
      if (fields.isEmpty()) {
        continue;
      }
      try {
        switch (fields.get(0)) {
          case "source-hash":
            expectFields(file, lineNumber, fields, 2);
            sourceHash = HashCode.fromString(fields.get(1));
            break;
          case "artifact-hash":
            expectFields(file, lineNumber, fields, 2);
            artifactHash = HashCode.fromString(fields.get(1));
            break;
          case "skip":
            expectFields(file, lineNumber, fields, 4);
            fragments.add(
                new SkipFragment(
                    Integer.parseInt(fields.get(1)),
                    Integer.parseInt(fields.get(2)),
                    parseFlag(file, lineNumber, fields.get(3))));
            break;
          default:
            throw new MalformedMetaException(
                file, String.format("line %d: unknown record '%s'", lineNumber, fields.get(0)));
        }
      } catch (IllegalArgumentException e) {
        // Also covers NumberFormatException and bad hex strings.
        throw new MalformedMetaException(
            file, String.format("line %d: %s", lineNumber, e.getMessage()));
      }
    }

    if (sourceHash == null || artifactHash == null) {
      throw new MalformedMetaException(file, "missing source or artifact hash");
    }
    return new HashMeta(sourceHash, artifactHash, fragments.build());
  }

  public static void write(Path file, HashMeta meta) throws IOException {
    StringBuilder out = new StringBuilder();
    out.append("source-hash ").append(meta.sourceHash()).append('\n');
    out.append("artifact-hash ").append(meta.artifactHash()).append('\n');
    for (SkipFragment fragment : meta.skipFragments()) {
      out.append("skip ")
          .append(fragment.start())
          .append(' ')
          .append(fragment.end())
          .append(' ')
          .append(fragment.replaceWithSemicolon() ? '1' : '0')
          .append('\n');
    }
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, out, UTF_8);
  }

  private static void expectFields(Path file, int lineNumber, List<String> fields, int expected)
      throws MalformedMetaException {
    if (fields.size() != expected) {
      throw new MalformedMetaException(
          file,
          String.format(
              "line %d: expected %d fields, got %d", lineNumber, expected, fields.size()));
    }
  }

  private static boolean parseFlag(Path file, int lineNumber, String flag)
      throws MalformedMetaException {
    switch (flag) {
      case "0":
        return false;
      case "1":
        return true;
      default:
        throw new MalformedMetaException(
            file, String.format("line %d: bad flag '%s'", lineNumber, flag));
    }
  }
}
