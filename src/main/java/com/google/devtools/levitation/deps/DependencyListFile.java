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
package com.google.devtools.levitation.deps;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Per-unit dependency list, as written by the frontend's parse-import action into {@code
 * <buildRoot>/<unit>.ldeps}.
 *
 * <p>Text format, one record per line, {@code #} starts a comment line:
 *
 * <pre>
 * public
 * external
 * declaration std/vector
 * definition io/file
 * </pre>
 *
 * A dependency is given as {@code /} separated path components; joined they form the unit path of
 * the unit depended upon.
 */
public final class DependencyListFile {
  private static final Splitter RECORD =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults().limit(2);
  private static final Splitter COMPONENTS = Splitter.on('/');
  private static final Joiner PATH_JOINER = Joiner.on('/');

  /** Dependencies of a unit, with every dependency given as a unit path. */
  public record DependencyList(
      ImmutableList<String> declarationDependencies,
      ImmutableList<String> definitionDependencies,
      boolean isPublic,
      boolean isExternal) {
    public DependencyList {
      checkNotNull(declarationDependencies);
      checkNotNull(definitionDependencies);
    }
  }

  /** Thrown when a dependency list can not be parsed. */
  public static final class MalformedDependencyListException extends IOException {
    MalformedDependencyListException(Path file, int lineNumber, String message) {
      super(String.format("%s:%d: %s", file, lineNumber, message));
    }
  }

  private DependencyListFile() {}

  public static DependencyList read(Path file) throws IOException {
    ImmutableList.Builder<String> declarations = ImmutableList.builder();
    ImmutableList.Builder<String> definitions = ImmutableList.builder();
    boolean isPublic = false;
    boolean isExternal = false;

    int lineNumber = 0;
    for (String line : Files.readAllLines(file, UTF_8)) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      List<String> record = RECORD.splitToList(trimmed);
      switch (record.get(0)) {
        case "public":
          isPublic = true;
          break;
        case "external":
          isExternal = true;
          break;
        case "declaration":
          declarations.add(unitPath(file, lineNumber, record));
          break;
        case "definition":
          definitions.add(unitPath(file, lineNumber, record));
          break;
        default:
          throw new MalformedDependencyListException(
              file, lineNumber, "unknown record '" + record.get(0) + "'");
      }
    }
    return new DependencyList(declarations.build(), definitions.build(), isPublic, isExternal);
  }

  public static void write(Path file, DependencyList dependencies) throws IOException {
    StringBuilder out = new StringBuilder();
    if (dependencies.isPublic()) {
      out.append("public\n");
    }
    if (dependencies.isExternal()) {
      out.append("external\n");
    }
    for (String declaration : dependencies.declarationDependencies()) {
      out.append("declaration ").append(declaration).append('\n');
    }
    for (String definition : dependencies.definitionDependencies()) {
      out.append("definition ").append(definition).append('\n');
    }
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, out, UTF_8);
  }

  private static String unitPath(Path file, int lineNumber, List<String> record)
      throws MalformedDependencyListException {
    if (record.size() < 2) {
      throw new MalformedDependencyListException(file, lineNumber, "missing dependency path");
    }
    List<String> components = COMPONENTS.splitToList(record.get(1));
    for (String component : components) {
      if (component.isEmpty() || component.equals(".") || component.equals("..")) {
        throw new MalformedDependencyListException(
            file, lineNumber, "bad dependency path '" + record.get(1) + "'");
      }
    }
    return PATH_JOINER.join(components);
  }
}
