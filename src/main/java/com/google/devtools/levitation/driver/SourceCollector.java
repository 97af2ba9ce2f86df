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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.util.BuildStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Finds the units of a build: every {@code .cppl} file below the sources root, and every prebuilt
 * {@code .decl-ast} below the library paths. A unit path is the file path relative to its root,
 * without extension and with {@code /} as separator.
 */
final class SourceCollector {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final DriverOptions options;

  SourceCollector(DriverOptions options) {
    this.options = options;
  }

  /**
   * Returns the files of all units by unit path, project units first, both groups sorted by path.
   * A library unit shadowed by a project unit, or by a library listed earlier, is dropped with a
   * warning.
   */
  ImmutableMap<String, FilesInfo> collect(BuildStatus status) throws IOException {
    logger.atFine().log("Collecting sources...");

    Path headersDir = options.shouldCreateHeaders() ? options.getHeadersDir() : null;
    Map<String, FilesInfo> units = new LinkedHashMap<>();
    ImmutableList<String> sources =
        findUnits(options.sourcesRoot, FileExtensions.SOURCE, options.buildRoot);
    for (String unitPath : sources) {
      units.put(
          unitPath,
          FilesInfo.forProjectUnit(
              unitPath,
              options.sourcesRoot,
              options.buildRoot,
              headersDir,
              options.declarationsDir));
    }
    logger.atFine().log("Found %d '.%s' files.", sources.size(), FileExtensions.SOURCE);

    for (Path library : options.libraryPaths) {
      ImmutableList<String> libraryUnits =
          findUnits(library, FileExtensions.DECLARATION_AST, /* excluded= */ null);
      for (String unitPath : libraryUnits) {
        FilesInfo existing = units.get(unitPath);
        if (existing != null) {
          status.addWarning(
              "Library unit '%s' in '%s' is shadowed by %s",
              unitPath,
              library,
              existing.isExternal() ? existing.declarationAst() : existing.source());
          continue;
        }
        units.put(unitPath, FilesInfo.forLibraryUnit(unitPath, library));
      }
      logger.atFine().log("Found %d library units in '%s'.", libraryUnits.size(), library);
    }
    return ImmutableMap.copyOf(units);
  }

  /** Unit paths of files with {@code extension} below {@code root}, except in {@code excluded}. */
  static ImmutableList<String> findUnits(Path root, String extension, @Nullable Path excluded)
      throws IOException {
    String suffix = "." + extension;
    Path absoluteRoot = root.toAbsolutePath().normalize();
    Path absoluteExcluded = excluded == null ? null : excluded.toAbsolutePath().normalize();
    try (Stream<Path> files = Files.walk(absoluteRoot)) {
      return files
          .filter(file -> absoluteExcluded == null || !file.startsWith(absoluteExcluded))
          .filter(Files::isRegularFile)
          .filter(file -> file.getFileName().toString().endsWith(suffix))
          .map(file -> unitPath(absoluteRoot.relativize(file), suffix))
          .sorted()
          .collect(toImmutableList());
    }
  }

  private static String unitPath(Path relative, String suffix) {
    String path = Joiner.on('/').join(relative);
    return path.substring(0, path.length() - suffix.length());
  }
}
