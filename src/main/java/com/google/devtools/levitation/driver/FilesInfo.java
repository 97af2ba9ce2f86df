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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.levitation.meta.HashMetaFile;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Paths of everything that belongs to one unit. Project units have all of them; library units only
 * have the prebuilt dependency list and declaration AST, found in their library directory.
 *
 * @param header generated header, null unless headers are requested
 * @param declaration generated declaration text, null unless requested
 */
public record FilesInfo(
    String unitPath,
    @Nullable Path source,
    Path dependencyList,
    Path declarationAst,
    @Nullable Path object,
    @Nullable Path header,
    @Nullable Path declaration) {
  public FilesInfo {
    checkNotNull(unitPath);
    checkNotNull(dependencyList);
    checkNotNull(declarationAst);
    checkArgument(
        (source == null) == (object == null),
        "Unit '%s' must have both source and object, or neither",
        unitPath);
  }

  static FilesInfo forProjectUnit(
      String unitPath,
      Path sourcesRoot,
      Path buildRoot,
      @Nullable Path headersDir,
      @Nullable Path declarationsDir) {
    return new FilesInfo(
        unitPath,
        withExtension(sourcesRoot, unitPath, FileExtensions.SOURCE),
        withExtension(buildRoot, unitPath, FileExtensions.DEPENDENCY_LIST),
        withExtension(buildRoot, unitPath, FileExtensions.DECLARATION_AST),
        withExtension(buildRoot, unitPath, FileExtensions.OBJECT),
        headersDir == null ? null : withExtension(headersDir, unitPath, FileExtensions.HEADER),
        declarationsDir == null
            ? null
            : withExtension(declarationsDir, unitPath, FileExtensions.HEADER));
  }

  static FilesInfo forLibraryUnit(String unitPath, Path libraryDir) {
    return new FilesInfo(
        unitPath,
        null,
        withExtension(libraryDir, unitPath, FileExtensions.DEPENDENCY_LIST),
        withExtension(libraryDir, unitPath, FileExtensions.DECLARATION_AST),
        null,
        null,
        null);
  }

  /** Whether the unit comes prebuilt from a library directory. */
  public boolean isExternal() {
    return source == null;
  }

  public Path dependencyListMeta() {
    return HashMetaFile.metaPathFor(dependencyList);
  }

  public Path declarationAstMeta() {
    return HashMetaFile.metaPathFor(declarationAst);
  }

  static Path withExtension(Path dir, String unitPath, String extension) {
    return dir.resolve(unitPath + "." + extension);
  }
}
