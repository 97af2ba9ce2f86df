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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * The compiler frontend, as seen by the build driver.
 *
 * <p>Every action either produces its output artifact together with the artifact's hash meta file
 * ({@code <output>.meta}, see {@link com.google.devtools.levitation.meta.HashMetaFile}), or throws.
 * Parse-import writes the unit's dependency list instead of a compiled artifact. Implementations
 * must be safe to call from several worker threads at once.
 */
public interface Frontend {

  /** Precompiles the shared preamble. */
  record PreambleRequest(Path source, Path output) {
    public PreambleRequest {
      checkNotNull(source);
      checkNotNull(output);
    }
  }

  /** Reads the imports of a unit and writes its dependency list. */
  record ParseImportRequest(
      String unitPath,
      Path source,
      Path sourcesRoot,
      Path dependencyList,
      @Nullable Path preamble) {
    public ParseImportRequest {
      checkNotNull(unitPath);
      checkNotNull(source);
      checkNotNull(sourcesRoot);
      checkNotNull(dependencyList);
    }
  }

  /**
   * Builds the declaration or the object of a unit.
   *
   * @param dependencies declaration artifacts of everything the node depends on, dependencies of a
   *     declaration artifact always listed before it
   */
  record BuildRequest(
      String unitPath,
      Path source,
      Path output,
      ImmutableList<Path> dependencies,
      @Nullable Path preamble) {
    public BuildRequest {
      checkNotNull(unitPath);
      checkNotNull(source);
      checkNotNull(output);
      checkNotNull(dependencies);
    }
  }

  /** Links object artifacts into the final output. */
  record LinkRequest(ImmutableList<Path> objects, Path output) {
    public LinkRequest {
      checkNotNull(objects);
      checkNotNull(output);
    }
  }

  void buildPreamble(PreambleRequest request) throws FrontendException, InterruptedException;

  void parseImport(ParseImportRequest request) throws FrontendException, InterruptedException;

  void buildDeclaration(BuildRequest request) throws FrontendException, InterruptedException;

  void buildObject(BuildRequest request) throws FrontendException, InterruptedException;

  void link(LinkRequest request) throws FrontendException, InterruptedException;

  /**
   * Whether actions only report what they would do. A dry-run frontend produces no artifacts, so
   * the pipeline stops as soon as it needs one.
   */
  default boolean isDryRun() {
    return false;
  }
}
