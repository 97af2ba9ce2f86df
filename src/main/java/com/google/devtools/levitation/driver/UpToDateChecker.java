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

import com.google.common.flogger.GoogleLogger;
import com.google.common.hash.HashCode;
import com.google.devtools.levitation.graph.NodeId;
import com.google.devtools.levitation.meta.HashMeta;
import com.google.devtools.levitation.meta.HashMetaFile;
import com.google.devtools.levitation.meta.SourceHasher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * Decides whether an artifact can be reused.
 *
 * <p>An artifact is up to date when it exists, its meta file records the hash of the current
 * source, the preamble was not rebuilt and no dependency was updated in this run. Anything that
 * can not be read counts as out of date; corrupt meta files are reported as warnings.
 */
final class UpToDateChecker {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final RunContext context;

  UpToDateChecker(RunContext context) {
    this.context = context;
  }

  boolean isUpToDate(Path source, Path artifact, Collection<NodeId> dependencies) {
    if (context.isPreambleUpdated()) {
      logger.atFinest().log("%s is outdated, preamble was rebuilt", artifact);
      return false;
    }
    if (context.anyUpdated(dependencies)) {
      logger.atFinest().log("%s is outdated, some of its dependencies were updated", artifact);
      return false;
    }
    return matchesSource(source, artifact);
  }

  /** Like {@link #isUpToDate} for the preamble itself, which depends on nothing else. */
  boolean isPreambleUpToDate(Path source, Path output) {
    return matchesSource(source, output);
  }

  /** Hash the artifact had when its meta was written, null if there is no usable meta. */
  @Nullable
  HashCode readArtifactHash(Path artifact) {
    HashMeta meta = readMeta(artifact, /* reportCorrupt= */ false);
    return meta == null ? null : meta.artifactHash();
  }

  private boolean matchesSource(Path source, Path artifact) {
    if (!Files.exists(artifact)) {
      logger.atFinest().log("%s does not exist", artifact);
      return false;
    }
    HashMeta meta = readMeta(artifact, /* reportCorrupt= */ true);
    if (meta == null) {
      return false;
    }
    HashCode sourceHash;
    try {
      sourceHash = SourceHasher.hashFile(source);
    } catch (IOException e) {
      context.getStatus().addWarning("Failed to hash %s: %s", source, e.getMessage());
      return false;
    }
    if (!sourceHash.equals(meta.sourceHash())) {
      logger.atFinest().log("%s is outdated, %s has changed", artifact, source);
      return false;
    }
    return true;
  }

  @Nullable
  private HashMeta readMeta(Path artifact, boolean reportCorrupt) {
    Path metaFile = HashMetaFile.metaPathFor(artifact);
    if (!Files.exists(metaFile)) {
      logger.atFinest().log("%s has no meta file", artifact);
      return null;
    }
    try {
      return HashMetaFile.read(metaFile);
    } catch (IOException e) {
      if (reportCorrupt) {
        context
            .getStatus()
            .addWarning("Failed to read %s, rebuilding: %s", metaFile, e.getMessage());
      }
      return null;
    }
  }
}
