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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.levitation.graph.DependencyGraph;
import com.google.devtools.levitation.graph.NodeId;
import com.google.devtools.levitation.util.BuildStatus;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * State of one driver run, shared by all phases and worker threads.
 *
 * <p>The file table and the graph are published once, by the phase producing them, and read-only
 * afterwards. The set of nodes updated during the run and the status are concurrent.
 */
public final class RunContext {
  private final BuildStatus status = new BuildStatus();
  private final Set<NodeId> updatedNodes = ConcurrentHashMap.newKeySet();

  private volatile ImmutableMap<Integer, FilesInfo> files;
  @Nullable private volatile DependencyGraph graph;
  private volatile boolean preambleUpdated;
  private volatile boolean stopped;

  public BuildStatus getStatus() {
    return status;
  }

  /** Whether later phases should run: the status is valid and nothing asked to stop early. */
  public boolean shouldContinue() {
    return !stopped && status.isValid();
  }

  /** Ends the run after the current phase without failing it. */
  void stop() {
    stopped = true;
  }

  void setFiles(ImmutableMap<Integer, FilesInfo> files) {
    checkState(this.files == null, "Files are already collected");
    this.files = checkNotNull(files);
  }

  /** Files of all collected units, by unit id. */
  public ImmutableMap<Integer, FilesInfo> getFiles() {
    checkState(files != null, "Sources are not collected yet");
    return files;
  }

  public FilesInfo getFiles(int unitId) {
    FilesInfo info = getFiles().get(unitId);
    checkArgument(info != null, "Unit #%s was not collected", unitId);
    return info;
  }

  void setGraph(DependencyGraph graph) {
    checkState(this.graph == null, "Dependencies are already solved");
    this.graph = checkNotNull(graph);
  }

  @Nullable
  public DependencyGraph getGraph() {
    return graph;
  }

  void setPreambleUpdated() {
    preambleUpdated = true;
  }

  /** Whether the preamble was rebuilt in this run, which outdates every other artifact. */
  public boolean isPreambleUpdated() {
    return preambleUpdated;
  }

  /** Records that the artifact of {@code id} changed in this run. */
  void markUpdated(NodeId id) {
    updatedNodes.add(id);
  }

  public boolean isUpdated(NodeId id) {
    return updatedNodes.contains(id);
  }

  public boolean anyUpdated(Collection<NodeId> ids) {
    for (NodeId id : ids) {
      if (isUpdated(id)) {
        return true;
      }
    }
    return false;
  }

  public ImmutableSet<NodeId> getUpdatedNodes() {
    return ImmutableSet.copyOf(updatedNodes);
  }
}
