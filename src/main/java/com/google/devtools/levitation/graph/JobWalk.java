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
package com.google.devtools.levitation.graph;

import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.concurrent.TaskId;
import com.google.devtools.levitation.concurrent.TaskScheduler;
import com.google.devtools.levitation.graph.DependencyGraph.NodeAction;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Bottom-up parallel walk behind {@link DependencyGraph#dfsJobs}.
 *
 * <p>Each node gets exactly one job, created by whichever caller claims the node first; later
 * callers wait for that same job. A job first fans its dependencies out as sub-jobs and waits for
 * them, then runs the action on its own node. The last dependency of every fan-out runs inline on
 * the current thread, so the number of threads needed is bounded by the branching of the graph
 * rather than its depth.
 */
final class JobWalk {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final DependencyGraph graph;
  private final TaskScheduler scheduler;
  private final NodeAction action;

  @GuardedBy("this")
  private final Map<NodeId, TaskId> jobs = new HashMap<>();

  JobWalk(DependencyGraph graph, TaskScheduler scheduler, NodeAction action) {
    this.graph = graph;
    this.scheduler = scheduler;
    this.action = action;
  }

  boolean run(Collection<NodeId> startingPoints) throws InterruptedException {
    return visit(null, startingPoints);
  }

  private boolean visit(@Nullable Node node, Collection<NodeId> subNodes)
      throws InterruptedException {
    Set<TaskId> subJobs = new LinkedHashSet<>();
    int remaining = subNodes.size();
    for (NodeId subNodeId : subNodes) {
      boolean last = --remaining == 0;
      Node subNode = graph.getNode(subNodeId);
      TaskId job;
      boolean claimed = false;
      synchronized (this) {
        job = jobs.get(subNodeId);
        if (job == null) {
          job =
              scheduler.newTask(
                  context ->
                      context.setSuccessful(visit(subNode, subNode.getDependencies())));
          jobs.put(subNodeId, job);
          claimed = true;
        }
      }
      if (claimed) {
        logger.atFinest().log(
            "Scheduling %s for %s%s", job, graph.describe(subNodeId), last ? " inline" : "");
        scheduler.startTask(job, /* sameThread= */ last);
      }
      subJobs.add(job);
    }

    boolean successful = subJobs.isEmpty() || scheduler.waitForTasks(subJobs);

    if (node == null) {
      return successful;
    }
    if (!successful) {
      logger.atFine().log(
          "Skipping %s, some of its dependencies failed", graph.describe(node.getId()));
      return false;
    }
    return action.process(node);
  }
}
