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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search for dependency cycles over the {@code Dependencies} edges of a graph.
 *
 * <p>We visit the graph depth-first, keeping track of the path we are currently on. Visiting a
 * node pushes it onto the path, pushes a marker onto the stack and then pushes its unfinished
 * children. When the marker comes back to the top, the whole downward closure of the node has been
 * visited and the node is popped off the path. Meeting a node that is still on the path closes a
 * cycle.
 */
final class CycleDetector {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Do not keep on searching for cycles after this many were found. */
  static final int MAX_CYCLES = 20;

  private static final NodeId CHILDREN_FINISHED = new NodeId(NodeKind.DECLARATION, -1);

  private enum Color {
    ON_PATH,
    DONE
  }

  private CycleDetector() {}

  static ImmutableList<CycleInfo> findCycles(Map<NodeId, Node> nodes) {
    Set<CycleInfo> cycles = new LinkedHashSet<>();
    Map<NodeId, Color> colors = new HashMap<>();
    List<NodeId> graphPath = new ArrayList<>();
    // Explicit stack instead of recursion, dependency chains can be long.
    Deque<NodeId> toVisit = new ArrayDeque<>();

    for (NodeId start : nodes.keySet()) {
      if (colors.containsKey(start)) {
        continue;
      }
      toVisit.push(start);
      while (!toVisit.isEmpty() && cycles.size() < MAX_CYCLES) {
        NodeId id = toVisit.pop();
        if (id == CHILDREN_FINISHED) {
          NodeId finished = graphPath.remove(graphPath.size() - 1);
          colors.put(finished, Color.DONE);
          continue;
        }

        Color color = colors.get(id);
        if (color == Color.DONE) {
          continue;
        }
        if (color == Color.ON_PATH) {
          int cycleStart = graphPath.indexOf(id);
          CycleInfo cycle =
              new CycleInfo(
                  graphPath.subList(0, cycleStart),
                  graphPath.subList(cycleStart, graphPath.size()));
          if (cycles.add(cycle)) {
            logger.atFine().log("Found cycle: %s", cycle);
          }
          continue;
        }

        colors.put(id, Color.ON_PATH);
        graphPath.add(id);
        toVisit.push(CHILDREN_FINISHED);
        for (NodeId dependency : nodes.get(id).getDependencies()) {
          if (colors.get(dependency) != Color.DONE) {
            toVisit.push(dependency);
          }
        }
      }
      if (cycles.size() >= MAX_CYCLES) {
        break;
      }
    }
    return ImmutableList.copyOf(cycles);
  }
}
