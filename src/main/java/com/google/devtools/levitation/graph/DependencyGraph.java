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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.concurrent.TaskScheduler;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Bidirectional dependency graph over declaration and definition nodes.
 *
 * <p>The graph is built once by {@link #build} and is immutable afterwards, so traversals need no
 * locking. Every edge points from a node to the declaration node of another unit. A definition
 * node depends on everything its declaration depends on, plus its own definition-only
 * dependencies, but never on its own declaration: definitions are recompiled from source.
 */
public final class DependencyGraph {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Work done on a node by {@link #dfsJobs}. Returns whether the node was processed. */
  @FunctionalInterface
  public interface NodeAction {
    boolean process(Node node) throws InterruptedException;
  }

  private final ImmutableMap<NodeId, Node> allNodes;
  private final ImmutableMap<Integer, UnitInfo> units;
  private final ImmutableSet<NodeId> roots;
  private final ImmutableSet<NodeId> terminals;
  private final ImmutableSet<NodeId> publicNodes;
  private final ImmutableSet<NodeId> externalNodes;
  private final ImmutableList<CycleInfo> cycles;
  private final boolean invalid;

  private DependencyGraph(
      ImmutableMap<NodeId, Node> allNodes,
      ImmutableMap<Integer, UnitInfo> units,
      ImmutableSet<NodeId> roots,
      ImmutableSet<NodeId> terminals,
      ImmutableSet<NodeId> publicNodes,
      ImmutableSet<NodeId> externalNodes,
      ImmutableList<CycleInfo> cycles,
      boolean invalid) {
    this.allNodes = allNodes;
    this.units = units;
    this.roots = roots;
    this.terminals = terminals;
    this.publicNodes = publicNodes;
    this.externalNodes = externalNodes;
    this.cycles = cycles;
    this.invalid = invalid;
  }

  /**
   * Builds the graph from per-unit dependency lists. Every dependency must name a unit that is
   * itself part of {@code unitDependencies}.
   *
   * <p>The result may be {@linkplain #isInvalid invalid}; callers must check that before
   * traversing it with {@link #dfsJobs}.
   */
  public static DependencyGraph build(Collection<UnitDependencies> unitDependencies) {
    logger.atFine().log("Building dependencies graph...");

    Map<Integer, UnitInfo> units = new LinkedHashMap<>();
    for (UnitDependencies deps : unitDependencies) {
      NodeId declaration = NodeId.declaration(deps.unitId());
      NodeId definition = deps.isExternal() ? null : NodeId.definition(deps.unitId());
      UnitInfo previous =
          units.put(
              deps.unitId(),
              new UnitInfo(
                  deps.unitId(), deps.path(), declaration, definition, deps.isExternal()));
      checkArgument(previous == null, "Unit '%s' is listed twice", deps.path());
    }

    // Insertion ordered, so that the "last dependency" of a node is deterministic.
    Map<NodeId, Set<NodeId>> dependencies = new LinkedHashMap<>();
    Map<NodeId, Set<NodeId>> dependents = new HashMap<>();
    Set<NodeId> explicitlyPublic = new LinkedHashSet<>();
    Set<NodeId> external = new LinkedHashSet<>();

    for (UnitDependencies deps : unitDependencies) {
      UnitInfo unit = units.get(deps.unitId());
      logger.atFinest().log("Creating nodes for unit #%d '%s'", unit.unitId(), unit.path());

      createNode(dependencies, dependents, unit.declaration());
      addDependencies(
          units, dependencies, dependents, unit.declaration(), deps.declarationDependencies());

      if (unit.definition() != null) {
        createNode(dependencies, dependents, unit.definition());
        addDependencies(
            units, dependencies, dependents, unit.definition(), deps.declarationDependencies());
        addDependencies(
            units, dependencies, dependents, unit.definition(), deps.definitionDependencies());
      }

      if (deps.isPublic()) {
        explicitlyPublic.add(unit.declaration());
      }
      if (deps.isExternal()) {
        external.add(unit.declaration());
      }
    }

    ImmutableMap.Builder<NodeId, Node> nodesBuilder =
        ImmutableMap.builderWithExpectedSize(dependencies.size());
    ImmutableSet.Builder<NodeId> roots = ImmutableSet.builder();
    ImmutableSet.Builder<NodeId> terminals = ImmutableSet.builder();
    for (Map.Entry<NodeId, Set<NodeId>> entry : dependencies.entrySet()) {
      NodeId id = entry.getKey();
      Node node =
          new Node(
              id,
              units.get(id.unitId()),
              ImmutableSet.copyOf(entry.getValue()),
              ImmutableSet.copyOf(dependents.get(id)));
      nodesBuilder.put(id, node);
      if (node.getDependencies().isEmpty()) {
        roots.add(id);
      }
      if (node.getDependentNodes().isEmpty()) {
        terminals.add(id);
      }
    }
    ImmutableMap<NodeId, Node> allNodes = nodesBuilder.buildOrThrow();
    ImmutableSet<NodeId> rootSet = roots.build();
    ImmutableSet<NodeId> terminalSet = terminals.build();

    ImmutableList<CycleInfo> cycles = CycleDetector.findCycles(allNodes);
    boolean invalid = !cycles.isEmpty() || (!allNodes.isEmpty() && rootSet.isEmpty());
    if (invalid) {
      logger.atFine().log("Graph is invalid, %d cycle(s) found", cycles.size());
    }

    return new DependencyGraph(
        allNodes,
        ImmutableMap.copyOf(units),
        rootSet,
        terminalSet,
        collectPublicNodes(allNodes, terminalSet, explicitlyPublic),
        ImmutableSet.copyOf(external),
        cycles,
        invalid);
  }

  private static void createNode(
      Map<NodeId, Set<NodeId>> dependencies, Map<NodeId, Set<NodeId>> dependents, NodeId id) {
    dependencies.putIfAbsent(id, new LinkedHashSet<>());
    dependents.putIfAbsent(id, new LinkedHashSet<>());
  }

  private static void addDependencies(
      Map<Integer, UnitInfo> units,
      Map<NodeId, Set<NodeId>> dependencies,
      Map<NodeId, Set<NodeId>> dependents,
      NodeId dependent,
      Collection<Integer> dependencyUnits) {
    for (int dependencyUnit : dependencyUnits) {
      UnitInfo unit = units.get(dependencyUnit);
      checkArgument(
          unit != null,
          "Node %s depends on unit #%s, which is not known",
          dependent,
          dependencyUnit);
      createNode(dependencies, dependents, unit.declaration());
      dependencies.get(dependent).add(unit.declaration());
      dependents.get(unit.declaration()).add(dependent);
    }
  }

  /**
   * Walks down from every terminal node carrying a sticky "public" flag: once a node that was
   * explicitly marked public is met, everything it reaches is public too. A node first reached in
   * non-public state is visited once more if it is later reached in public state.
   */
  private static ImmutableSet<NodeId> collectPublicNodes(
      ImmutableMap<NodeId, Node> allNodes,
      ImmutableSet<NodeId> terminals,
      Set<NodeId> explicitlyPublic) {
    logger.atFine().log("Collecting public nodes...");

    Set<NodeId> publicNodes = new LinkedHashSet<>(explicitlyPublic);
    Map<NodeId, Boolean> visited = new HashMap<>();
    Deque<NodeId> nodeStack = new ArrayDeque<>();
    Deque<Boolean> publicStack = new ArrayDeque<>();

    for (NodeId terminal : terminals) {
      nodeStack.push(terminal);
      publicStack.push(false);
      while (!nodeStack.isEmpty()) {
        NodeId id = nodeStack.pop();
        boolean markPublic = publicStack.pop();

        Boolean visitedAsPublic = visited.get(id);
        if (visitedAsPublic != null && (visitedAsPublic || !markPublic)) {
          continue;
        }

        if (explicitlyPublic.contains(id)) {
          markPublic = true;
        } else if (markPublic) {
          publicNodes.add(id);
        }
        visited.put(id, markPublic);

        if (markPublic) {
          logger.atFinest().log("Public node: '%s'", id);
        }

        for (NodeId dependency : allNodes.get(id).getDependencies()) {
          nodeStack.push(dependency);
          publicStack.push(markPublic);
        }
      }
    }
    return ImmutableSet.copyOf(publicNodes);
  }

  public Node getNode(NodeId id) {
    Node node = allNodes.get(id);
    checkArgument(node != null, "Node %s is not present in the graph", id);
    return node;
  }

  public ImmutableMap<NodeId, Node> allNodes() {
    return allNodes;
  }

  public UnitInfo getUnit(int unitId) {
    UnitInfo unit = units.get(unitId);
    checkArgument(unit != null, "Unit #%s is not present in the graph", unitId);
    return unit;
  }

  public ImmutableMap<Integer, UnitInfo> units() {
    return units;
  }

  /** Nodes without dependencies. Starting points for top-down traversal. */
  public ImmutableSet<NodeId> roots() {
    return roots;
  }

  /** Nodes without dependent nodes. Starting points for the bottom-up build. */
  public ImmutableSet<NodeId> terminals() {
    return terminals;
  }

  public ImmutableSet<NodeId> publicNodes() {
    return publicNodes;
  }

  public ImmutableSet<NodeId> externalNodes() {
    return externalNodes;
  }

  /** Whether the node should be present in the library public interface. */
  public boolean isPublic(NodeId id) {
    return publicNodes.contains(id);
  }

  /** Whether the node belongs to a prebuilt library unit. */
  public boolean isExternal(NodeId id) {
    return externalNodes.contains(id);
  }

  /** Whether the graph has cycles. An invalid graph must not be built. */
  public boolean isInvalid() {
    return invalid;
  }

  public ImmutableList<CycleInfo> getCycles() {
    return cycles;
  }

  /**
   * All nodes {@code id} depends on, directly or not, ordered so that every node comes after its
   * own dependencies. This is the order in which declaration artifacts are fed to the frontend.
   */
  public ImmutableList<NodeId> fullDependencies(NodeId id) {
    checkState(!invalid, "Can not order dependencies of an invalid graph");
    Set<NodeId> ordered = new LinkedHashSet<>();
    Set<NodeId> entered = new HashSet<>();
    Deque<NodeId> stack = new ArrayDeque<>();
    Deque<Boolean> expanded = new ArrayDeque<>();
    for (NodeId dependency : getNode(id).getDependencies()) {
      stack.push(dependency);
      expanded.push(false);
    }
    while (!stack.isEmpty()) {
      NodeId current = stack.pop();
      if (expanded.pop()) {
        ordered.add(current);
        continue;
      }
      if (!entered.add(current)) {
        continue;
      }
      stack.push(current);
      expanded.push(true);
      for (NodeId dependency : getNode(current).getDependencies()) {
        if (!entered.contains(dependency)) {
          stack.push(dependency);
          expanded.push(false);
        }
      }
    }
    return ImmutableList.copyOf(ordered);
  }

  /** Human readable name of a node, {@code <path>:<kind>}. */
  public String describe(NodeId id) {
    UnitInfo unit = units.get(id.unitId());
    return (unit != null ? unit.path() : "#" + id.unitId()) + ":" + id.kind().getShortName();
  }

  /**
   * Breadth-first walk from the roots towards dependent nodes. Stops as soon as {@code onNode}
   * returns false. Without visited tracking a node is reported once per level it is reached on.
   *
   * @return whether the walk went through the whole graph
   */
  public boolean bfsWalk(Predicate<Node> onNode) {
    return bfsWalk(new HashSet<>(), /* skipVisited= */ false, onNode);
  }

  /** Breadth-first walk reporting every reachable node exactly once. */
  public void bfsWalkSkipVisited(Consumer<Node> onNode) {
    bfsWalkSkipVisited(new HashSet<>(), onNode);
  }

  /**
   * Like {@link #bfsWalkSkipVisited(Consumer)}, recording visited nodes into {@code visited}.
   * Nodes already in {@code visited} are neither reported nor walked through.
   */
  public void bfsWalkSkipVisited(Set<NodeId> visited, Consumer<Node> onNode) {
    bfsWalk(
        visited,
        /* skipVisited= */ true,
        node -> {
          onNode.accept(node);
          return true;
        });
  }

  private boolean bfsWalk(Set<NodeId> visited, boolean skipVisited, Predicate<Node> onNode) {
    Set<NodeId> worklist = new LinkedHashSet<>(roots);
    Set<NodeId> newWorklist = new LinkedHashSet<>();

    while (!worklist.isEmpty()) {
      newWorklist.clear();
      for (NodeId id : worklist) {
        if (skipVisited && !visited.add(id)) {
          continue;
        }
        Node node = getNode(id);
        if (!onNode.test(node)) {
          return false;
        }
        for (NodeId dependent : node.getDependentNodes()) {
          if (!skipVisited || !visited.contains(dependent)) {
            newWorklist.add(dependent);
          }
        }
      }
      Set<NodeId> swap = worklist;
      worklist = newWorklist;
      newWorklist = swap;
    }
    return true;
  }

  /**
   * Runs {@code action} on every node reachable from the terminals, dependencies first.
   *
   * <p>For every edge {@code d -> n}, the action on {@code d} has finished before the action on
   * {@code n} starts, and the action on {@code n} is not run at all if {@code d} failed. Other
   * branches are not cancelled by a failure.
   *
   * @return whether every action was run and succeeded
   */
  public boolean dfsJobs(TaskScheduler scheduler, NodeAction action) throws InterruptedException {
    return dfsJobs(scheduler, terminals, action);
  }

  public boolean dfsJobs(
      TaskScheduler scheduler, Collection<NodeId> startingPoints, NodeAction action)
      throws InterruptedException {
    checkState(!invalid, "Can not walk an invalid graph");
    checkNotNull(action);
    return new JobWalk(this, scheduler, action).run(startingPoints);
  }

  /** Breadth-first dump of every node, followed by the terminals and any isolated nodes. */
  public String dump() {
    StringBuilder out = new StringBuilder();
    if (roots.isEmpty()) {
      out.append("(empty)\n\n");
      return out.toString();
    }

    Set<NodeId> visited = new HashSet<>();
    bfsWalkSkipVisited(visited, node -> dumpNode(out, node).append('\n'));

    // A graph with cycles may have no terminals at all; that is reported by the solver, not here.
    if (terminals.isEmpty()) {
      out.append("No terminal nodes found. Graph has cycles.\n");
      return out.toString();
    }

    out.append("Terminals:\n");
    for (NodeId terminal : terminals) {
      out.append("    ").append(terminal).append('\n');
    }
    out.append('\n');

    if (visited.size() < allNodes.size()) {
      out.append("Isolated nodes:\n");
      for (Node node : allNodes.values()) {
        if (!visited.contains(node.getId())) {
          dumpNode(out, node).append('\n');
        }
      }
    }
    return out.toString();
  }

  private StringBuilder dumpNode(StringBuilder out, Node node) {
    out.append("Node");
    if (roots.contains(node.getId())) {
      out.append("(root)");
    }
    out.append('[').append(node.getId()).append("], ").append(node.getUnit().path()).append(":\n");
    out.append("    Kind: ")
        .append(node.getKind() == NodeKind.DECLARATION ? "Declaration" : "Definition")
        .append('\n');
    if (!node.getDependentNodes().isEmpty()) {
      out.append("    Is used by:\n");
      for (NodeId dependent : node.getDependentNodes()) {
        out.append("        ").append(dependent).append('\n');
      }
    }
    if (!node.getDependencies().isEmpty()) {
      out.append("    Dependencies:\n");
      for (NodeId dependency : node.getDependencies()) {
        out.append("        ").append(dependency).append('\n');
      }
    }
    return out;
  }
}
