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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.deps.DependencyListFile.DependencyList;
import com.google.devtools.levitation.graph.CycleInfo;
import com.google.devtools.levitation.graph.DependencyGraph;
import com.google.devtools.levitation.graph.UnitDependencies;
import com.google.devtools.levitation.util.BuildStatus;
import com.google.devtools.levitation.util.UnitInterner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Reads the dependency lists of all units and turns them into a {@link DependencyGraph}.
 *
 * <p>Every dependency must resolve to one of the units handed to {@link #solve}. Unresolved
 * dependencies are collected for all units before giving up, so that the user sees every broken
 * import of a run at once; a graph is never built from partial input.
 */
public final class DependencySolver {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** A unit together with the dependency list file describing it. */
  public record UnitDependencyFile(int unitId, Path dependencyList, boolean external) {
    public UnitDependencyFile {
      checkNotNull(dependencyList);
    }
  }

  private final UnitInterner interner;
  private final BuildStatus status = new BuildStatus();

  public DependencySolver(UnitInterner interner) {
    this.interner = checkNotNull(interner);
  }

  /** Outcome of the last {@link #solve} call. */
  public BuildStatus getStatus() {
    return status;
  }

  /**
   * Builds the graph. Returns null, with the reasons recorded in {@link #getStatus}, if a list can
   * not be read, a dependency does not resolve or the graph has cycles.
   */
  @Nullable
  public DependencyGraph solve(Collection<UnitDependencyFile> units) {
    logger.atFine().log("Solving dependencies for %d units...", units.size());

    Set<Integer> knownUnits = new HashSet<>();
    for (UnitDependencyFile unit : units) {
      knownUnits.add(unit.unitId());
    }

    List<String> errors = new ArrayList<>();
    List<UnitDependencies> resolved = new ArrayList<>(units.size());
    for (UnitDependencyFile unit : units) {
      String unitPath = interner.get(unit.unitId());
      DependencyList list;
      try {
        list = DependencyListFile.read(unit.dependencyList());
      } catch (IOException e) {
        errors.add(
            String.format(
                "Failed to read dependencies of '%s': %s", unitPath, e.getMessage()));
        continue;
      }

      logger.atFinest().log(
          "Unit '%s': declaration deps %s, definition deps %s%s%s",
          unitPath,
          list.declarationDependencies(),
          list.definitionDependencies(),
          list.isPublic() ? ", public" : "",
          list.isExternal() || unit.external() ? ", external" : "");

      resolved.add(
          new UnitDependencies(
              unit.unitId(),
              unitPath,
              resolve(unitPath, list.declarationDependencies(), knownUnits, errors),
              resolve(unitPath, list.definitionDependencies(), knownUnits, errors),
              list.isPublic(),
              list.isExternal() || unit.external()));
    }

    if (!errors.isEmpty()) {
      status.setFailure(Joiner.on('\n').join(errors));
      return null;
    }

    DependencyGraph graph = DependencyGraph.build(resolved);
    if (graph.isInvalid()) {
      if (graph.getCycles().isEmpty()) {
        status.setFailure("Dependency graph has no roots, dependencies are cyclic.");
      } else {
        List<String> cycles = new ArrayList<>();
        for (CycleInfo cycle : graph.getCycles()) {
          cycles.add("Dependency cycle: " + cycle.describe(graph::describe));
        }
        status.setFailure(Joiner.on('\n').join(cycles));
      }
      return null;
    }
    return graph;
  }

  private ImmutableList<Integer> resolve(
      String unitPath, List<String> dependencies, Set<Integer> knownUnits, List<String> errors) {
    ImmutableList.Builder<Integer> ids = ImmutableList.builderWithExpectedSize(dependencies.size());
    for (String dependency : dependencies) {
      OptionalInt id = interner.find(dependency);
      if (id.isEmpty() || !knownUnits.contains(id.getAsInt())) {
        errors.add(
            String.format(
                "Unit '%s' depends on '%s', which is not found.", unitPath, dependency));
        continue;
      }
      ids.add(id.getAsInt());
    }
    return ids.build();
  }
}
