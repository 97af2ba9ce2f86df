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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/**
 * Node of a {@link DependencyGraph}. Edges are recorded on both ends: if {@code x} is among the
 * dependencies of {@code n}, then {@code n} is among the dependent nodes of {@code x}.
 *
 * <p>Instances are immutable and safe to share between threads once the graph is built.
 */
public final class Node {
  private final NodeId id;
  private final UnitInfo unit;
  private final ImmutableSet<NodeId> dependencies;
  private final ImmutableSet<NodeId> dependentNodes;

  Node(
      NodeId id,
      UnitInfo unit,
      ImmutableSet<NodeId> dependencies,
      ImmutableSet<NodeId> dependentNodes) {
    this.id = id;
    this.unit = unit;
    this.dependencies = dependencies;
    this.dependentNodes = dependentNodes;
  }

  public NodeId getId() {
    return id;
  }

  public NodeKind getKind() {
    return id.kind();
  }

  public UnitInfo getUnit() {
    return unit;
  }

  /** Nodes this node needs, in the order they were recorded. */
  public ImmutableSet<NodeId> getDependencies() {
    return dependencies;
  }

  /** Nodes that need this node. */
  public ImmutableSet<NodeId> getDependentNodes() {
    return dependentNodes;
  }

  /** Short human readable form, e.g. {@code Node[3:DECL]: a/b}. */
  public String describe() {
    return "Node[" + id + "]: " + unit.path();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("path", unit.path())
        .add("dependencies", dependencies)
        .add("dependentNodes", dependentNodes)
        .toString();
  }
}
