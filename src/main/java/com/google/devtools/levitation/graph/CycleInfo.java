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

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A single dependency cycle, together with the path that led the search to it. The cycle is
 * normalized so that its smallest node comes first, which makes rotations of the same cycle equal.
 */
public final class CycleInfo {
  private final ImmutableList<NodeId> pathToCycle;
  private final ImmutableList<NodeId> cycle;

  CycleInfo(Iterable<NodeId> pathToCycle, Iterable<NodeId> cycle) {
    this.pathToCycle = ImmutableList.copyOf(pathToCycle);
    this.cycle = normalize(ImmutableList.copyOf(cycle));
  }

  public ImmutableList<NodeId> getPathToCycle() {
    return pathToCycle;
  }

  /** Members of the cycle; each one depends on the next, and the last one on the first. */
  public ImmutableList<NodeId> getCycle() {
    return cycle;
  }

  /** Renders the cycle as {@code a -> b -> a}, using {@code namer} for every node. */
  public String describe(Function<NodeId, String> namer) {
    return ImmutableList.<NodeId>builder().addAll(cycle).add(cycle.get(0)).build().stream()
        .map(namer)
        .collect(Collectors.joining(" -> "));
  }

  private static ImmutableList<NodeId> normalize(ImmutableList<NodeId> cycle) {
    checkArgument(!cycle.isEmpty(), "Cycle cannot be empty");
    int start = 0;
    for (int i = 1; i < cycle.size(); i++) {
      if (cycle.get(i).compareTo(cycle.get(start)) < 0) {
        start = i;
      }
    }
    if (start == 0) {
      return cycle;
    }
    return ImmutableList.<NodeId>builderWithExpectedSize(cycle.size())
        .addAll(cycle.subList(start, cycle.size()))
        .addAll(cycle.subList(0, start))
        .build();
  }

  @Override
  public int hashCode() {
    return cycle.hashCode();
  }

  /** Two cycles are equal if they have the same members in the same circular order. */
  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof CycleInfo thatCycle)) {
      return false;
    }
    return cycle.equals(thatCycle.cycle);
  }

  @Override
  public String toString() {
    return describe(NodeId::toString);
  }
}
