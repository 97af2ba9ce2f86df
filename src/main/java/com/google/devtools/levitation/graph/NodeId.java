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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Comparator;

/**
 * Key of a graph node: the node kind plus the interned id of the unit path. Two nodes of the same
 * unit differ only by kind.
 */
public record NodeId(NodeKind kind, int unitId) implements Comparable<NodeId> {
  private static final Comparator<NodeId> ORDER =
      Comparator.comparingInt(NodeId::unitId).thenComparing(NodeId::kind);

  public NodeId {
    checkNotNull(kind);
  }

  public static NodeId declaration(int unitId) {
    return new NodeId(NodeKind.DECLARATION, unitId);
  }

  public static NodeId definition(int unitId) {
    return new NodeId(NodeKind.DEFINITION, unitId);
  }

  @Override
  public int compareTo(NodeId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return unitId + ":" + kind.getShortName();
  }
}
