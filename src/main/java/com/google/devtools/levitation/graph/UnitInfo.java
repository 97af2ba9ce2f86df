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

import javax.annotation.Nullable;

/**
 * Per-unit record of the graph: the unit path and its nodes. External units are only declared
 * here, their body is built elsewhere, so they have no definition node.
 */
public record UnitInfo(
    int unitId, String path, NodeId declaration, @Nullable NodeId definition, boolean external) {
  public UnitInfo {
    checkNotNull(path);
    checkNotNull(declaration);
    checkArgument(external == (definition == null), "Only external units lack a definition");
  }
}
