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

import com.google.common.collect.ImmutableList;

/**
 * Resolved dependency list of a single unit, as emitted by the frontend's parse-import action.
 * Dependencies are unit ids of other units; they always target the other unit's declaration.
 *
 * @param declarationDependencies units whose declarations the declaration of this unit needs
 * @param definitionDependencies units needed only by the definition of this unit
 * @param isPublic whether the declaration is part of the library interface
 * @param isExternal whether the unit comes from a prebuilt library
 */
public record UnitDependencies(
    int unitId,
    String path,
    ImmutableList<Integer> declarationDependencies,
    ImmutableList<Integer> definitionDependencies,
    boolean isPublic,
    boolean isExternal) {
  public UnitDependencies {
    checkNotNull(path);
    checkNotNull(declarationDependencies);
    checkNotNull(definitionDependencies);
  }
}
