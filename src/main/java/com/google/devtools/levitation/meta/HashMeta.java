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
package com.google.devtools.levitation.meta;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;

/**
 * Hash metadata persisted next to every built artifact: the hash of the source the artifact was
 * built from, the hash of the artifact itself and the source fragments the frontend skipped.
 */
public record HashMeta(
    HashCode sourceHash, HashCode artifactHash, ImmutableList<SkipFragment> skipFragments) {
  public HashMeta {
    checkNotNull(sourceHash);
    checkNotNull(artifactHash);
    checkNotNull(skipFragments);
  }

  public HashMeta(HashCode sourceHash, HashCode artifactHash) {
    this(sourceHash, artifactHash, ImmutableList.of());
  }
}
