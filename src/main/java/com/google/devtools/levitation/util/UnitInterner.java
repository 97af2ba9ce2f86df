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
package com.google.devtools.levitation.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool of unit paths. Maps every distinct path string to a compact, dense integer id and back.
 *
 * <p>Lookups by path are lock-free; insertion of a new path takes the pool lock so that ids stay
 * dense and the reverse table never has holes.
 */
@ThreadSafe
public final class UnitInterner {
  private final ConcurrentHashMap<String, Integer> ids = new ConcurrentHashMap<>();

  @GuardedBy("this")
  private final List<String> paths = new ArrayList<>();

  /** Returns the id of {@code path}, registering it if it was not seen before. */
  public int intern(String path) {
    checkNotNull(path);
    Integer id = ids.get(path);
    if (id != null) {
      return id;
    }
    synchronized (this) {
      id = ids.get(path);
      if (id == null) {
        id = paths.size();
        paths.add(path);
        ids.put(path, id);
      }
      return id;
    }
  }

  /** Returns the id of {@code path} if it is known. Never registers anything. */
  public OptionalInt find(String path) {
    Integer id = ids.get(path);
    return id == null ? OptionalInt.empty() : OptionalInt.of(id);
  }

  public synchronized String get(int id) {
    checkArgument(id >= 0 && id < paths.size(), "Unknown unit id %s", id);
    return paths.get(id);
  }

  public synchronized int size() {
    return paths.size();
  }

  /** Snapshot of all interned paths, in id order. */
  public synchronized ImmutableList<String> paths() {
    return ImmutableList.copyOf(paths);
  }
}
