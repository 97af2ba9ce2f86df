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

/** The two halves every unit is compiled into. */
public enum NodeKind {
  /** The unit's public interface; built into a declaration artifact. */
  DECLARATION("DECL"),
  /** The whole unit, rebuilt from source into an object artifact. */
  DEFINITION("DEF");

  private final String shortName;

  NodeKind(String shortName) {
    this.shortName = shortName;
  }

  public String getShortName() {
    return shortName;
  }
}
