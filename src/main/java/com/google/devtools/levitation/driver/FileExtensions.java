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
package com.google.devtools.levitation.driver;

/** File name extensions of sources and build artifacts, without the leading dot. */
public final class FileExtensions {
  public static final String SOURCE = "cppl";
  public static final String HEADER = "h";
  public static final String DEPENDENCY_LIST = "ldeps";
  public static final String DECLARATION_AST = "decl-ast";
  public static final String OBJECT = "o";

  private FileExtensions() {}
}
