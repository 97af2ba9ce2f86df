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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Byte range of a unit source that is not part of its declaration text, as reported by the
 * frontend. Opaque to the driver, except for header generation which cuts these ranges out.
 *
 * @param start offset of the first byte of the fragment
 * @param end offset just past the last byte of the fragment
 * @param replaceWithSemicolon whether the fragment is replaced by {@code ;} rather than dropped
 */
public record SkipFragment(int start, int end, boolean replaceWithSemicolon) {
  public SkipFragment {
    checkArgument(0 <= start && start <= end, "Bad fragment [%s, %s)", start, end);
  }

  public int size() {
    return end - start;
  }
}
