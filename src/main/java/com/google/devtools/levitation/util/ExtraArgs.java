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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Splits a single extra-arguments string (as given to {@code -FP}, {@code -FC} and friends) into
 * separate command line arguments.
 *
 * <p>Spaces separate arguments unless quoted or escaped. Quotes are kept in the argument, except
 * when they enclose the whole argument. A backslash takes the next character literally.
 */
public final class ExtraArgs {

  private ExtraArgs() {}

  public static ImmutableList<String> parse(@Nullable String args) {
    if (Strings.isNullOrEmpty(args)) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<String> result = ImmutableList.builder();
    StringBuilder current = new StringBuilder();
    boolean hasCurrent = false;
    char openQuote = 0;
    boolean escaped = false;

    for (int i = 0; i < args.length(); i++) {
      char c = args.charAt(i);
      if (escaped) {
        current.append(c);
        hasCurrent = true;
        escaped = false;
        continue;
      }
      switch (c) {
        case '\\':
          escaped = true;
          break;
        case '"':
        case '\'':
          if (openQuote == 0) {
            openQuote = c;
          } else if (openQuote == c) {
            openQuote = 0;
          }
          current.append(c);
          hasCurrent = true;
          break;
        case ' ':
        case '\t':
          if (openQuote != 0) {
            current.append(c);
          } else if (hasCurrent) {
            result.add(stripBoundingQuotes(current.toString()));
            current.setLength(0);
            hasCurrent = false;
          }
          break;
        default:
          current.append(c);
          hasCurrent = true;
      }
    }
    if (hasCurrent) {
      result.add(stripBoundingQuotes(current.toString()));
    }
    return result.build();
  }

  static String stripBoundingQuotes(String arg) {
    int length = arg.length();
    if (length < 2) {
      return arg;
    }
    char first = arg.charAt(0);
    if (first == arg.charAt(length - 1) && (first == '"' || first == '\'')) {
      return arg.substring(1, length - 1);
    }
    return arg;
  }
}
