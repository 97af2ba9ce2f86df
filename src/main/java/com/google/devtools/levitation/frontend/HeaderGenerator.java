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
package com.google.devtools.levitation.frontend;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Comparator.comparingInt;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.meta.SkipFragment;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Produces the C++ header of a public unit: the unit source with every definition body cut out,
 * wrapped into an include guard and preceded by includes of the headers it depends on.
 *
 * <p>Skip fragments are byte ranges {@code [start, end)} of the source, as recorded by the
 * frontend in the declaration meta. A fragment flagged {@code replaceWithSemicolon} leaves a
 * {@code ;} behind, which turns a function definition into a declaration.
 */
public final class HeaderGenerator {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final CharMatcher GUARD_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.digit());

  private final boolean dryRun;

  public HeaderGenerator(boolean dryRun) {
    this.dryRun = dryRun;
  }

  /**
   * Writes the header of {@code unitPath} to {@code output}.
   *
   * @param includes unit paths of the declarations this unit depends on
   */
  public void generate(
      String unitPath,
      Path source,
      Path output,
      List<String> includes,
      List<SkipFragment> skipFragments)
      throws FrontendException {
    logger.atFine().log("Generating header %s for '%s'", output, unitPath);
    if (dryRun) {
      return;
    }
    try {
      byte[] text = render(unitPath, Files.readAllBytes(source), includes, skipFragments);
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(output, text);
    } catch (IOException e) {
      throw new FrontendException("Failed to generate header " + output, e);
    }
  }

  static byte[] render(
      String unitPath, byte[] source, List<String> includes, List<SkipFragment> skipFragments)
      throws FrontendException {
    String guard = includeGuard(unitPath);
    StringBuilder prologue = new StringBuilder();
    prologue.append("#ifndef ").append(guard).append('\n');
    prologue.append("#define ").append(guard).append("\n\n");
    for (String include : includes) {
      prologue.append("#include \"").append(include).append(".h\"\n");
    }
    if (!includes.isEmpty()) {
      prologue.append('\n');
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(source.length + prologue.length());
    out.writeBytes(prologue.toString().getBytes(UTF_8));
    out.writeBytes(cutFragments(unitPath, source, skipFragments));
    if (source.length > 0 && source[source.length - 1] != '\n') {
      out.write('\n');
    }
    out.writeBytes(("\n#endif // " + guard + "\n").getBytes(UTF_8));
    return out.toByteArray();
  }

  static byte[] cutFragments(String unitPath, byte[] source, List<SkipFragment> skipFragments)
      throws FrontendException {
    ImmutableList<SkipFragment> sorted =
        ImmutableList.sortedCopyOf(comparingInt(SkipFragment::start), skipFragments);
    ByteArrayOutputStream out = new ByteArrayOutputStream(source.length);
    int position = 0;
    for (SkipFragment fragment : sorted) {
      if (fragment.end() > source.length) {
        throw new FrontendException(
            String.format(
                "Skip fragment [%d, %d) of '%s' is out of range, source has %d bytes",
                fragment.start(), fragment.end(), unitPath, source.length));
      }
      if (fragment.start() < position) {
        throw new FrontendException(
            String.format(
                "Skip fragment [%d, %d) of '%s' overlaps the previous one",
                fragment.start(), fragment.end(), unitPath));
      }
      out.write(source, position, fragment.start() - position);
      if (fragment.replaceWithSemicolon()) {
        out.write(';');
      }
      position = fragment.end();
    }
    out.write(source, position, source.length - position);
    return out.toByteArray();
  }

  static String includeGuard(String unitPath) {
    String name = GUARD_CHARS.negate().replaceFrom(unitPath, '_');
    return "LEVITATION_" + Ascii.toUpperCase(name) + "_H";
  }
}
