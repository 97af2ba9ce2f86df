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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.levitation.meta.HashMeta;
import com.google.devtools.levitation.meta.HashMetaFile;
import com.google.devtools.levitation.meta.SkipFragment;
import com.google.devtools.levitation.meta.SourceHasher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * {@link Frontend} that drives a {@code clang++} built with C++ Levitation support.
 *
 * <p>The compiler writes the declaration skip fragments into {@code -cppl-meta-out}; all other
 * meta files, and the hashes of the declaration meta, are written here once the command succeeded.
 */
public final class CompilerFrontend implements Frontend {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String COMPILER = "clang++";
  static final String CXX_STANDARD = "-std=c++17";

  /**
   * How to invoke the compiler.
   *
   * @param binDir directory holding the compiler, empty to look it up on {@code PATH}
   * @param stdlib value of {@code -stdlib=}, empty to leave it to the compiler
   */
  public record Settings(
      String binDir,
      String stdlib,
      ImmutableList<String> extraPreambleArgs,
      ImmutableList<String> extraParserArgs,
      ImmutableList<String> extraCodeGenArgs,
      ImmutableList<String> extraLinkerArgs,
      boolean dryRun) {
    public Settings {
      checkNotNull(binDir);
      checkNotNull(stdlib);
      checkNotNull(extraPreambleArgs);
      checkNotNull(extraParserArgs);
      checkNotNull(extraCodeGenArgs);
      checkNotNull(extraLinkerArgs);
    }
  }

  private final Settings settings;
  private final CommandRunner runner;

  public CompilerFrontend(Settings settings) {
    this(settings, new ProcessCommandRunner());
  }

  @VisibleForTesting
  CompilerFrontend(Settings settings, CommandRunner runner) {
    this.settings = checkNotNull(settings);
    this.runner = checkNotNull(runner);
  }

  @Override
  public boolean isDryRun() {
    return settings.dryRun();
  }

  @Override
  public void buildPreamble(PreambleRequest request)
      throws FrontendException, InterruptedException {
    CommandLine command =
        compilerCommand()
            .add("-cppl-preamble")
            .add(request.source())
            .addFlagAndValue("-o", request.output())
            .addAll(settings.extraPreambleArgs())
            .build();
    if (execute(command, request.output())) {
      writeMeta(request.source(), request.output(), ImmutableList.of());
    }
  }

  @Override
  public void parseImport(ParseImportRequest request)
      throws FrontendException, InterruptedException {
    CommandLine command =
        compilerCommand()
            .add("-cppl-import")
            .addKeyValueIfNotEmpty("-cppl-include-preamble", request.preamble())
            .addKeyValue("-cppl-src-root", request.sourcesRoot())
            .addKeyValue("-cppl-deps-out", request.dependencyList())
            .addAll(settings.extraParserArgs())
            .add(request.source())
            .build();
    if (execute(command, request.dependencyList())) {
      writeMeta(request.source(), request.dependencyList(), ImmutableList.of());
    }
  }

  @Override
  public void buildDeclaration(BuildRequest request)
      throws FrontendException, InterruptedException {
    Path metaFile = HashMetaFile.metaPathFor(request.output());
    CommandLine command =
        compilerCommand()
            .add("-cppl-decl")
            .addKeyValueIfNotEmpty("-cppl-include-preamble", request.preamble())
            .addKeyValues("-cppl-include-dependency", request.dependencies())
            .addKeyValue("-cppl-meta-out", metaFile)
            .addAll(settings.extraParserArgs())
            .add(request.source())
            .addFlagAndValue("-o", request.output())
            .build();
    if (!settings.dryRun()) {
      // Fragments of a previous build must not survive a compiler that wrote none this time.
      deleteIfExists(metaFile);
    }
    if (execute(command, request.output())) {
      writeMeta(request.source(), request.output(), readSkipFragments(metaFile));
    }
  }

  @Override
  public void buildObject(BuildRequest request) throws FrontendException, InterruptedException {
    CommandLine command =
        compilerCommand()
            .add("-cppl-obj")
            .addKeyValueIfNotEmpty("-cppl-include-preamble", request.preamble())
            .addKeyValues("-cppl-include-dependency", request.dependencies())
            .addAll(settings.extraParserArgs())
            .addAll(settings.extraCodeGenArgs())
            .add(request.source())
            .addFlagAndValue("-o", request.output())
            .build();
    if (execute(command, request.output())) {
      writeMeta(request.source(), request.output(), ImmutableList.of());
    }
  }

  @Override
  public void link(LinkRequest request) throws FrontendException, InterruptedException {
    CommandLine command =
        CommandLine.builder(compilerPath())
            .addKeyValueIfNotEmpty("-stdlib", settings.stdlib())
            .addAll(settings.extraLinkerArgs())
            .addPaths(request.objects())
            .addFlagAndValue("-o", request.output())
            .build();
    execute(command, request.output());
  }

  @VisibleForTesting
  String compilerPath() {
    if (settings.binDir().isEmpty()) {
      return COMPILER;
    }
    return Paths.get(settings.binDir(), COMPILER).toString();
  }

  private CommandLine.Builder compilerCommand() {
    return CommandLine.builder(compilerPath())
        .add(CXX_STANDARD)
        .addKeyValueIfNotEmpty("-stdlib", settings.stdlib());
  }

  /**
   * Runs {@code command}, creating the parent directory of {@code output} first.
   *
   * @return false if nothing was executed because of dry run
   */
  private boolean execute(CommandLine command, Path output)
      throws FrontendException, InterruptedException {
    if (settings.dryRun()) {
      logger.atInfo().log("%s", command);
      return false;
    }
    int exitCode;
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      exitCode = runner.run(command);
    } catch (IOException e) {
      throw new FrontendException("Failed to run " + command.getExecutable(), e);
    }
    if (exitCode != 0) {
      throw new FrontendException(
          String.format("Command failed with exit code %d: %s", exitCode, command));
    }
    if (!Files.exists(output)) {
      throw new FrontendException("Command did not produce " + output + ": " + command);
    }
    return true;
  }

  private static void writeMeta(
      Path source, Path artifact, ImmutableList<SkipFragment> skipFragments)
      throws FrontendException {
    try {
      HashMetaFile.write(
          HashMetaFile.metaPathFor(artifact),
          new HashMeta(
              SourceHasher.hashFile(source), SourceHasher.hashFile(artifact), skipFragments));
    } catch (IOException e) {
      throw new FrontendException("Failed to write meta for " + artifact, e);
    }
  }

  private static ImmutableList<SkipFragment> readSkipFragments(Path metaFile) {
    if (!Files.exists(metaFile)) {
      return ImmutableList.of();
    }
    try {
      return HashMetaFile.read(metaFile).skipFragments();
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Ignoring skip fragments of %s", metaFile);
      return ImmutableList.of();
    }
  }

  private static void deleteIfExists(Path file) throws FrontendException {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new FrontendException("Failed to remove stale " + file, e);
    }
  }
}
