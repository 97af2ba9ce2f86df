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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.devtools.levitation.util.ExtraArgs;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.PathOptionHandler;

/** Command line options of the levitation driver. */
public final class DriverOptions {

  /** The options are consistent as parsed, but do not describe a buildable project. */
  public static final class InvalidOptionsException extends Exception {
    InvalidOptionsException(String message) {
      super(message);
    }
  }

  @Option(
      name = "-root",
      handler = PathOptionHandler.class,
      metaVar = "<dir>",
      usage = "Sources root directory, the unit path of a source is relative to it.")
  public Path sourcesRoot = Paths.get(DriverDefaults.SOURCES_ROOT);

  @Option(
      name = "-buildRoot",
      handler = PathOptionHandler.class,
      metaVar = "<dir>",
      usage = "Directory for dependency lists, declaration ASTs and objects.")
  public Path buildRoot = Paths.get(DriverDefaults.BUILD_ROOT);

  @Option(
      name = "-preamble",
      handler = PathOptionHandler.class,
      metaVar = "<path>",
      usage = "Preamble source, precompiled once and included into every unit.")
  @Nullable
  public Path preamble;

  @Option(name = "-j", metaVar = "<N>", usage = "Number of jobs.")
  public int jobs = Runtime.getRuntime().availableProcessors();

  @Option(
      name = "-o",
      handler = PathOptionHandler.class,
      metaVar = "<path>",
      usage = "Output executable, or objects directory with -c.")
  @Nullable
  public Path output;

  @Option(
      name = "-h",
      handler = PathOptionHandler.class,
      metaVar = "<dir>",
      usage = "Output directory for generated headers, <buildRoot>/include by default.")
  @Nullable
  public Path headersDir;

  @Option(
      name = "-decl-out",
      handler = PathOptionHandler.class,
      metaVar = "<dir>",
      usage = "Output directory for declaration text of public units.")
  @Nullable
  public Path declarationsDir;

  @Option(name = "-stdlib", metaVar = "<name>", usage = "Standard library to build against.")
  public String stdlib = DriverDefaults.STDLIB;

  @Option(name = "-c", usage = "Compile only, don't link. Generates headers of public units.")
  public boolean compileOnly;

  @Option(
      name = "-I",
      handler = PathOptionHandler.class,
      metaVar = "<dir>",
      usage = "Library search path with prebuilt declaration ASTs. May be repeated.")
  public List<Path> libraryPaths = new ArrayList<>();

  @Option(name = "-FH", metaVar = "<args>", usage = "Extra arguments for preamble compilation.")
  public String extraPreambleArgs = "";

  @Option(name = "-FP", metaVar = "<args>", usage = "Extra arguments for parsing.")
  public String extraParserArgs = "";

  @Option(name = "-FC", metaVar = "<args>", usage = "Extra arguments for code generation.")
  public String extraCodeGenArgs = "";

  @Option(name = "-FL", metaVar = "<args>", usage = "Extra arguments for linking.")
  public String extraLinkerArgs = "";

  @Option(name = "-bin", metaVar = "<dir>", usage = "Directory holding clang++.")
  public String binDir = "";

  @Option(name = "--verbose", usage = "Verbose output.")
  public boolean verbose;

  @Option(name = "--trace", usage = "Even more verbose output, for debugging the driver.")
  public boolean trace;

  @Option(name = "-###", usage = "Dry run: print commands, execute nothing.")
  public boolean dryRun;

  @Option(name = "--dump-deps", usage = "Dump the dependency graph once it is solved.")
  public boolean dumpDependencies;

  @Option(name = "--help", help = true, usage = "Print this help.")
  public boolean help;

  /** Parses {@code args}. Does not check the file system, see {@link #validate}. */
  public static DriverOptions parse(String... args) throws CmdLineException {
    DriverOptions options = new DriverOptions();
    new CmdLineParser(options).parseArgument(args);
    return options;
  }

  static String usage() {
    StringWriter out = new StringWriter();
    new CmdLineParser(new DriverOptions()).printUsage(out, null);
    return out.toString();
  }

  /** Checks the options against the file system. Reports every problem found. */
  public void validate() throws InvalidOptionsException {
    List<String> problems = new ArrayList<>();
    if (!Files.isDirectory(sourcesRoot)) {
      problems.add("Sources root '" + sourcesRoot + "' is not a directory.");
    }
    if (jobs < 1) {
      problems.add("Jobs number must be positive, got " + jobs + ".");
    }
    if (preamble != null && !Files.isRegularFile(preamble)) {
      problems.add("Preamble '" + preamble + "' does not exist.");
    }
    for (Path library : libraryPaths) {
      if (!Files.isDirectory(library)) {
        problems.add("Library path '" + library + "' is not a directory.");
      }
    }
    if (!problems.isEmpty()) {
      throw new InvalidOptionsException(Joiner.on('\n').join(problems));
    }
  }

  public Path getOutput() {
    if (output != null) {
      return output;
    }
    return Paths.get(
        isLinkPhaseEnabled()
            ? DriverDefaults.OUTPUT_EXECUTABLE
            : DriverDefaults.OUTPUT_OBJECTS_DIR);
  }

  public Path getHeadersDir() {
    return headersDir != null ? headersDir : buildRoot.resolve(DriverDefaults.HEADERS_DIR);
  }

  @Nullable
  public Path getPreambleOutput() {
    return preamble != null ? buildRoot.resolve(DriverDefaults.PREAMBLE_OUTPUT) : null;
  }

  /** Worker threads besides the main one, which takes part in the work too. */
  public int getPoolSize() {
    return Math.max(0, jobs - 1);
  }

  public boolean isLinkPhaseEnabled() {
    return !compileOnly;
  }

  public boolean shouldCreateHeaders() {
    return compileOnly;
  }

  public boolean shouldCreateDeclarations() {
    return declarationsDir != null;
  }

  public Level getLogLevel() {
    if (trace) {
      return Level.FINEST;
    }
    return verbose ? Level.FINE : Level.INFO;
  }

  public ImmutableList<String> getExtraPreambleArgs() {
    return ExtraArgs.parse(extraPreambleArgs);
  }

  public ImmutableList<String> getExtraParserArgs() {
    return ExtraArgs.parse(extraParserArgs);
  }

  public ImmutableList<String> getExtraCodeGenArgs() {
    return ExtraArgs.parse(extraCodeGenArgs);
  }

  public ImmutableList<String> getExtraLinkerArgs() {
    return ExtraArgs.parse(extraLinkerArgs);
  }

  /** Multi-line description of the effective parameters, for verbose output. */
  public String describe() {
    StringBuilder out = new StringBuilder();
    out.append("Running driver with following parameters:\n\n");
    out.append("    BinaryDir: ").append(binDir.isEmpty() ? "<PATH>" : binDir).append('\n');
    out.append("    SourcesRoot: ").append(sourcesRoot).append('\n');
    out.append("    BuildRoot: ").append(buildRoot).append('\n');
    out.append("    PreambleSource: ")
        .append(preamble == null ? "<preamble compilation not requested>" : preamble)
        .append('\n');
    out.append("    JobsNumber: ").append(jobs).append('\n');
    out.append("    Output: ").append(getOutput()).append('\n');
    out.append("    OutputHeadersDir: ")
        .append(shouldCreateHeaders() ? getHeadersDir() : "<header creation not requested>")
        .append('\n');
    out.append("    OutputDeclsDir: ")
        .append(declarationsDir == null ? "<declarations not requested>" : declarationsDir)
        .append('\n');
    out.append("    DryRun: ").append(dryRun ? "yes" : "no").append('\n');
    describeExtraArgs(out, "Preamble", getExtraPreambleArgs());
    describeExtraArgs(out, "Parse", getExtraParserArgs());
    describeExtraArgs(out, "CodeGen", getExtraCodeGenArgs());
    describeExtraArgs(out, "Link", getExtraLinkerArgs());
    return out.toString();
  }

  private static void describeExtraArgs(StringBuilder out, String phase, List<String> args) {
    if (args.isEmpty()) {
      return;
    }
    out.append("Extra args, phase '").append(phase).append("':\n  ");
    Joiner.on(' ').appendTo(out, args).append('\n');
  }
}
