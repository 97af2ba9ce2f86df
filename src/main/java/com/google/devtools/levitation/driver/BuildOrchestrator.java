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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.hash.HashCode;
import com.google.devtools.levitation.concurrent.TaskId;
import com.google.devtools.levitation.concurrent.TaskScheduler;
import com.google.devtools.levitation.deps.DependencySolver;
import com.google.devtools.levitation.deps.DependencySolver.UnitDependencyFile;
import com.google.devtools.levitation.frontend.Frontend;
import com.google.devtools.levitation.frontend.Frontend.BuildRequest;
import com.google.devtools.levitation.frontend.Frontend.LinkRequest;
import com.google.devtools.levitation.frontend.Frontend.ParseImportRequest;
import com.google.devtools.levitation.frontend.Frontend.PreambleRequest;
import com.google.devtools.levitation.frontend.FrontendException;
import com.google.devtools.levitation.frontend.HeaderGenerator;
import com.google.devtools.levitation.graph.DependencyGraph;
import com.google.devtools.levitation.graph.Node;
import com.google.devtools.levitation.graph.NodeKind;
import com.google.devtools.levitation.meta.HashMetaFile;
import com.google.devtools.levitation.meta.SkipFragment;
import com.google.devtools.levitation.util.UnitInterner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Runs the build pipeline: collect sources, build preamble, parse imports, solve dependencies,
 * generate code and link.
 *
 * <p>Every phase is skipped once an earlier one failed. Up-to-date artifacts are reused, judged
 * by their hash meta files; a node whose artifact changed forces its dependents to be rebuilt in
 * the same run.
 */
public final class BuildOrchestrator {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final DriverOptions options;
  private final UnitInterner interner;
  private final TaskScheduler scheduler;
  private final Frontend frontend;
  private final HeaderGenerator headerGenerator;
  private final RunContext context = new RunContext();
  private final UpToDateChecker checker = new UpToDateChecker(context);

  public BuildOrchestrator(BuildSession session) {
    this.options = session.getOptions();
    this.interner = session.getInterner();
    this.scheduler = session.getScheduler();
    this.frontend = session.getFrontend();
    this.headerGenerator = new HeaderGenerator(frontend.isDryRun());
  }

  public RunContext getContext() {
    return context;
  }

  /**
   * Runs all phases. Warnings are logged at the end, followed by the error of the first failure.
   *
   * @return whether the build succeeded
   */
  public boolean run() throws InterruptedException {
    collectSources();
    buildPreamble();
    runParseImport();
    solveDependencies();
    codeGen();
    if (options.isLinkPhaseEnabled()) {
      runLinker();
    }

    for (String warning : context.getStatus().getWarnings()) {
      logger.atWarning().log("%s", warning);
    }
    if (!context.getStatus().isValid()) {
      logger.atSevere().log("%s", context.getStatus().getErrorMessage());
      return false;
    }
    return true;
  }

  void collectSources() {
    ImmutableMap<String, FilesInfo> units;
    try {
      units = new SourceCollector(options).collect(context.getStatus());
    } catch (IOException e) {
      context.getStatus().setFailure("Failed to collect sources: %s", e.getMessage());
      return;
    }

    ImmutableMap.Builder<Integer, FilesInfo> files =
        ImmutableMap.builderWithExpectedSize(units.size());
    for (Map.Entry<String, FilesInfo> unit : units.entrySet()) {
      files.put(interner.intern(unit.getKey()), unit.getValue());
    }
    context.setFiles(files.buildOrThrow());

    if (projectUnits().isEmpty()) {
      context
          .getStatus()
          .addWarning("No '.%s' files found in '%s'", FileExtensions.SOURCE, options.sourcesRoot);
    }
  }

  void buildPreamble() throws InterruptedException {
    if (!context.shouldContinue() || options.preamble == null) {
      return;
    }
    Path source = options.preamble;
    Path output = options.getPreambleOutput();
    if (checker.isPreambleUpToDate(source, output)) {
      logger.atFine().log("Preamble %s is up to date", output);
      return;
    }

    logPhase("PREAMBLE %s -> preamble out: %s", source, output);
    try {
      frontend.buildPreamble(new PreambleRequest(source, output));
      context.setPreambleUpdated();
    } catch (FrontendException e) {
      context.getStatus().setFailure("Preamble: phase failed. %s", e.getMessage());
    }
  }

  void runParseImport() throws InterruptedException {
    if (!context.shouldContinue()) {
      return;
    }
    List<TaskId> tasks = new ArrayList<>();
    for (Map.Entry<Integer, FilesInfo> unit : projectUnits().entrySet()) {
      FilesInfo files = unit.getValue();
      tasks.add(
          scheduler.runTask(
              taskContext -> taskContext.setSuccessful(parseImport(files))));
    }
    if (!scheduler.waitForTasks(tasks)) {
      context.getStatus().setFailure("Parse import: phase failed.");
    }
  }

  private boolean parseImport(FilesInfo files) throws InterruptedException {
    if (checker.isUpToDate(files.source(), files.dependencyList(), ImmutableList.of())) {
      logger.atFine().log("Dependencies of '%s' are up to date", files.unitPath());
      return true;
    }
    logPhase("PARSE IMP %s -> (ldeps: %s)", files.source(), files.dependencyList());
    try {
      frontend.parseImport(
          new ParseImportRequest(
              files.unitPath(),
              files.source(),
              options.sourcesRoot,
              files.dependencyList(),
              options.getPreambleOutput()));
      return true;
    } catch (FrontendException e) {
      logger.atSevere().log("Parse import of '%s' failed: %s", files.unitPath(), e.getMessage());
      return false;
    }
  }

  void solveDependencies() {
    if (!context.shouldContinue()) {
      return;
    }

    List<UnitDependencyFile> dependencyFiles = new ArrayList<>();
    List<Path> missing = new ArrayList<>();
    for (Map.Entry<Integer, FilesInfo> unit : context.getFiles().entrySet()) {
      FilesInfo files = unit.getValue();
      if (frontend.isDryRun() && !Files.exists(files.dependencyList())) {
        missing.add(files.dependencyList());
      }
      dependencyFiles.add(
          new UnitDependencyFile(unit.getKey(), files.dependencyList(), files.isExternal()));
    }
    if (!missing.isEmpty()) {
      context
          .getStatus()
          .addWarning(
              "Dry run: %d dependency file(s) are not built yet, can't go beyond parse import.",
              missing.size());
      context.stop();
      return;
    }

    DependencySolver solver = new DependencySolver(interner);
    DependencyGraph graph = solver.solve(dependencyFiles);
    context.getStatus().inheritResult(solver.getStatus(), "Dependencies solver: ");
    if (graph == null) {
      return;
    }
    context.setGraph(graph);

    if (options.dumpDependencies) {
      logger.atInfo().log("Dependencies graph:\n%s", graph.dump());
    }
  }

  void codeGen() throws InterruptedException {
    if (!context.shouldContinue()) {
      return;
    }
    if (!context.getGraph().dfsJobs(scheduler, this::processNode)) {
      context.getStatus().setFailure("Codegen: phase failed.");
    }
  }

  private boolean processNode(Node node) throws InterruptedException {
    DependencyGraph graph = context.getGraph();
    FilesInfo files = context.getFiles(node.getUnit().unitId());

    if (files.isExternal()) {
      if (frontend.isDryRun() || Files.exists(files.declarationAst())) {
        return true;
      }
      logger.atSevere().log(
          "Library declaration %s of '%s' is missing", files.declarationAst(), files.unitPath());
      return false;
    }

    boolean isDeclaration = node.getKind() == NodeKind.DECLARATION;
    if (isDeclaration && node.getDependentNodes().isEmpty() && !graph.isPublic(node.getId())) {
      // Nothing reads the declaration AST of a terminal, non-public unit.
      logger.atFine().log("Skipping unused declaration %s", graph.describe(node.getId()));
      return true;
    }
    Path artifact = isDeclaration ? files.declarationAst() : files.object();

    boolean rebuilt = false;
    if (checker.isUpToDate(files.source(), artifact, node.getDependencies())) {
      logger.atFine().log("%s is up to date", graph.describe(node.getId()));
    } else {
      ImmutableList<Path> dependencies =
          graph.fullDependencies(node.getId()).stream()
              .map(id -> context.getFiles(id.unitId()).declarationAst())
              .collect(toImmutableList());
      BuildRequest request =
          new BuildRequest(
              files.unitPath(),
              files.source(),
              artifact,
              dependencies,
              options.getPreambleOutput());
      HashCode previousHash = checker.readArtifactHash(artifact);

      try {
        if (isDeclaration) {
          logPhase(
              "BUILD DECL %s, deps: (%s) -> decl-ast: %s",
              files.source(),
              COMMA_JOINER.join(dependencies),
              artifact);
          frontend.buildDeclaration(request);
        } else {
          logPhase(
              "BUILD OBJ  %s, deps: (%s) -> object: %s",
              files.source(),
              COMMA_JOINER.join(dependencies),
              artifact);
          frontend.buildObject(request);
        }
      } catch (FrontendException e) {
        logger.atSevere().log(
            "Failed to build %s: %s", graph.describe(node.getId()), e.getMessage());
        return false;
      }
      rebuilt = true;

      HashCode newHash = frontend.isDryRun() ? null : checker.readArtifactHash(artifact);
      if (newHash == null || !newHash.equals(previousHash)) {
        logger.atFinest().log("%s was updated", graph.describe(node.getId()));
        context.markUpdated(node.getId());
      }
    }

    if (isDeclaration && graph.isPublic(node.getId())) {
      return generateInterfaces(node, files, rebuilt);
    }
    return true;
  }

  /** Writes the header and the declaration text of a public unit, where requested. */
  private boolean generateInterfaces(Node node, FilesInfo files, boolean rebuilt) {
    List<Path> outputs = new ArrayList<>();
    if (files.header() != null && (rebuilt || !Files.exists(files.header()))) {
      outputs.add(files.header());
    }
    if (files.declaration() != null && (rebuilt || !Files.exists(files.declaration()))) {
      outputs.add(files.declaration());
    }
    if (outputs.isEmpty()) {
      return true;
    }

    DependencyGraph graph = context.getGraph();
    ImmutableList<String> includes =
        node.getDependencies().stream()
            .map(id -> graph.getUnit(id.unitId()).path())
            .collect(toImmutableList());
    try {
      ImmutableList<SkipFragment> fragments =
          frontend.isDryRun()
              ? ImmutableList.of()
              : HashMetaFile.read(files.declarationAstMeta()).skipFragments();
      for (Path output : outputs) {
        headerGenerator.generate(files.unitPath(), files.source(), output, includes, fragments);
      }
      return true;
    } catch (IOException | FrontendException e) {
      logger.atSevere().log(
          "Failed to generate interface of '%s': %s", files.unitPath(), e.getMessage());
      return false;
    }
  }

  void runLinker() throws InterruptedException {
    if (!context.shouldContinue()) {
      return;
    }
    Path output = options.getOutput();
    boolean objectsUpdated =
        context.isPreambleUpdated()
            || context.getUpdatedNodes().stream().anyMatch(id -> id.kind() == NodeKind.DEFINITION);
    if (!objectsUpdated && Files.exists(output)) {
      logger.atFine().log("%s is up to date", output);
      return;
    }

    ImmutableList<Path> objects =
        projectUnits().values().stream().map(FilesInfo::object).collect(toImmutableList());
    if (objects.isEmpty()) {
      return;
    }
    logPhase("LINK objects: (%s) -> %s", COMMA_JOINER.join(objects), output);
    try {
      frontend.link(new LinkRequest(objects, output));
    } catch (FrontendException e) {
      context.getStatus().setFailure("Link: phase failed. %s", e.getMessage());
    }
  }

  private ImmutableMap<Integer, FilesInfo> projectUnits() {
    ImmutableMap.Builder<Integer, FilesInfo> units = ImmutableMap.builder();
    for (Map.Entry<Integer, FilesInfo> unit : context.getFiles().entrySet()) {
      if (!unit.getValue().isExternal()) {
        units.put(unit);
      }
    }
    return units.buildOrThrow();
  }

  /** Phase lines are shown by default, except in dry run where the commands are shown instead. */
  private void logPhase(String format, Object... args) {
    logger
        .at(frontend.isDryRun() && !options.verbose ? Level.FINE : Level.INFO)
        .logVarargs(format, args);
  }
}
