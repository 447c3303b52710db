package com.architecture.memory.flowgraph.service;

import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.dto.ProjectAnalysisReport;
import com.architecture.memory.flowgraph.dto.SourceUnit;
import com.architecture.memory.flowgraph.dto.UnitFailure;
import com.architecture.memory.flowgraph.model.ast.AstFormatException;
import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import com.architecture.memory.flowgraph.service.graph.GraphIntegrityChecker;
import com.architecture.memory.flowgraph.service.graph.GraphStore;
import com.architecture.memory.flowgraph.service.graph.analyzer.AstReader;
import com.architecture.memory.flowgraph.service.graph.analyzer.ExtractorCoverage;
import com.architecture.memory.flowgraph.service.graph.analyzer.UnitAnalyzer;
import com.architecture.memory.flowgraph.service.graph.builder.UnitGraphBuilder;
import com.architecture.memory.flowgraph.service.validation.DataFlowValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Orchestrates a whole-project analysis:
 *   1. Analyze and build each unit (units of one file run sequentially, files in parallel)
 *   2. Commit each unit batch atomically to the graph store
 *   3. Check graph integrity (dangling edges)
 *   4. Validate data-flow lineage of every variable
 *
 * A failing unit is recorded and skipped; it never aborts its siblings.
 */
@Service
@Slf4j
public class ProjectAnalysisService {

    private final AstReader astReader;
    private final UnitAnalyzer unitAnalyzer;
    private final UnitGraphBuilder unitGraphBuilder;
    private final GraphStore graphStore;
    private final GraphIntegrityChecker integrityChecker;
    private final DataFlowValidator validator;
    private final CanonicalIdGenerator idGenerator;
    private final Executor executor;

    public ProjectAnalysisService(AstReader astReader,
                                  UnitAnalyzer unitAnalyzer,
                                  UnitGraphBuilder unitGraphBuilder,
                                  GraphStore graphStore,
                                  GraphIntegrityChecker integrityChecker,
                                  DataFlowValidator validator,
                                  CanonicalIdGenerator idGenerator,
                                  @Qualifier("analysisExecutor") Executor executor) {
        this.astReader = astReader;
        this.unitAnalyzer = unitAnalyzer;
        this.unitGraphBuilder = unitGraphBuilder;
        this.graphStore = graphStore;
        this.integrityChecker = integrityChecker;
        this.validator = validator;
        this.idGenerator = idGenerator;
        this.executor = executor;
    }

    /**
     * Build pass for one unit. Touches no storage; the caller decides when to commit.
     */
    public UnitGraph analyzeUnit(AstNode program, String file) {
        return unitGraphBuilder.build(unitAnalyzer.analyze(program, file));
    }

    /**
     * Reads parser output files (one JSON AST per source file) and analyzes them as a project.
     * Unreadable files are reported as failures. The unit file name is the AST file name
     * without its {@code .json} suffix.
     */
    public ProjectAnalysisReport analyzeAstFiles(List<Path> astFiles) {
        List<SourceUnit> units = new ArrayList<>();
        List<UnitFailure> unreadable = new ArrayList<>();
        for (Path astFile : astFiles) {
            String file = sourceNameOf(astFile);
            try {
                units.add(SourceUnit.builder().file(file).program(astReader.read(astFile)).build());
            } catch (AstFormatException e) {
                log.error("[pipeline] Unreadable AST {}: {}", astFile, e.getMessage());
                unreadable.add(UnitFailure.builder()
                        .file(file)
                        .errorType(e.getClass().getSimpleName())
                        .message(e.getMessage())
                        .build());
            }
        }
        ProjectAnalysisReport report = analyzeProject(units);
        report.getFailures().addAll(0, unreadable);
        return report;
    }

    public ProjectAnalysisReport analyzeProject(List<SourceUnit> units) {
        return analyzeProject(units, () -> false);
    }

    /**
     * Runs the full pipeline. {@code cancelled} is checked between units and between
     * validation traversals.
     */
    public ProjectAnalysisReport analyzeProject(List<SourceUnit> units, BooleanSupplier cancelled) {
        log.info("[pipeline] Starting analysis of {} units", units.size());

        Map<String, List<SourceUnit>> byFile = new LinkedHashMap<>();
        for (SourceUnit unit : units) {
            byFile.computeIfAbsent(unit.getFile(), k -> new ArrayList<>()).add(unit);
        }

        List<CompletableFuture<FileOutcome>> futures = new ArrayList<>();
        for (List<SourceUnit> fileUnits : byFile.values()) {
            futures.add(CompletableFuture.supplyAsync(() -> runFile(fileUnits, cancelled), executor));
        }

        ProjectAnalysisReport report = ProjectAnalysisReport.builder().build();
        ExtractorCoverage coverage = new ExtractorCoverage();
        for (CompletableFuture<FileOutcome> future : futures) {
            FileOutcome outcome = future.join();
            report.setUnitsAnalyzed(report.getUnitsAnalyzed() + outcome.analyzed);
            report.getFailures().addAll(outcome.failures);
            outcome.graphs.forEach(g -> coverage.mergeFrom(g.getUnhandledTypes(), g.getUnresolvedIdentifiers()));
        }
        report.setUnhandledTypes(new LinkedHashMap<>(coverage.getUnhandledTypes()));
        report.setUnresolvedIdentifiers(new LinkedHashMap<>(coverage.getUnresolvedIdentifiers()));

        if (cancelled.getAsBoolean()) {
            log.info("[pipeline] Cancelled after build pass: {} units analyzed", report.getUnitsAnalyzed());
            report.setCancelled(true);
            return withCounts(report);
        }

        List<DataFlowIssue> integrityIssues = integrityChecker.check(graphStore);
        for (DataFlowIssue issue : integrityIssues) {
            graphStore.bufferNode(issue.toNode(idGenerator));
        }
        graphStore.commit();
        report.setIntegrityIssues(integrityIssues);

        report.setValidationIssues(validator.validate(graphStore, cancelled));
        report.setCancelled(cancelled.getAsBoolean());

        withCounts(report);
        log.info("[pipeline] Analysis complete: units={}, failures={}, nodes={}, edges={}, integrityIssues={}, validationIssues={}",
                report.getUnitsAnalyzed(), report.getFailures().size(), report.getNodeCount(), report.getEdgeCount(),
                integrityIssues.size(), report.getValidationIssues().size());
        if (!coverage.isComplete()) {
            log.info("[coverage] {}", coverage);
        }
        return report;
    }

    private FileOutcome runFile(List<SourceUnit> units, BooleanSupplier cancelled) {
        FileOutcome outcome = new FileOutcome();
        for (SourceUnit unit : units) {
            if (cancelled.getAsBoolean()) {
                break;
            }
            try {
                UnitGraph graph = analyzeUnit(unit.getProgram(), unit.getFile());
                graphStore.commitBatch(graph);
                outcome.graphs.add(graph);
                outcome.analyzed++;
                log.info("[pipeline] Analyzed {}: {} nodes, {} edges", unit.getFile(),
                        graph.getNodes().size(), graph.getEdges().size());
            } catch (RuntimeException e) {
                log.error("[pipeline] Failed to analyze {}", unit.getFile(), e);
                outcome.failures.add(UnitFailure.builder()
                        .file(unit.getFile())
                        .errorType(e.getClass().getSimpleName())
                        .message(e.getMessage())
                        .build());
            }
        }
        return outcome;
    }

    private String sourceNameOf(Path astFile) {
        String name = astFile.getFileName().toString();
        return name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
    }

    private ProjectAnalysisReport withCounts(ProjectAnalysisReport report) {
        report.setNodeCount(graphStore.nodeCount());
        report.setEdgeCount(graphStore.edgeCount());
        return report;
    }

    private static final class FileOutcome {
        private final List<UnitGraph> graphs = new ArrayList<>();
        private final List<UnitFailure> failures = new ArrayList<>();
        private int analyzed;
    }
}
