package com.architecture.memory.flowgraph.support;

import com.architecture.memory.flowgraph.config.AnalyzerSettings;
import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import com.architecture.memory.flowgraph.service.graph.GraphIntegrityChecker;
import com.architecture.memory.flowgraph.service.graph.InMemoryGraphStore;
import com.architecture.memory.flowgraph.service.graph.analyzer.AssignmentTracker;
import com.architecture.memory.flowgraph.service.graph.analyzer.BranchExtractor;
import com.architecture.memory.flowgraph.service.graph.analyzer.ExpressionClassifier;
import com.architecture.memory.flowgraph.service.graph.analyzer.ExpressionNodePolicy;
import com.architecture.memory.flowgraph.service.graph.analyzer.LiteralExtractor;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import com.architecture.memory.flowgraph.service.graph.analyzer.UnitAnalyzer;
import com.architecture.memory.flowgraph.service.graph.builder.AssignmentBuilder;
import com.architecture.memory.flowgraph.service.graph.builder.ControlFlowBuilder;
import com.architecture.memory.flowgraph.service.graph.builder.CoreBuilder;
import com.architecture.memory.flowgraph.service.graph.builder.ReturnBuilder;
import com.architecture.memory.flowgraph.service.graph.builder.UnitGraphBuilder;
import com.architecture.memory.flowgraph.service.validation.DataFlowValidator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.util.List;

/**
 * The analysis components wired by hand, without a Spring context.
 */
@Getter
public class TestPipeline {

    public static final String FILE = "src/app.ts";

    private final CanonicalIdGenerator idGenerator = new CanonicalIdGenerator();
    private final ExpressionClassifier classifier = new ExpressionClassifier(new LiteralExtractor(), idGenerator);
    private final ExpressionNodePolicy expressionPolicy = new ExpressionNodePolicy(idGenerator);
    private final AssignmentTracker assignmentTracker = new AssignmentTracker(classifier, expressionPolicy);
    private final BranchExtractor branchExtractor = new BranchExtractor(classifier, expressionPolicy, assignmentTracker, idGenerator);
    private final UnitAnalyzer unitAnalyzer = new UnitAnalyzer(idGenerator, classifier, assignmentTracker, branchExtractor);
    private final CoreBuilder coreBuilder = new CoreBuilder();
    private final UnitGraphBuilder unitGraphBuilder = new UnitGraphBuilder(coreBuilder,
            new AssignmentBuilder(coreBuilder), new ReturnBuilder(coreBuilder), new ControlFlowBuilder(coreBuilder));
    private final GraphIntegrityChecker integrityChecker = new GraphIntegrityChecker();
    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final DataFlowValidator validator;

    public TestPipeline() {
        this(AnalyzerSettings.defaults());
    }

    public TestPipeline(AnalyzerSettings settings) {
        this.validator = new DataFlowValidator(settings, idGenerator, Runnable::run);
    }

    public ParsedUnit analyze(ObjectNode program) {
        return unitAnalyzer.analyze(AstNode.of(program), FILE);
    }

    public UnitGraph build(ObjectNode program) {
        return unitGraphBuilder.build(analyze(program));
    }

    /**
     * Builds, commits and validates one program. Returns the validation issues.
     */
    public List<DataFlowIssue> validate(ObjectNode program) {
        store.commitBatch(build(program));
        return validator.validate(store);
    }
}
