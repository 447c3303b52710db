package com.architecture.memory.flowgraph;

import com.architecture.memory.flowgraph.config.AnalyzerSettings;
import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.dto.IssueSeverity;
import com.architecture.memory.flowgraph.dto.ProjectAnalysisReport;
import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.ProjectAnalysisService;
import com.architecture.memory.flowgraph.service.graph.GraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FlowGraphApplicationTest {

    @Autowired
    private ProjectAnalysisService analysisService;

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private AnalyzerSettings settings;

    @BeforeEach
    void setUp() {
        graphStore.clear();
    }

    @Test
    void settingsAreBoundFromApplicationYaml() {
        assertThat(settings.getValidationMaxDepth()).isEqualTo(256);
        assertThat(settings.isParametersAsLeaves()).isTrue();
        assertThat(settings.getWorkerThreads()).isEqualTo(4);
    }

    @Test
    void analyzesAParsedSourceFile() throws URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/fixtures/checkout.ts.json").toURI());

        ProjectAnalysisReport report = analysisService.analyzeAstFiles(List.of(fixture));

        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getUnitsAnalyzed()).isEqualTo(1);
        assertThat(report.getIntegrityIssues()).isEmpty();
        assertThat(report.getValidationIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getCode()).isEqualTo(DataFlowIssue.ERR_MISSING_ASSIGNMENT);
            assertThat(issue.getSeverity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(issue.getNodeId()).isEqualTo("variable:checkout.ts:module.checkout.leftover");
            assertThat(issue.getLine()).isEqualTo(9);
        });

        assertThat(graphStore.getNode("function:checkout.ts:module.checkout")).isPresent();
        assertThat(graphStore.getOutgoingEdges("variable:checkout.ts:module.checkout.status", Set.of(EdgeType.ASSIGNED_FROM)))
                .withFailMessage("Both branches of the if assign status")
                .hasSize(2);
        assertThat(graphStore.queryNodes(NodeKind.ISSUE)).hasSize(1);
        assertThat(report.getNodeCount()).isEqualTo(graphStore.nodeCount());
    }
}
