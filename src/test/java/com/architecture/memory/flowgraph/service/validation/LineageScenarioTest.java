package com.architecture.memory.flowgraph.service.validation;

import com.architecture.memory.flowgraph.config.AnalyzerSettings;
import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.support.AstBuilder;
import com.architecture.memory.flowgraph.support.TestPipeline;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.memory.flowgraph.support.AstBuilder.params;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole programs through analysis, build, commit and validation.
 */
class LineageScenarioTest {

    private final TestPipeline pipeline = new TestPipeline();
    private final AstBuilder b = new AstBuilder();

    @Test
    void arithmeticOnLiteralsValidates() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(b.constDecl("x", b.binary("+", b.num(1), b.num(2)))));

        assertThat(issues).isEmpty();
    }

    @Test
    void aggregatesAndNullFallbacksValidate() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.constDecl("config", b.obj(b.prop("retries", b.num(3)))),
                b.constDecl("list", b.arr(b.id("config"))),
                b.constDecl("maybe", b.logical("??", b.id("config"), b.nul()))));

        assertThat(issues).isEmpty();
    }

    @Test
    void ternaryArmsTraceToTheirBindings() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.constDecl("a", b.num(1)),
                b.constDecl("b", b.num(2)),
                b.constDecl("c", b.bool(true)),
                b.constDecl("r", b.cond(b.id("c"), b.id("a"), b.id("b")))));

        assertThat(issues).isEmpty();
    }

    @Test
    void unresolvedMembersAreTerminal() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.constDecl("s", b.binary("+", b.member(b.id("x"), "y"), b.member(b.id("z"), "w")))));

        assertThat(issues)
                .withFailMessage("Operands that cannot be traced end the chain; coverage reports them instead")
                .isEmpty();
    }

    @Test
    void unassignedVariableIsReported_unlessACallConsumesIt() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.letDecl("unused", null),
                b.letDecl("out", null),
                b.exprStmt(b.call(b.id("fill"), b.id("out")))));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getCode()).isEqualTo(DataFlowIssue.ERR_MISSING_ASSIGNMENT);
            assertThat(issue.getNodeId()).isEqualTo("variable:src/app.ts:module.unused");
        });
    }

    @Test
    void mutualAssignmentIsACycle() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.letDecl("a", b.id("b")),
                b.letDecl("b", b.id("a"))));

        assertThat(issues).hasSize(2).allSatisfy(issue -> {
            assertThat(issue.getCode()).isEqualTo(DataFlowIssue.ERR_NO_LEAF_NODE);
            assertThat(issue.getReason()).isEqualTo("CYCLE");
        });
    }

    @Test
    void parametersEndTheChainByDefault() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.functionDecl("copy", params(b.id("source")),
                        b.constDecl("target", b.id("source")),
                        b.ret(b.id("target")))));

        assertThat(issues).isEmpty();
    }

    @Test
    void parametersAreDeadEndsWhenTheyAreNotLeaves() {
        TestPipeline strict = new TestPipeline(AnalyzerSettings.builder().parametersAsLeaves(false).build());

        List<DataFlowIssue> issues = strict.validate(b.program(
                b.functionDecl("copy", params(b.id("source")),
                        b.constDecl("target", b.id("source")))));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getReason()).isEqualTo("DEAD_END");
            assertThat(issue.getChain()).containsExactly(
                    "variable:src/app.ts:module.copy.target", "parameter:src/app.ts:module.copy.source");
        });
    }

    @Test
    void destructuringAndLoopsValidate() {
        List<DataFlowIssue> issues = pipeline.validate(b.program(
                b.constDecl("rows", b.call(b.id("fetchRows"))),
                b.declaration("const", b.arrPattern(b.id("first"), b.rest(b.id("others"))), b.id("rows")),
                b.forOf("const", b.objPattern(b.shorthand("id")), b.id("others"),
                        b.block(b.constDecl("key", b.template(List.of("row-", ""), b.id("id")))))));

        assertThat(issues).isEmpty();
    }

    @Test
    void validatingTwiceIsIdempotent() {
        pipeline.validate(b.program(b.letDecl("pending", null)));
        int nodes = pipeline.getStore().nodeCount();
        int edges = pipeline.getStore().edgeCount();

        List<DataFlowIssue> again = pipeline.getValidator().validate(pipeline.getStore());

        assertThat(again).hasSize(1);
        assertThat(pipeline.getStore().nodeCount()).isEqualTo(nodes);
        assertThat(pipeline.getStore().edgeCount()).isEqualTo(edges);
    }
}
