package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import com.architecture.memory.flowgraph.support.AstBuilder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.memory.flowgraph.support.AstBuilder.at;
import static com.architecture.memory.flowgraph.support.AstBuilder.toAst;
import static org.assertj.core.api.Assertions.assertThat;

class BranchExtractorTest {

    private final CanonicalIdGenerator idGenerator = new CanonicalIdGenerator();
    private final ExpressionClassifier classifier = new ExpressionClassifier(new LiteralExtractor(), idGenerator);
    private final ExpressionNodePolicy policy = new ExpressionNodePolicy(idGenerator);
    private final AssignmentTracker tracker = new AssignmentTracker(classifier, policy);
    private final BranchExtractor extractor = new BranchExtractor(classifier, policy, tracker, idGenerator);
    private final ScopeContext ctx = new ScopeContext("src/app.ts", idGenerator, new ExtractorCoverage());
    private final AstBuilder b = new AstBuilder();

    @Test
    void ternaryWithLiteralArmsRecordsNoArms() {
        ObjectNode ternary = at(b.cond(b.id("flag"), b.str("yes"), b.str("no")), 4, 8);

        BranchInfo branch = extractor.extractTernary(toAst(ternary), ctx);

        assertThat(branch.getId()).isEqualTo("branch:ternary:src/app.ts:4:8");
        assertThat(branch.getCondition()).isNull();
        assertThat(branch.getConsequent())
                .withFailMessage("A literal arm produces no Expression node, so no arm may be recorded")
                .isNull();
        assertThat(branch.getAlternate()).isNull();
    }

    @Test
    void ternaryWithCompoundArmsRecordsThem() {
        ObjectNode ternary = b.cond(b.binary(">", b.id("x"), b.num(1)), b.binary("+", b.id("a"), b.num(1)), b.id("b"));

        BranchInfo branch = extractor.extractTernary(toAst(ternary), ctx);

        assertThat(branch.getCondition().getKind()).isEqualTo(ExpressionKind.BINARY);
        assertThat(branch.getCondition().getOperator()).isEqualTo(">");
        assertThat(branch.getConsequent().getOperator()).isEqualTo("+");
        assertThat(branch.getAlternate()).isNull();
    }

    @Test
    void armRecordSharesTheIdTheTrackerAssigns() {
        ObjectNode arm = b.member(b.id("user"), "name");
        ObjectNode ternary = b.cond(b.id("ok"), arm, b.str(""));

        BranchInfo branch = extractor.extractTernary(toAst(ternary), ctx);
        ValueSource described = tracker.describe(toAst(ternary), ctx);

        assertThat(described.getExpression().slot("consequent").getSource().getExpression().getId())
                .isEqualTo(branch.getConsequent().getId());
    }

    @Test
    void ifRecordsItsConditionExpression() {
        ObjectNode statement = b.ifStmt(b.logical("&&", b.id("a"), b.id("b")), b.block(), null);

        BranchInfo branch = extractor.extractIf(toAst(statement), ctx);

        assertThat(branch.getBranchKind()).isEqualTo(BranchInfo.IF);
        assertThat(branch.getCondition().getKind()).isEqualTo(ExpressionKind.LOGICAL);
        assertThat(branch.getContainerId()).isEqualTo("module:src/app.ts");
    }

    @Test
    void switchCountsItsCases() {
        ObjectNode statement = b.switchStmt(b.id("mode"),
                b.switchCase(b.str("a")), b.switchCase(b.str("b")), b.switchCase(null));

        BranchInfo branch = extractor.extractSwitch(toAst(statement), ctx);

        assertThat(branch.getCaseCount()).isEqualTo(3);
        assertThat(branch.getCondition()).isNull();
    }

    @Test
    void loopsRecordTheirKindAndIterable() {
        ObjectNode forOf = b.forOf("const", b.id("item"), b.id("items"), b.block());
        ObjectNode forAwait = b.forOf("const", b.id("chunk"), b.id("stream"), b.block()).put("await", true);
        ObjectNode whileLoop = b.whileStmt(b.binary("<", b.id("i"), b.num(10)), b.block());

        BranchInfo ofBranch = extractor.extractLoop(toAst(forOf), ctx);
        BranchInfo awaitBranch = extractor.extractLoop(toAst(forAwait), ctx);
        BranchInfo whileBranch = extractor.extractLoop(toAst(whileLoop), ctx);

        assertThat(ofBranch.getLoopKind()).isEqualTo("for-of");
        assertThat(ofBranch.getIterable().getIdentifierName()).isEqualTo("items");
        assertThat(awaitBranch.getLoopKind()).isEqualTo("for-await-of");
        assertThat(whileBranch.getLoopKind()).isEqualTo("while");
        assertThat(whileBranch.getCondition().getOperator()).isEqualTo("<");
    }

    @Test
    void tryProducesCatchAndFinallyLinkedToTheTry() {
        ObjectNode statement = b.tryStmt(b.block(), b.id("e"), b.block(), b.block());

        List<BranchInfo> branches = extractor.extractTry(toAst(statement), ctx);

        assertThat(branches).extracting(BranchInfo::getBranchKind)
                .containsExactly(BranchInfo.TRY, BranchInfo.CATCH, BranchInfo.FINALLY);
        String tryId = branches.get(0).getId();
        assertThat(branches.get(1).getParentBranchId()).isEqualTo(tryId);
        assertThat(branches.get(1).getParentEdgeType()).isEqualTo(EdgeType.HAS_CATCH);
        assertThat(branches.get(2).getParentEdgeType()).isEqualTo(EdgeType.HAS_FINALLY);
    }

    @Test
    void tryWithoutHandlerHasOnlyFinally() {
        ObjectNode statement = b.tryStmt(b.block(), null, null, b.block());

        List<BranchInfo> branches = extractor.extractTry(toAst(statement), ctx);

        assertThat(branches).extracting(BranchInfo::getBranchKind).containsExactly(BranchInfo.TRY, BranchInfo.FINALLY);
    }
}
