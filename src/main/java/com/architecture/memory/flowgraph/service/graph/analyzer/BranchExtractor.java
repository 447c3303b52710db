package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link BranchInfo} records for ternaries, if/switch statements, loops and try blocks.
 *
 * A condition or ternary arm is recorded only when {@link ExpressionNodePolicy} says it
 * produces an Expression node; the record then carries that node's description so the
 * builder creates exactly the node it links to.
 */
@Component
@RequiredArgsConstructor
public class BranchExtractor {

    private final ExpressionClassifier classifier;
    private final ExpressionNodePolicy expressionPolicy;
    private final AssignmentTracker assignmentTracker;
    private final CanonicalIdGenerator idGenerator;

    public BranchInfo extractTernary(AstNode conditional, ScopeContext ctx) {
        BranchInfo branch = newBranch(BranchInfo.TERNARY, conditional, ctx);
        branch.setCondition(expressionIfProduced(conditional.get("test"), ctx));
        branch.setConsequent(expressionIfProduced(conditional.get("consequent"), ctx));
        branch.setAlternate(expressionIfProduced(conditional.get("alternate"), ctx));
        return branch;
    }

    public BranchInfo extractIf(AstNode statement, ScopeContext ctx) {
        BranchInfo branch = newBranch(BranchInfo.IF, statement, ctx);
        branch.setCondition(expressionIfProduced(statement.get("test"), ctx));
        return branch;
    }

    public BranchInfo extractSwitch(AstNode statement, ScopeContext ctx) {
        BranchInfo branch = newBranch(BranchInfo.SWITCH, statement, ctx);
        branch.setCondition(expressionIfProduced(statement.get("discriminant"), ctx));
        branch.setCaseCount(statement.getList("cases").size());
        return branch;
    }

    public BranchInfo extractLoop(AstNode statement, ScopeContext ctx) {
        BranchInfo branch = newBranch(BranchInfo.LOOP, statement, ctx);
        switch (statement.getType()) {
            case "ForStatement" -> {
                branch.setLoopKind("for");
                branch.setCondition(expressionIfProduced(statement.get("test"), ctx));
            }
            case "ForInStatement" -> {
                branch.setLoopKind("for-in");
                branch.setIterable(assignmentTracker.describe(statement.get("right"), ctx));
            }
            case "ForOfStatement" -> {
                branch.setLoopKind(statement.getFlag("await") ? "for-await-of" : "for-of");
                branch.setIterable(assignmentTracker.describe(statement.get("right"), ctx));
            }
            case "WhileStatement" -> {
                branch.setLoopKind("while");
                branch.setCondition(expressionIfProduced(statement.get("test"), ctx));
            }
            case "DoWhileStatement" -> {
                branch.setLoopKind("do-while");
                branch.setCondition(expressionIfProduced(statement.get("test"), ctx));
            }
            default -> throw new IllegalArgumentException("Not a loop statement: " + statement);
        }
        return branch;
    }

    /**
     * The try branch followed by its catch and finally branches, each linked to the try.
     */
    public List<BranchInfo> extractTry(AstNode statement, ScopeContext ctx) {
        List<BranchInfo> branches = new ArrayList<>();
        BranchInfo tryBranch = newBranch(BranchInfo.TRY, statement, ctx);
        branches.add(tryBranch);

        AstNode handler = statement.get("handler");
        if (handler != null) {
            BranchInfo catchBranch = newBranch(BranchInfo.CATCH, handler, ctx);
            catchBranch.setParentBranchId(tryBranch.getId());
            catchBranch.setParentEdgeType(EdgeType.HAS_CATCH);
            branches.add(catchBranch);
        }
        AstNode finalizer = statement.get("finalizer");
        if (finalizer != null) {
            BranchInfo finallyBranch = newBranch(BranchInfo.FINALLY, finalizer, ctx);
            finallyBranch.setParentBranchId(tryBranch.getId());
            finallyBranch.setParentEdgeType(EdgeType.HAS_FINALLY);
            branches.add(finallyBranch);
        }
        return branches;
    }

    /**
     * The Expression record for {@code expression} if, and only if, it produces an Expression node.
     */
    ExpressionRecord expressionIfProduced(AstNode expression, ScopeContext ctx) {
        if (expression == null) {
            return null;
        }
        Classification classification = classifier.classify(expression);
        if (!expressionPolicy.producesExpressionNode(classification)) {
            return null;
        }
        return assignmentTracker.describeExpression((Classification.Complex) classification, ctx);
    }

    private BranchInfo newBranch(String kind, AstNode node, ScopeContext ctx) {
        String baseId = idGenerator.generateBranchId(kind, ctx.getFile(), node.getLine(), node.getColumn());
        return BranchInfo.builder()
                .id(ctx.positionalId(node, baseId))
                .branchKind(kind)
                .line(node.getLine())
                .column(node.getColumn())
                .containerId(ctx.currentContainerId())
                .scopeId(ctx.currentScopeId())
                .build();
    }
}
