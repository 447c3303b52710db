package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Single decision point for "does this expression get its own Expression node".
 *
 * Both the assignment tracker and the branch extractor ask here, so a branch arm
 * and an assignment source never disagree about the node they point to.
 */
@Component
@RequiredArgsConstructor
public class ExpressionNodePolicy {

    private final CanonicalIdGenerator idGenerator;

    public boolean producesExpressionNode(Classification classification) {
        return classification != null
                && classification.is(Classification.Kind.COMPLEX)
                && producesExpressionNode(((Classification.Complex) classification).getExpressionKind());
    }

    public boolean producesExpressionNode(ExpressionKind kind) {
        // Every compound sub-kind is materialized; kept as a switch so a new kind is a conscious choice
        return switch (kind) {
            case MEMBER, BINARY, LOGICAL, CONDITIONAL, UNARY, UPDATE, TEMPLATE_LITERAL, TAGGED_TEMPLATE -> true;
        };
    }

    /**
     * The id under which the Expression node for {@code classification} is created. Callers
     * that only link to the node (branch arms) use the same call, so both sides agree.
     */
    public String expressionId(Classification.Complex classification, ScopeContext ctx) {
        return expressionId(classification.getExpressionKind(), classification.getNode(), ctx);
    }

    public String expressionId(ExpressionKind kind, AstNode node, ScopeContext ctx) {
        String baseId = idGenerator.generateExpressionId(kind.getAstType(), ctx.getFile(), node.getLine(), node.getColumn());
        return ctx.positionalId(node, baseId);
    }
}
