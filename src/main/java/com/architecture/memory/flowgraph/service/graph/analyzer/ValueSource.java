package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a value comes from, as seen by the assignment tracker.
 *
 * Exactly one payload is set per {@link Kind}:
 * <ul>
 *   <li>IDENTIFIER: {@code identifierName} resolved against {@code scopeId} at build time</li>
 *   <li>LITERAL: {@code literal}</li>
 *   <li>AGGREGATE: {@code aggregate} (object or array literal)</li>
 *   <li>EXPRESSION: {@code expression}, whose operand slots are sources themselves</li>
 *   <li>REFERENCE: {@code referenceId} of a call, function or class node created by the walker</li>
 *   <li>UNRESOLVED: {@code unresolvedType}, the AST type nobody handles</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValueSource {

    public enum Kind {
        IDENTIFIER,
        LITERAL,
        AGGREGATE,
        EXPRESSION,
        REFERENCE,
        UNRESOLVED
    }

    private Kind kind;

    private String identifierName;
    private String scopeId;

    private LiteralRecord literal;
    private AggregateLiteralRecord aggregate;
    private ExpressionRecord expression;

    private String referenceId;
    private NodeKind referenceKind;

    private String unresolvedType;

    public static ValueSource identifier(String name, String scopeId) {
        return ValueSource.builder().kind(Kind.IDENTIFIER).identifierName(name).scopeId(scopeId).build();
    }

    public static ValueSource literal(LiteralRecord literal) {
        return ValueSource.builder().kind(Kind.LITERAL).literal(literal).build();
    }

    public static ValueSource aggregate(AggregateLiteralRecord aggregate) {
        return ValueSource.builder().kind(Kind.AGGREGATE).aggregate(aggregate).build();
    }

    public static ValueSource expression(ExpressionRecord expression) {
        return ValueSource.builder().kind(Kind.EXPRESSION).expression(expression).build();
    }

    public static ValueSource reference(String id, NodeKind kind) {
        return ValueSource.builder().kind(Kind.REFERENCE).referenceId(id).referenceKind(kind).build();
    }

    public static ValueSource unresolved(String astType) {
        return ValueSource.builder().kind(Kind.UNRESOLVED).unresolvedType(astType).build();
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    public String describe() {
        return switch (kind) {
            case IDENTIFIER -> "identifier " + identifierName;
            case LITERAL -> "literal " + literal.getValue();
            case AGGREGATE -> aggregate.getKind() + " " + aggregate.getId();
            case EXPRESSION -> "expression " + expression.getId();
            case REFERENCE -> referenceKind + " " + referenceId;
            case UNRESOLVED -> "unresolved " + unresolvedType;
        };
    }
}
