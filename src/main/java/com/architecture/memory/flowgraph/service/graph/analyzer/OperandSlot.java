package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named operand position of a compound expression, e.g. {@code left}, {@code consequent},
 * {@code object} or {@code substitution[1]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperandSlot {
    private String name;
    private ValueSource source;

    public static OperandSlot of(String name, ValueSource source) {
        return new OperandSlot(name, source);
    }

    public boolean isIdentifier() {
        return source.is(ValueSource.Kind.IDENTIFIER);
    }

    public String getIdentifierName() {
        return isIdentifier() ? source.getIdentifierName() : null;
    }

    public boolean isLiteral() {
        return source.is(ValueSource.Kind.LITERAL);
    }

    public Object getLiteralValue() {
        return isLiteral() ? source.getLiteral().getValue() : null;
    }

    public Integer getLiteralLine() {
        return isLiteral() ? source.getLiteral().getLine() : null;
    }

    public Integer getLiteralColumn() {
        return isLiteral() ? source.getLiteral().getColumn() : null;
    }

    public boolean isNestedExpression() {
        return source.is(ValueSource.Kind.EXPRESSION);
    }
}
