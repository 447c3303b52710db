package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of attempting to read a literal value. A {@code null} literal is a distinct
 * state, never folded into "not a literal".
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LiteralExtraction {

    public enum State {
        NOT_LITERAL,
        LITERAL_NULL,
        LITERAL_VALUE
    }

    private static final LiteralExtraction NOT_LITERAL = new LiteralExtraction(State.NOT_LITERAL, null, null);
    private static final LiteralExtraction NULL_LITERAL = new LiteralExtraction(State.LITERAL_NULL, null, "null");

    private final State state;
    private final Object value;
    private final String valueType;

    public static LiteralExtraction notLiteral() {
        return NOT_LITERAL;
    }

    public static LiteralExtraction nullLiteral() {
        return NULL_LITERAL;
    }

    public static LiteralExtraction value(Object value, String valueType) {
        return new LiteralExtraction(State.LITERAL_VALUE, value, valueType);
    }

    public static LiteralExtraction undefinedValue() {
        return new LiteralExtraction(State.LITERAL_VALUE, null, "undefined");
    }

    public boolean isLiteral() {
        return state != State.NOT_LITERAL;
    }

    public boolean isNull() {
        return state == State.LITERAL_NULL;
    }
}
