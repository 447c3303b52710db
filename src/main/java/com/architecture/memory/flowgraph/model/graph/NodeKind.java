package com.architecture.memory.flowgraph.model.graph;

/**
 * Closed set of node kinds emitted by the build pass.
 */
public enum NodeKind {
    MODULE,
    VARIABLE,
    PARAMETER,
    FUNCTION,
    CLASS,
    CALL,
    METHOD_CALL,
    CONSTRUCTOR_CALL,
    EXPRESSION,
    LITERAL,
    OBJECT_LITERAL,
    ARRAY_LITERAL,
    BRANCH,
    IMPORT,      // external resource marker
    ISSUE;

    public boolean isCall() {
        return this == CALL || this == METHOD_CALL || this == CONSTRUCTOR_CALL;
    }

    public boolean isBinding() {
        return this == VARIABLE || this == PARAMETER;
    }
}
