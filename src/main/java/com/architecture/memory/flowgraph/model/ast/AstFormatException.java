package com.architecture.memory.flowgraph.model.ast;

/**
 * Raised when the parser output does not have the expected AST shape.
 */
public class AstFormatException extends RuntimeException {

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
