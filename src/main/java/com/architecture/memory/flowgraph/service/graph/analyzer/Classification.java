package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.Getter;

/**
 * Closed classification of an expression after wrapper unwrapping.
 *
 * Consumers dispatch on {@link #getKind()} and cast to the matching nested type;
 * the constructor is private so no other variants exist.
 */
@Getter
public abstract class Classification {

    public enum Kind {
        IDENTIFIER,
        LITERAL,
        OBJECT_LITERAL,
        ARRAY_LITERAL,
        CALL,
        FUNCTION,
        CLASS,
        COMPLEX,
        UNSUPPORTED
    }

    private final Kind kind;
    // The effective node after unwrapping await/sequence/type assertions
    private final AstNode node;

    private Classification(Kind kind, AstNode node) {
        this.kind = kind;
        this.node = node;
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "(" + node + ")";
    }

    @Getter
    public static final class Identifier extends Classification {
        private final String name;

        Identifier(AstNode node, String name) {
            super(Kind.IDENTIFIER, node);
            this.name = name;
        }
    }

    @Getter
    public static final class Literal extends Classification {
        private final LiteralExtraction extraction;

        Literal(AstNode node, LiteralExtraction extraction) {
            super(Kind.LITERAL, node);
            this.extraction = extraction;
        }
    }

    public static final class Aggregate extends Classification {
        Aggregate(Kind kind, AstNode node) {
            super(kind, node);
        }

        public NodeKind getNodeKind() {
            return getKind() == Kind.OBJECT_LITERAL ? NodeKind.OBJECT_LITERAL : NodeKind.ARRAY_LITERAL;
        }
    }

    @Getter
    public static final class Call extends Classification {
        private final NodeKind callKind;
        private final String name;
        private final String receiverName;

        Call(AstNode node, NodeKind callKind, String name, String receiverName) {
            super(Kind.CALL, node);
            this.callKind = callKind;
            this.name = name;
            this.receiverName = receiverName;
        }
    }

    public static final class Function extends Classification {
        Function(AstNode node) {
            super(Kind.FUNCTION, node);
        }
    }

    public static final class ClassRef extends Classification {
        ClassRef(AstNode node) {
            super(Kind.CLASS, node);
        }
    }

    @Getter
    public static final class Complex extends Classification {
        private final ExpressionKind expressionKind;

        Complex(AstNode node, ExpressionKind expressionKind) {
            super(Kind.COMPLEX, node);
            this.expressionKind = expressionKind;
        }
    }

    @Getter
    public static final class Unsupported extends Classification {
        private final String astType;

        Unsupported(AstNode node, String astType) {
            super(Kind.UNSUPPORTED, node);
            this.astType = astType;
        }
    }
}
