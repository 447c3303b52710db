package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Classifies an initializer or operand expression into a {@link Classification}.
 *
 * Transparent wrappers are peeled first: parentheses, TypeScript assertions,
 * await/yield, optional chains, sequences (last element) and nested assignments
 * (right-hand side). Everything not recognized below is {@code UNSUPPORTED}.
 */
@Component
@RequiredArgsConstructor
public class ExpressionClassifier {

    private static final Set<String> WRAPPERS = Set.of(
            "ParenthesizedExpression",
            "TSAsExpression",
            "TSSatisfiesExpression",
            "TSNonNullExpression",
            "TSTypeAssertion",
            "TSInstantiationExpression",
            "TypeCastExpression",
            "AwaitExpression",
            "YieldExpression",
            "SequenceExpression",
            "ChainExpression",
            "AssignmentExpression"
    );

    private static final Set<String> MEMBER_TYPES = Set.of(
            "MemberExpression", "OptionalMemberExpression");

    private static final Set<String> CALL_TYPES = Set.of(
            "CallExpression", "OptionalCallExpression");

    private final LiteralExtractor literalExtractor;
    private final CanonicalIdGenerator idGenerator;

    public Classification classify(AstNode expression) {
        AstNode node = unwrap(expression);
        if (node == null) {
            return new Classification.Unsupported(expression, expression != null ? expression.getType() : "<none>");
        }

        LiteralExtraction literal = literalExtractor.extract(node);
        if (literal.isLiteral()) {
            return new Classification.Literal(node, literal);
        }

        String type = node.getType();
        if (node.is("Identifier")) {
            // `undefined` is a global binding but reads as a value
            if ("undefined".equals(node.getName())) {
                return new Classification.Literal(node, LiteralExtraction.undefinedValue());
            }
            return new Classification.Identifier(node, node.getName());
        }
        if (node.is("ObjectExpression")) {
            return new Classification.Aggregate(Classification.Kind.OBJECT_LITERAL, node);
        }
        if (node.is("ArrayExpression")) {
            return new Classification.Aggregate(Classification.Kind.ARRAY_LITERAL, node);
        }
        if (CALL_TYPES.contains(type)) {
            return classifyCall(node, node.get("callee"));
        }
        if (node.is("NewExpression")) {
            return new Classification.Call(node, NodeKind.CONSTRUCTOR_CALL, calleeName(node.get("callee")), null);
        }
        if (node.isAnyOf("FunctionExpression", "ArrowFunctionExpression", "ObjectMethod")) {
            return new Classification.Function(node);
        }
        if (node.is("ClassExpression")) {
            return new Classification.ClassRef(node);
        }
        if (node.is("TaggedTemplateExpression")) {
            AstNode tag = unwrap(node.get("tag"));
            if (tag != null && (tag.is("Identifier") || MEMBER_TYPES.contains(tag.getType()))) {
                return classifyCall(node, tag);
            }
            return new Classification.Complex(node, ExpressionKind.TAGGED_TEMPLATE);
        }
        if (MEMBER_TYPES.contains(type)) {
            return new Classification.Complex(node, ExpressionKind.MEMBER);
        }
        if (node.is("BinaryExpression")) {
            return new Classification.Complex(node, ExpressionKind.BINARY);
        }
        if (node.is("LogicalExpression")) {
            return new Classification.Complex(node, ExpressionKind.LOGICAL);
        }
        if (node.is("ConditionalExpression")) {
            return new Classification.Complex(node, ExpressionKind.CONDITIONAL);
        }
        if (node.is("UnaryExpression")) {
            return new Classification.Complex(node, ExpressionKind.UNARY);
        }
        if (node.is("UpdateExpression")) {
            return new Classification.Complex(node, ExpressionKind.UPDATE);
        }
        if (node.is("TemplateLiteral")) {
            return new Classification.Complex(node, ExpressionKind.TEMPLATE_LITERAL);
        }
        return new Classification.Unsupported(node, type);
    }

    /**
     * Peels transparent wrappers until a node that carries meaning is reached.
     * Returns null for an empty sequence or a wrapper without its inner expression.
     */
    public AstNode unwrap(AstNode expression) {
        AstNode current = expression;
        while (current != null && WRAPPERS.contains(current.getType())) {
            current = innerOf(current);
        }
        return current;
    }

    public boolean isWrapper(AstNode node) {
        return node != null && WRAPPERS.contains(node.getType());
    }

    /**
     * Positional id of a node referenced by value: calls, functions, classes and aggregates.
     * Identifiers, literals and expressions are given ids by their own builders.
     */
    public String referenceId(Classification classification, ScopeContext ctx) {
        AstNode node = classification.getNode();
        NodeKind kind = switch (classification.getKind()) {
            case CALL -> ((Classification.Call) classification).getCallKind();
            case FUNCTION -> NodeKind.FUNCTION;
            case CLASS -> NodeKind.CLASS;
            case OBJECT_LITERAL, ARRAY_LITERAL -> ((Classification.Aggregate) classification).getNodeKind();
            default -> throw new IllegalArgumentException("Not a reference classification: " + classification);
        };
        return positionalId(kind, node, ctx);
    }

    public String positionalId(NodeKind kind, AstNode node, ScopeContext ctx) {
        return ctx.positionalId(node, idGenerator.generatePositionalId(kind, ctx.getFile(), node.getLine(), node.getColumn()));
    }

    private Classification classifyCall(AstNode node, AstNode rawCallee) {
        AstNode callee = unwrap(rawCallee);
        if (callee != null && MEMBER_TYPES.contains(callee.getType())) {
            AstNode receiver = unwrap(callee.get("object"));
            String receiverName = receiver != null ? receiver.getName() : null;
            return new Classification.Call(node, NodeKind.METHOD_CALL, memberPropertyName(callee), receiverName);
        }
        return new Classification.Call(node, NodeKind.CALL, calleeName(callee), null);
    }

    private AstNode innerOf(AstNode wrapper) {
        switch (wrapper.getType()) {
            case "SequenceExpression": {
                List<AstNode> expressions = wrapper.getList("expressions");
                return expressions.isEmpty() ? null : expressions.get(expressions.size() - 1);
            }
            case "AssignmentExpression":
                return wrapper.get("right");
            default:
                return wrapper.get("expression") != null ? wrapper.get("expression") : wrapper.get("argument");
        }
    }

    String calleeName(AstNode callee) {
        AstNode node = unwrap(callee);
        if (node == null) {
            return null;
        }
        if (node.is("Identifier")) {
            return node.getName();
        }
        if (MEMBER_TYPES.contains(node.getType())) {
            return memberPropertyName(node);
        }
        if (node.isAnyOf("Super", "ThisExpression", "Import")) {
            return node.getType().toLowerCase();
        }
        return null;
    }

    private String memberPropertyName(AstNode member) {
        AstNode property = member.get("property");
        if (property == null) {
            return null;
        }
        if (!member.getFlag("computed") && property.is("Identifier")) {
            return property.getName();
        }
        if (property.is("PrivateName") && property.get("id") != null) {
            return "#" + property.get("id").getName();
        }
        LiteralExtraction literal = literalExtractor.extract(property);
        return literal.isLiteral() && literal.getValue() != null ? String.valueOf(literal.getValue()) : null;
    }
}
