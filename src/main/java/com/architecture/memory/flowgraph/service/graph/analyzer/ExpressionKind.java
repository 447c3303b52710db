package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Sub-kinds of compound expressions whose operands are themselves trees.
 */
@Getter
@RequiredArgsConstructor
public enum ExpressionKind {
    MEMBER("MemberExpression"),
    BINARY("BinaryExpression"),
    LOGICAL("LogicalExpression"),
    CONDITIONAL("ConditionalExpression"),
    UNARY("UnaryExpression"),
    UPDATE("UpdateExpression"),
    TEMPLATE_LITERAL("TemplateLiteral"),
    TAGGED_TEMPLATE("TaggedTemplateExpression");

    // Written into node ids and the expressionType attribute
    private final String astType;
}
