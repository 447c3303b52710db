package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the value of pure literal AST nodes, Babel and ESTree forms alike.
 */
@Component
public class LiteralExtractor {

    public LiteralExtraction extract(AstNode node) {
        if (node == null) {
            return LiteralExtraction.notLiteral();
        }
        switch (node.getType()) {
            case "StringLiteral":
                return LiteralExtraction.value(node.getText("value"), "string");
            case "NumericLiteral":
                return LiteralExtraction.value(numberOf(node.getRaw("value")), "number");
            case "BooleanLiteral":
                return LiteralExtraction.value(node.getFlag("value"), "boolean");
            case "NullLiteral":
                return LiteralExtraction.nullLiteral();
            case "BigIntLiteral":
                return LiteralExtraction.value(node.getText("value"), "bigint");
            case "RegExpLiteral":
                return LiteralExtraction.value("/" + node.getText("pattern") + "/" + nullToEmpty(node.getText("flags")), "regex");
            case "Literal":
                return extractEstreeLiteral(node);
            case "TemplateLiteral":
                return extractPlainTemplate(node);
            case "UnaryExpression":
                return extractSignedNumber(node);
            default:
                return LiteralExtraction.notLiteral();
        }
    }

    private LiteralExtraction extractEstreeLiteral(AstNode node) {
        if (node.has("regex")) {
            JsonNode regex = node.getRaw("regex");
            return LiteralExtraction.value("/" + regex.path("pattern").asText() + "/" + regex.path("flags").asText(""), "regex");
        }
        if (node.has("bigint")) {
            return LiteralExtraction.value(node.getText("bigint"), "bigint");
        }
        JsonNode value = node.getRaw("value");
        if (value == null || value.isNull()) {
            return LiteralExtraction.nullLiteral();
        }
        if (value.isTextual()) {
            return LiteralExtraction.value(value.asText(), "string");
        }
        if (value.isNumber()) {
            return LiteralExtraction.value(numberOf(value), "number");
        }
        if (value.isBoolean()) {
            return LiteralExtraction.value(value.asBoolean(), "boolean");
        }
        return LiteralExtraction.notLiteral();
    }

    // `plain text` only; templates with substitutions are expressions
    private LiteralExtraction extractPlainTemplate(AstNode node) {
        if (!node.getList("expressions").isEmpty()) {
            return LiteralExtraction.notLiteral();
        }
        StringBuilder text = new StringBuilder();
        List<AstNode> quasis = node.getList("quasis");
        for (AstNode quasi : quasis) {
            if (quasi == null) {
                continue;
            }
            JsonNode value = quasi.getRaw("value");
            if (value != null) {
                JsonNode cooked = value.get("cooked");
                text.append(cooked != null && !cooked.isNull() ? cooked.asText() : value.path("raw").asText(""));
            }
        }
        return LiteralExtraction.value(text.toString(), "string");
    }

    // -1, +2 and void 0 are values, not expressions
    private LiteralExtraction extractSignedNumber(AstNode node) {
        String operator = node.getText("operator");
        AstNode argument = node.get("argument");
        if (argument == null) {
            return LiteralExtraction.notLiteral();
        }
        if ("void".equals(operator)) {
            return extract(argument).isLiteral() ? LiteralExtraction.undefinedValue() : LiteralExtraction.notLiteral();
        }
        if (!"-".equals(operator) && !"+".equals(operator)) {
            return LiteralExtraction.notLiteral();
        }
        LiteralExtraction inner = extract(argument);
        if (inner.getState() != LiteralExtraction.State.LITERAL_VALUE || !(inner.getValue() instanceof Number number)) {
            return LiteralExtraction.notLiteral();
        }
        if ("+".equals(operator)) {
            return inner;
        }
        if (number instanceof Long l) {
            return LiteralExtraction.value(-l, "number");
        }
        return LiteralExtraction.value(-number.doubleValue(), "number");
    }

    private Number numberOf(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return 0L;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.asLong();
        }
        return value.asDouble();
    }

    private String nullToEmpty(String text) {
        return text != null ? text : "";
    }
}
