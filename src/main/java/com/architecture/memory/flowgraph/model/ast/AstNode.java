package com.architecture.memory.flowgraph.model.ast;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view over one node of a Babel/ESTree shaped JSON AST.
 *
 * Every node carries a {@code type} discriminant and {@code loc.start.line/column}.
 * Missing location data reads as 0.
 */
public final class AstNode {

    private final JsonNode json;

    private AstNode(JsonNode json) {
        this.json = json;
    }

    public static AstNode of(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (!json.isObject() || !json.hasNonNull("type")) {
            throw new AstFormatException("AST node without 'type': " + abbreviate(json));
        }
        return new AstNode(json);
    }

    public String getType() {
        return json.get("type").asText();
    }

    public boolean is(String type) {
        return getType().equals(type);
    }

    public boolean isAnyOf(String... types) {
        String own = getType();
        for (String type : types) {
            if (own.equals(type)) {
                return true;
            }
        }
        return false;
    }

    public int getLine() {
        return json.path("loc").path("start").path("line").asInt(0);
    }

    public int getColumn() {
        return json.path("loc").path("start").path("column").asInt(0);
    }

    public AstNode get(String field) {
        JsonNode child = json.get(field);
        if (child == null || !child.isObject()) {
            return null;
        }
        return AstNode.of(child);
    }

    /**
     * Child list for an array field. Array holes ({@code [, a]}) are kept as null entries.
     */
    public List<AstNode> getList(String field) {
        JsonNode array = json.get(field);
        if (array == null || !array.isArray()) {
            return Collections.emptyList();
        }
        List<AstNode> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            result.add(element.isObject() ? AstNode.of(element) : null);
        }
        return result;
    }

    public String getText(String field) {
        JsonNode value = json.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    public boolean getFlag(String field) {
        return json.path(field).asBoolean(false);
    }

    public boolean has(String field) {
        return json.has(field);
    }

    public JsonNode getRaw(String field) {
        return json.get(field);
    }

    /**
     * Identifier name, or null for non-identifiers.
     */
    public String getName() {
        return is("Identifier") ? getText("name") : null;
    }

    /**
     * All direct child nodes in document order, skipping location and comment data.
     */
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (key.equals("loc") || key.equals("range") || key.endsWith("Comments")
                    || key.equals("typeAnnotation") || key.equals("returnType")
                    || key.equals("typeParameters")) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isObject() && value.hasNonNull("type")) {
                children.add(new AstNode(value));
            } else if (value.isArray()) {
                for (JsonNode element : value) {
                    if (element.isObject() && element.hasNonNull("type")) {
                        children.add(new AstNode(element));
                    }
                }
            }
        }
        return children;
    }

    public String position() {
        return getLine() + ":" + getColumn();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode other)) return false;
        return json == other.json;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(json));
    }

    @Override
    public String toString() {
        return getType() + "@" + position();
    }

    private static String abbreviate(JsonNode json) {
        String text = String.valueOf(json);
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
