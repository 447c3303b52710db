package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node in the code property graph. The id is derived from source coordinates or a
 * stable semantic name, never from counters or UUIDs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private NodeKind kind;
    private String name;
    private String file;
    private int line;
    private int column;

    // Kind specific: operator, value, valueType, expressionType, branchKind, severity...
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public String getStringAttribute(String key) {
        Object value = attributes.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public GraphNode withAttribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public String describe() {
        String label = name != null ? name : kind.name();
        return String.format("%s(%s) at %s:%d:%d", kind, label, file, line, column);
    }
}
