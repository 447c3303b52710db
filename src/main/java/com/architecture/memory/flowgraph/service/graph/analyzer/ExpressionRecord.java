package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A compound expression that becomes an Expression node, with its operands already classified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpressionRecord {
    private String id;
    private ExpressionKind kind;
    private int line;
    private int column;

    // Binary/logical/unary/update operator, null otherwise
    private String operator;

    // object, property, computed, optional, path, prefix...
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @Builder.Default
    private List<OperandSlot> operandSlots = new ArrayList<>();

    public OperandSlot slot(String name) {
        return operandSlots.stream().filter(s -> s.getName().equals(name)).findFirst().orElse(null);
    }
}
