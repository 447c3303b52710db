package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A literal value at its own source position, materialized as an inline Literal node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiteralRecord {
    private String id;
    private int line;
    private int column;

    // LITERAL_NULL and LITERAL_VALUE only, never NOT_LITERAL
    private LiteralExtraction extraction;

    public Object getValue() {
        return extraction.getValue();
    }

    public String getValueType() {
        return extraction.getValueType();
    }
}
