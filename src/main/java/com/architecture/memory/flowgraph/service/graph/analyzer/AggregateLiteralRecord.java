package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An object or array literal. Its entries are structural children; the aggregate itself is terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateLiteralRecord {
    private String id;
    private NodeKind kind;
    private int line;
    private int column;

    @Builder.Default
    private List<Entry> entries = new ArrayList<>();

    // True when every entry, recursively, is a literal value
    private boolean literalOnly;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Entry {
        // Property key, element index, or "..." for spread
        private String key;
        private ValueSource value;
    }
}
