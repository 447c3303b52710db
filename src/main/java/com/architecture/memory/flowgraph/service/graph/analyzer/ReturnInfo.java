package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A returned value, owned by the enclosing function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReturnInfo {
    private String functionId;
    private ValueSource source;
    private int line;
    private int column;
}
