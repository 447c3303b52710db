package com.architecture.memory.flowgraph.model.graph;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GraphEdge {
    EdgeType type;
    String src;
    String dst;

    public static GraphEdge of(EdgeType type, String src, String dst) {
        return new GraphEdge(type, src, dst);
    }

    /**
     * Format: {edgeType}:{src}->{dst}
     */
    public String canonicalId() {
        return String.format("%s:%s->%s", type.name().toLowerCase(), src, dst);
    }
}
