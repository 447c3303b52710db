package com.architecture.memory.flowgraph.service.validation;

import com.architecture.memory.flowgraph.model.graph.GraphNode;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one lineage traversal: the leaf that was reached, or why none was.
 */
@Value
public class LeafSearchResult {

    public enum Reason {
        CYCLE,
        DEAD_END,
        DANGLING_EDGE,
        DEPTH_LIMIT,
        NON_DATA_NODE
    }

    boolean found;
    GraphNode leaf;
    List<String> chain;
    Reason reason;

    public static LeafSearchResult found(GraphNode leaf, List<String> chain) {
        return new LeafSearchResult(true, leaf, List.copyOf(chain), null);
    }

    public static LeafSearchResult notFound(Reason reason, List<String> chain) {
        return new LeafSearchResult(false, null, List.copyOf(chain), reason);
    }

    public String chainText() {
        return String.join(" -> ", chain);
    }
}
