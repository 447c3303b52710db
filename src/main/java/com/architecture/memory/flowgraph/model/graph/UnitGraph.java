package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The buffered output of one analysis unit, submitted to storage as a single batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitGraph {
    private String file;

    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();

    // Extractor coverage of the unit: AST type -> count, identifier name -> count
    @Builder.Default
    private Map<String, Integer> unhandledTypes = new TreeMap<>();

    @Builder.Default
    private Map<String, Integer> unresolvedIdentifiers = new TreeMap<>();

    public Set<String> nodeIds() {
        return nodes.stream().map(GraphNode::getId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> edgeIds() {
        return edges.stream().map(GraphEdge::canonicalId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.getKind() == kind).toList();
    }

    public List<GraphEdge> edgesOfType(EdgeType type) {
        return edges.stream().filter(e -> e.getType() == type).toList();
    }
}
