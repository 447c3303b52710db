package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphEdge;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import com.architecture.memory.flowgraph.service.graph.analyzer.ScopeContext;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Unit-local buffer of nodes and edges. Nodes are keyed by id and edges by canonical id,
 * so building the same record twice buffers it once.
 */
public class BuildContext {

    @Getter
    private final ScopeContext scope;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();

    public BuildContext(ScopeContext scope) {
        this.scope = scope;
    }

    public String getFile() {
        return scope.getFile();
    }

    /**
     * Buffers {@code node} unless a node with the same id is already buffered.
     * Returns true when the node is new.
     */
    public boolean addNode(GraphNode node) {
        return nodes.putIfAbsent(node.getId(), node) == null;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public void addEdge(EdgeType type, String src, String dst) {
        GraphEdge edge = GraphEdge.of(type, src, dst);
        edges.putIfAbsent(edge.canonicalId(), edge);
    }

    /**
     * Resolves a name through the unit's scope chain. A miss is a build-time gap: it is
     * counted and no edge should be emitted for it.
     */
    public Optional<String> resolve(String scopeId, String name) {
        Optional<String> id = scope.resolve(scopeId, name);
        if (id.isEmpty()) {
            scope.getCoverage().recordUnresolved(name);
        }
        return id;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public UnitGraph toUnitGraph() {
        return UnitGraph.builder()
                .file(getFile())
                .nodes(new ArrayList<>(nodes.values()))
                .edges(new ArrayList<>(edges.values()))
                .unhandledTypes(new TreeMap<>(scope.getCoverage().getUnhandledTypes()))
                .unresolvedIdentifiers(new TreeMap<>(scope.getCoverage().getUnresolvedIdentifiers()))
                .build();
    }
}
