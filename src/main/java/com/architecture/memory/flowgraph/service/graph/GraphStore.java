package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphEdge;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of the code property graph.
 *
 * Writes are buffered and become visible on {@link #commit()}; {@link #commitBatch(UnitGraph)}
 * applies one unit's nodes and edges atomically. Reads see committed data only.
 */
public interface GraphStore {

    void bufferNode(GraphNode node);

    void bufferEdge(GraphEdge edge);

    /**
     * Applies everything buffered since the last commit.
     */
    void commit();

    void commitBatch(UnitGraph batch);

    Optional<GraphNode> getNode(String id);

    /**
     * Outgoing edges of {@code id} in insertion order, restricted to {@code types}
     * (all types when empty).
     */
    List<GraphEdge> getOutgoingEdges(String id, Set<EdgeType> types);

    List<GraphEdge> getIncomingEdges(String id, Set<EdgeType> types);

    List<GraphNode> queryNodes(NodeKind kind);

    List<GraphEdge> getAllEdges();

    int nodeCount();

    int edgeCount();

    void clear();
}
