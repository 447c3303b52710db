package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphEdge;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory {@link GraphStore}.
 *
 * A node committed again under the same id replaces the previous one. An edge with the
 * same type, source and destination as a stored edge is ignored.
 */
@Component
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> incoming = new LinkedHashMap<>();
    private final Set<String> edgeIds = new HashSet<>();
    private final List<GraphEdge> edges = new ArrayList<>();

    private final List<GraphNode> pendingNodes = new ArrayList<>();
    private final List<GraphEdge> pendingEdges = new ArrayList<>();

    @Override
    public void bufferNode(GraphNode node) {
        synchronized (pendingNodes) {
            pendingNodes.add(node);
        }
    }

    @Override
    public void bufferEdge(GraphEdge edge) {
        synchronized (pendingEdges) {
            pendingEdges.add(edge);
        }
    }

    @Override
    public void commit() {
        List<GraphNode> nodeBatch;
        List<GraphEdge> edgeBatch;
        synchronized (pendingNodes) {
            nodeBatch = new ArrayList<>(pendingNodes);
            pendingNodes.clear();
        }
        synchronized (pendingEdges) {
            edgeBatch = new ArrayList<>(pendingEdges);
            pendingEdges.clear();
        }
        apply(nodeBatch, edgeBatch);
    }

    @Override
    public void commitBatch(UnitGraph batch) {
        apply(batch.getNodes(), batch.getEdges());
        log.debug("[store] Committed {}: {} nodes, {} edges", batch.getFile(), batch.getNodes().size(), batch.getEdges().size());
    }

    private void apply(Collection<GraphNode> nodeBatch, Collection<GraphEdge> edgeBatch) {
        lock.writeLock().lock();
        try {
            for (GraphNode node : nodeBatch) {
                nodes.put(node.getId(), node);
            }
            for (GraphEdge edge : edgeBatch) {
                if (edgeIds.add(edge.canonicalId())) {
                    edges.add(edge);
                    outgoing.computeIfAbsent(edge.getSrc(), k -> new ArrayList<>()).add(edge);
                    incoming.computeIfAbsent(edge.getDst(), k -> new ArrayList<>()).add(edge);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEdge> getOutgoingEdges(String id, Set<EdgeType> types) {
        return filtered(outgoing, id, types);
    }

    @Override
    public List<GraphEdge> getIncomingEdges(String id, Set<EdgeType> types) {
        return filtered(incoming, id, types);
    }

    private List<GraphEdge> filtered(Map<String, List<GraphEdge>> index, String id, Set<EdgeType> types) {
        lock.readLock().lock();
        try {
            List<GraphEdge> all = index.getOrDefault(id, List.of());
            if (types == null || types.isEmpty()) {
                return new ArrayList<>(all);
            }
            return all.stream().filter(e -> types.contains(e.getType())).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphNode> queryNodes(NodeKind kind) {
        lock.readLock().lock();
        try {
            return nodes.values().stream().filter(n -> n.getKind() == kind).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEdge> getAllEdges() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(edges);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int nodeCount() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int edgeCount() {
        lock.readLock().lock();
        try {
            return edges.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            nodes.clear();
            outgoing.clear();
            incoming.clear();
            edgeIds.clear();
            edges.clear();
        } finally {
            lock.writeLock().unlock();
        }
        synchronized (pendingNodes) {
            pendingNodes.clear();
        }
        synchronized (pendingEdges) {
            pendingEdges.clear();
        }
    }
}
