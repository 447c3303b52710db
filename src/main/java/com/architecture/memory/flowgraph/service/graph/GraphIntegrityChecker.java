package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.dto.IssueSeverity;
import com.architecture.memory.flowgraph.model.graph.GraphEdge;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds edges whose source or destination node does not exist. These are build defects,
 * reported separately from data-flow validation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphIntegrityChecker {

    public List<DataFlowIssue> check(GraphStore store) {
        List<DataFlowIssue> issues = findBrokenReferences(store.getAllEdges(), store::getNode);
        log.info("[integrity] {} edges checked, {} broken references", store.edgeCount(), issues.size());
        return issues;
    }

    /**
     * Same check on a single unit batch before it is committed.
     */
    public List<DataFlowIssue> check(UnitGraph unit) {
        Map<String, GraphNode> nodes = unit.getNodes().stream()
                .collect(Collectors.toMap(GraphNode::getId, Function.identity(), (a, b) -> a));
        return findBrokenReferences(unit.getEdges(), id -> Optional.ofNullable(nodes.get(id)));
    }

    private List<DataFlowIssue> findBrokenReferences(List<GraphEdge> edges, Function<String, Optional<GraphNode>> lookup) {
        List<DataFlowIssue> issues = new ArrayList<>();
        for (GraphEdge edge : edges) {
            Optional<GraphNode> src = lookup.apply(edge.getSrc());
            Optional<GraphNode> dst = lookup.apply(edge.getDst());
            if (src.isPresent() && dst.isPresent()) {
                continue;
            }
            String missing = src.isEmpty() ? edge.getSrc() : edge.getDst();
            Optional<GraphNode> anchor = src.isPresent() ? src : dst;
            log.warn("[integrity] Broken reference {}: missing {}", edge.canonicalId(), missing);
            issues.add(DataFlowIssue.builder()
                    .code(DataFlowIssue.ERR_BROKEN_REFERENCE)
                    .severity(IssueSeverity.ERROR)
                    .message(String.format("Edge %s references missing node %s", edge.canonicalId(), missing))
                    .nodeId(anchor.map(GraphNode::getId).orElse(missing))
                    .file(anchor.map(GraphNode::getFile).orElse(null))
                    .line(anchor.map(GraphNode::getLine).orElse(0))
                    .column(anchor.map(GraphNode::getColumn).orElse(0))
                    .reason(src.isEmpty() ? "MISSING_SOURCE" : "MISSING_DESTINATION")
                    .chain(new ArrayList<>(List.of(edge.getSrc(), edge.getDst())))
                    .build());
        }
        return issues;
    }
}
