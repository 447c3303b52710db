package com.architecture.memory.flowgraph.service.validation;

import com.architecture.memory.flowgraph.config.AnalyzerSettings;
import com.architecture.memory.flowgraph.dto.DataFlowIssue;
import com.architecture.memory.flowgraph.dto.IssueSeverity;
import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphEdge;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import com.architecture.memory.flowgraph.service.graph.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Proves that every variable's value traces back to a terminal node.
 *
 * Runs over the committed graph and only reads it, except for writing the resulting Issue
 * nodes back at the end. Each traversal owns its visited set and chain, so starting nodes
 * can be validated in parallel. A traversal that fails is reported and never stops the others.
 */
@Service
@Slf4j
public class DataFlowValidator {

    // Values that need no further tracing
    static final Set<NodeKind> LEAF_KINDS = EnumSet.of(
            NodeKind.LITERAL,
            NodeKind.OBJECT_LITERAL,
            NodeKind.ARRAY_LITERAL,
            NodeKind.CALL,
            NodeKind.METHOD_CALL,
            NodeKind.CONSTRUCTOR_CALL,
            NodeKind.FUNCTION,
            NodeKind.CLASS,
            NodeKind.IMPORT
    );

    private static final Set<EdgeType> DERIVES = EnumSet.of(EdgeType.DERIVES_FROM);
    private static final Set<EdgeType> USES = EnumSet.of(EdgeType.USES);

    private final AnalyzerSettings settings;
    private final CanonicalIdGenerator idGenerator;
    private final Executor executor;

    public DataFlowValidator(AnalyzerSettings settings,
                             CanonicalIdGenerator idGenerator,
                             @Qualifier("analysisExecutor") Executor executor) {
        this.settings = settings;
        this.idGenerator = idGenerator;
        this.executor = executor;
    }

    public List<DataFlowIssue> validate(GraphStore graph) {
        return validate(graph, () -> false);
    }

    /**
     * Validates every Variable node. {@code cancelled} is checked before each traversal;
     * a traversal already running completes.
     */
    public List<DataFlowIssue> validate(GraphStore graph, BooleanSupplier cancelled) {
        List<GraphNode> starts = graph.queryNodes(NodeKind.VARIABLE);
        log.info("[validator] Validating {} variables (parallel={})", starts.size(), settings.isParallelValidation());

        List<DataFlowIssue> issues = new ArrayList<>();
        if (settings.isParallelValidation()) {
            List<CompletableFuture<Optional<DataFlowIssue>>> futures = new ArrayList<>();
            for (GraphNode start : starts) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> cancelled.getAsBoolean() ? Optional.<DataFlowIssue>empty() : validateStart(graph, start),
                        executor));
            }
            for (CompletableFuture<Optional<DataFlowIssue>> future : futures) {
                future.join().ifPresent(issues::add);
            }
        } else {
            for (GraphNode start : starts) {
                if (cancelled.getAsBoolean()) {
                    log.info("[validator] Cancelled after {} issues", issues.size());
                    break;
                }
                validateStart(graph, start).ifPresent(issues::add);
            }
        }

        for (DataFlowIssue issue : issues) {
            graph.bufferNode(issue.toNode(idGenerator));
        }
        graph.commit();

        log.info("[validator] Validation complete: {} issues ({} errors, {} warnings)", issues.size(),
                issues.stream().filter(i -> i.getSeverity() == IssueSeverity.ERROR).count(),
                issues.stream().filter(i -> i.getSeverity() == IssueSeverity.WARNING).count());
        return issues;
    }

    Optional<DataFlowIssue> validateStart(GraphStore graph, GraphNode start) {
        try {
            LeafSearchResult result = findLeaf(graph, start);
            if (result.isFound()) {
                log.debug("[validator] {} -> {}", start.describe(), result.getLeaf().describe());
                return Optional.empty();
            }
            return Optional.of(toIssue(start, result));
        } catch (RuntimeException e) {
            log.error("[validator] Traversal from {} failed", start.getId(), e);
            return Optional.of(DataFlowIssue.builder()
                    .code(DataFlowIssue.ERR_VALIDATION_FAILED)
                    .severity(IssueSeverity.ERROR)
                    .message("Validation of " + start.describe() + " failed: " + e.getMessage())
                    .nodeId(start.getId())
                    .file(start.getFile())
                    .line(start.getLine())
                    .column(start.getColumn())
                    .build());
        }
    }

    /**
     * Follows the first lineage edge from {@code start} until a leaf, a dead end, a
     * revisited node or the depth bound.
     */
    public LeafSearchResult findLeaf(GraphStore graph, GraphNode start) {
        Set<String> visited = new HashSet<>();
        List<String> chain = new ArrayList<>();
        GraphNode node = start;

        for (int depth = 0; ; depth++) {
            if (depth > settings.getValidationMaxDepth()) {
                return LeafSearchResult.notFound(LeafSearchResult.Reason.DEPTH_LIMIT, chain);
            }
            chain.add(node.getId());
            if (!visited.add(node.getId())) {
                return LeafSearchResult.notFound(LeafSearchResult.Reason.CYCLE, chain);
            }
            if (LEAF_KINDS.contains(node.getKind())) {
                return LeafSearchResult.found(node, chain);
            }

            List<GraphEdge> edges;
            if (node.getKind() == NodeKind.EXPRESSION) {
                edges = graph.getOutgoingEdges(node.getId(), DERIVES);
                if (edges.isEmpty()) {
                    // Every operand was a literal or could not be traced; coverage reports the latter
                    return LeafSearchResult.found(node, chain);
                }
            } else if (node.getKind().isBinding()) {
                if (isConsumedByCall(graph, node)) {
                    return LeafSearchResult.found(node, chain);
                }
                edges = graph.getOutgoingEdges(node.getId(), EdgeType.LINEAGE);
                if (edges.isEmpty()) {
                    if (node.getKind() == NodeKind.PARAMETER && settings.isParametersAsLeaves()) {
                        return LeafSearchResult.found(node, chain);
                    }
                    return LeafSearchResult.notFound(LeafSearchResult.Reason.DEAD_END, chain);
                }
            } else {
                return LeafSearchResult.notFound(LeafSearchResult.Reason.NON_DATA_NODE, chain);
            }

            String next = edges.get(0).getDst();
            Optional<GraphNode> nextNode = graph.getNode(next);
            if (nextNode.isEmpty()) {
                chain.add(next);
                return LeafSearchResult.notFound(LeafSearchResult.Reason.DANGLING_EDGE, chain);
            }
            node = nextNode.get();
        }
    }

    private boolean isConsumedByCall(GraphStore graph, GraphNode node) {
        for (GraphEdge edge : graph.getIncomingEdges(node.getId(), USES)) {
            Optional<GraphNode> user = graph.getNode(edge.getSrc());
            if (user.isPresent() && user.get().getKind().isCall()) {
                return true;
            }
        }
        return false;
    }

    private DataFlowIssue toIssue(GraphNode start, LeafSearchResult result) {
        boolean unassigned = result.getReason() == LeafSearchResult.Reason.DEAD_END && result.getChain().size() == 1;
        DataFlowIssue.DataFlowIssueBuilder issue = DataFlowIssue.builder()
                .nodeId(start.getId())
                .file(start.getFile())
                .line(start.getLine())
                .column(start.getColumn())
                .chain(new ArrayList<>(result.getChain()));
        if (unassigned) {
            return issue.code(DataFlowIssue.ERR_MISSING_ASSIGNMENT)
                    .severity(IssueSeverity.WARNING)
                    .message(String.format("%s is never assigned and never passed to a call", start.describe()))
                    .build();
        }
        log.debug("[validator] No leaf for {} ({}): {}", start.getId(), result.getReason(), result.chainText());
        return issue.code(DataFlowIssue.ERR_NO_LEAF_NODE)
                .severity(IssueSeverity.ERROR)
                .message(String.format("No leaf node reachable from %s (%s): %s",
                        start.describe(), result.getReason(), result.chainText()))
                .reason(result.getReason().name())
                .build();
    }
}
