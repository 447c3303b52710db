package com.architecture.memory.flowgraph.dto;

import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A diagnostic produced by validation or the integrity check, written back as an Issue node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataFlowIssue {

    public static final String ERR_NO_LEAF_NODE = "ERR_NO_LEAF_NODE";
    public static final String ERR_MISSING_ASSIGNMENT = "ERR_MISSING_ASSIGNMENT";
    public static final String ERR_VALIDATION_FAILED = "ERR_VALIDATION_FAILED";
    public static final String ERR_BROKEN_REFERENCE = "ERR_BROKEN_REFERENCE";

    private String code;
    private IssueSeverity severity;
    private String message;

    // Offending node and its source position
    private String nodeId;
    private String file;
    private int line;
    private int column;

    // CYCLE, DEAD_END, DANGLING_EDGE, DEPTH_LIMIT, NON_DATA_NODE for ERR_NO_LEAF_NODE
    private String reason;

    // Node ids walked before the chain broke
    @Builder.Default
    private List<String> chain = new ArrayList<>();

    public GraphNode toNode(CanonicalIdGenerator idGenerator) {
        GraphNode node = GraphNode.builder()
                .id(idGenerator.generateIssueId(code, nodeId))
                .kind(NodeKind.ISSUE)
                .name(code)
                .file(file)
                .line(line)
                .column(column)
                .build();
        node.withAttribute("code", code);
        node.withAttribute("severity", severity.name().toLowerCase());
        node.withAttribute("message", message);
        node.withAttribute("targetNode", nodeId);
        if (reason != null) {
            node.withAttribute("reason", reason);
        }
        node.withAttribute("chain", List.copyOf(chain));
        return node;
    }
}
