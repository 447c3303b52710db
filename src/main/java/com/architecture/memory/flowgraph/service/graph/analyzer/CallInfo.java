package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A call site. Identifier arguments and an identifier receiver become Uses edges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallInfo {
    private String id;
    private NodeKind kind;
    private String name;
    private int line;
    private int column;
    private String containerId;
    private String scopeId;

    // e.g. "console" for console.log(x)
    private String receiverName;

    @Builder.Default
    private List<String> argumentNames = new ArrayList<>();

    private int argumentCount;
}
