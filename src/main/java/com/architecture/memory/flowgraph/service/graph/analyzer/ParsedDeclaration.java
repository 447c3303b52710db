package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared entity: variable, parameter, function, class or import binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedDeclaration {
    private String id;
    private NodeKind kind;
    private String name;
    private int line;
    private int column;

    // Module, function or class that contains the declaration
    private String containerId;

    // declarationKind (const/let/var), async, generator, source, imported...
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();
}
