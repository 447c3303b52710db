package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A name bound by a declaration target, with the value it receives.
 * {@code source} is null when nothing is assigned ({@code let x;}, a parameter without default).
 */
@Data
@AllArgsConstructor
public class PatternBinding {
    private AstNode identifier;
    private ValueSource source;

    public String getName() {
        return identifier.getName();
    }
}
