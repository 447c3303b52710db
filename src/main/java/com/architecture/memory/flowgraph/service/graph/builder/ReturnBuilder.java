package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import com.architecture.memory.flowgraph.service.graph.analyzer.ReturnInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Function -> returned value, with the same value materialization as assignments.
 */
@Component
@RequiredArgsConstructor
public class ReturnBuilder {

    private final CoreBuilder coreBuilder;

    public void build(ParsedUnit unit, BuildContext context) {
        for (ReturnInfo returned : unit.getReturns()) {
            coreBuilder.materialize(returned.getSource(), context)
                    .ifPresent(value -> context.addEdge(EdgeType.RETURNS, returned.getFunctionId(), value));
        }
    }
}
