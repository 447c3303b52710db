package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.model.graph.UnitGraph;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts a {@link ParsedUnit} into the buffered node and edge batch of one unit.
 *
 * Order matters: declarations and calls are buffered before any value is materialized,
 * so references to functions, classes and calls find their nodes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UnitGraphBuilder {

    private final CoreBuilder coreBuilder;
    private final AssignmentBuilder assignmentBuilder;
    private final ReturnBuilder returnBuilder;
    private final ControlFlowBuilder controlFlowBuilder;

    public UnitGraph build(ParsedUnit unit) {
        BuildContext context = new BuildContext(unit.getScope());

        coreBuilder.buildStructure(unit, context);
        assignmentBuilder.build(unit, context);
        returnBuilder.build(unit, context);
        controlFlowBuilder.build(unit, context);

        log.debug("[builder] {}: {} nodes, {} edges", unit.getFile(), context.nodeCount(), context.edgeCount());
        return context.toUnitGraph();
    }
}
