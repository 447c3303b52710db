package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.service.graph.analyzer.AssignmentInfo;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Emits the AssignedFrom (or DerivesFrom, for loop variables) edge of each assignment,
 * from the bound node to the node its value comes from.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AssignmentBuilder {

    private final CoreBuilder coreBuilder;

    public void build(ParsedUnit unit, BuildContext context) {
        for (AssignmentInfo assignment : unit.getAssignments()) {
            buildAssignment(assignment, context);
        }
    }

    void buildAssignment(AssignmentInfo assignment, BuildContext context) {
        Optional<String> target = assignment.isReassignment()
                ? context.resolve(assignment.getScopeId(), assignment.getTargetName())
                : Optional.of(assignment.getTargetId());
        if (target.isEmpty()) {
            log.debug("[builder] Assignment to undeclared {} at {}:{} skipped",
                    assignment.getTargetName(), assignment.getLine(), assignment.getColumn());
            return;
        }
        Optional<String> source = coreBuilder.materialize(assignment.getSource(), context);
        if (source.isEmpty()) {
            log.debug("[builder] No source node for {} ({})", assignment.getTargetName(), assignment.getSource().describe());
            return;
        }
        context.addEdge(assignment.getEdgeType(), target.get(), source.get());
    }
}
