package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.analyzer.BranchInfo;
import com.architecture.memory.flowgraph.service.graph.analyzer.ExpressionRecord;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Branch nodes and their condition, arm, iterable and catch/finally edges.
 *
 * Condition and arm edges point at Expression nodes this builder buffers itself from the
 * branch record, so an arm edge never targets a node that does not exist.
 */
@Component
@RequiredArgsConstructor
public class ControlFlowBuilder {

    private final CoreBuilder coreBuilder;

    public void build(ParsedUnit unit, BuildContext context) {
        for (BranchInfo branch : unit.getBranches()) {
            buildBranch(branch, context);
        }
    }

    void buildBranch(BranchInfo branch, BuildContext context) {
        GraphNode node = GraphNode.builder()
                .id(branch.getId())
                .kind(NodeKind.BRANCH)
                .name(branch.getBranchKind())
                .file(context.getFile())
                .line(branch.getLine())
                .column(branch.getColumn())
                .build();
        node.withAttribute("branchKind", branch.getBranchKind());
        if (branch.getLoopKind() != null) {
            node.withAttribute("loopKind", branch.getLoopKind());
        }
        if (BranchInfo.SWITCH.equals(branch.getBranchKind())) {
            node.withAttribute("caseCount", branch.getCaseCount());
        }
        context.addNode(node);
        context.addEdge(EdgeType.CONTAINS, branch.getContainerId(), branch.getId());

        link(branch.getId(), EdgeType.HAS_CONDITION, branch.getCondition(), context);
        link(branch.getId(), EdgeType.HAS_CONSEQUENT, branch.getConsequent(), context);
        link(branch.getId(), EdgeType.HAS_ALTERNATE, branch.getAlternate(), context);

        if (branch.getIterable() != null) {
            coreBuilder.materialize(branch.getIterable(), context)
                    .ifPresent(iterable -> context.addEdge(EdgeType.ITERATES_OVER, branch.getId(), iterable));
        }
        if (branch.getParentBranchId() != null) {
            context.addEdge(branch.getParentEdgeType(), branch.getParentBranchId(), branch.getId());
        }
    }

    private void link(String branchId, EdgeType type, ExpressionRecord expression, BuildContext context) {
        if (expression == null) {
            return;
        }
        context.addEdge(type, branchId, coreBuilder.bufferExpression(expression, context));
    }
}
