package com.architecture.memory.flowgraph.service.graph.builder;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.GraphNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.analyzer.AggregateLiteralRecord;
import com.architecture.memory.flowgraph.service.graph.analyzer.CallInfo;
import com.architecture.memory.flowgraph.service.graph.analyzer.ExpressionRecord;
import com.architecture.memory.flowgraph.service.graph.analyzer.LiteralRecord;
import com.architecture.memory.flowgraph.service.graph.analyzer.OperandSlot;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedDeclaration;
import com.architecture.memory.flowgraph.service.graph.analyzer.ParsedUnit;
import com.architecture.memory.flowgraph.service.graph.analyzer.ValueSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Creates the structural part of a unit graph (module, declarations, calls, containment)
 * and materializes value sources: literals, aggregate literals and Expression nodes.
 *
 * The other builders call {@link #materialize} to obtain the node a value flows from.
 */
@Component
@Slf4j
public class CoreBuilder {

    public void buildStructure(ParsedUnit unit, BuildContext context) {
        context.addNode(GraphNode.builder()
                .id(unit.getModuleId())
                .kind(NodeKind.MODULE)
                .name(unit.getFile())
                .file(unit.getFile())
                .line(1)
                .column(0)
                .build());

        for (ParsedDeclaration declaration : unit.getDeclarations()) {
            boolean added = context.addNode(GraphNode.builder()
                    .id(declaration.getId())
                    .kind(declaration.getKind())
                    .name(declaration.getName())
                    .file(unit.getFile())
                    .line(declaration.getLine())
                    .column(declaration.getColumn())
                    .attributes(new LinkedHashMap<>(declaration.getAttributes()))
                    .build());
            if (!added) {
                log.warn("[builder] Duplicate declaration id {} in {}", declaration.getId(), unit.getFile());
            }
            context.addEdge(EdgeType.CONTAINS, declaration.getContainerId(), declaration.getId());
        }

        for (CallInfo call : unit.getCalls()) {
            buildCall(call, context);
        }
    }

    private void buildCall(CallInfo call, BuildContext context) {
        GraphNode node = GraphNode.builder()
                .id(call.getId())
                .kind(call.getKind())
                .name(call.getName())
                .file(context.getFile())
                .line(call.getLine())
                .column(call.getColumn())
                .build();
        node.withAttribute("argumentCount", call.getArgumentCount());
        if (call.getReceiverName() != null) {
            node.withAttribute("receiver", call.getReceiverName());
        }
        context.addNode(node);
        context.addEdge(EdgeType.CONTAINS, call.getContainerId(), call.getId());

        for (String argument : call.getArgumentNames()) {
            context.resolve(call.getScopeId(), argument)
                    .ifPresent(target -> context.addEdge(EdgeType.USES, call.getId(), target));
        }
        if (call.getReceiverName() != null) {
            context.resolve(call.getScopeId(), call.getReceiverName())
                    .ifPresent(target -> context.addEdge(EdgeType.USES, call.getId(), target));
        }
    }

    /**
     * The id of the node {@code source} denotes, buffering literal, aggregate and expression
     * nodes on the way. Empty for unresolved identifiers and unsupported expressions.
     */
    public Optional<String> materialize(ValueSource source, BuildContext context) {
        if (source == null) {
            return Optional.empty();
        }
        switch (source.getKind()) {
            case IDENTIFIER:
                return context.resolve(source.getScopeId(), source.getIdentifierName());
            case LITERAL:
                return Optional.of(bufferLiteral(source.getLiteral(), context));
            case AGGREGATE:
                return Optional.of(bufferAggregate(source.getAggregate(), context));
            case EXPRESSION:
                return Optional.of(bufferExpression(source.getExpression(), context));
            case REFERENCE:
                if (!context.hasNode(source.getReferenceId())) {
                    log.warn("[builder] {} {} referenced but never created, edge omitted",
                            source.getReferenceKind(), source.getReferenceId());
                    return Optional.empty();
                }
                return Optional.of(source.getReferenceId());
            default:
                return Optional.empty();
        }
    }

    public String bufferLiteral(LiteralRecord literal, BuildContext context) {
        GraphNode node = GraphNode.builder()
                .id(literal.getId())
                .kind(NodeKind.LITERAL)
                .name(String.valueOf(literal.getValue()))
                .file(context.getFile())
                .line(literal.getLine())
                .column(literal.getColumn())
                .build();
        node.withAttribute("value", literal.getValue());
        node.withAttribute("valueType", literal.getValueType());
        context.addNode(node);
        return literal.getId();
    }

    /**
     * Buffers an Expression node and one DerivesFrom edge per operand slot that resolves to a node.
     * Nested expressions in slots are buffered first, recursively.
     */
    public String bufferExpression(ExpressionRecord expression, BuildContext context) {
        if (context.hasNode(expression.getId())) {
            return expression.getId();
        }
        GraphNode node = GraphNode.builder()
                .id(expression.getId())
                .kind(NodeKind.EXPRESSION)
                .name(expression.getKind().getAstType())
                .file(context.getFile())
                .line(expression.getLine())
                .column(expression.getColumn())
                .build();
        node.withAttribute("expressionType", expression.getKind().getAstType());
        if (expression.getOperator() != null) {
            node.withAttribute("operator", expression.getOperator());
        }
        node.getAttributes().putAll(expression.getAttributes());
        context.addNode(node);

        for (OperandSlot slot : expression.getOperandSlots()) {
            Optional<String> target = materialize(slot.getSource(), context);
            if (target.isPresent()) {
                context.addEdge(EdgeType.DERIVES_FROM, expression.getId(), target.get());
            } else {
                log.debug("[builder] {} slot {} has no node ({})", expression.getId(), slot.getName(),
                        slot.getSource().describe());
            }
        }
        return expression.getId();
    }

    /**
     * Aggregates are terminal: entries hang off them structurally, never as lineage.
     */
    public String bufferAggregate(AggregateLiteralRecord aggregate, BuildContext context) {
        if (context.hasNode(aggregate.getId())) {
            return aggregate.getId();
        }
        GraphNode node = GraphNode.builder()
                .id(aggregate.getId())
                .kind(aggregate.getKind())
                .name(aggregate.getKind() == NodeKind.OBJECT_LITERAL ? "{}" : "[]")
                .file(context.getFile())
                .line(aggregate.getLine())
                .column(aggregate.getColumn())
                .build();
        node.withAttribute("literalOnly", aggregate.isLiteralOnly());
        node.withAttribute("size", aggregate.getEntries().size());
        context.addNode(node);

        EdgeType entryEdge = aggregate.getKind() == NodeKind.OBJECT_LITERAL ? EdgeType.HAS_PROPERTY : EdgeType.HAS_ELEMENT;
        for (AggregateLiteralRecord.Entry entry : aggregate.getEntries()) {
            materialize(entry.getValue(), context)
                    .ifPresent(target -> context.addEdge(entryEdge, aggregate.getId(), target));
        }
        return aggregate.getId();
    }
}
