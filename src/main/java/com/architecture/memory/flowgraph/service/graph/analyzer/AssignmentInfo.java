package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One value flowing into one binding: a declaration initializer, a destructured name,
 * a parameter default, a reassignment or a for-of loop variable.
 *
 * {@code targetId} is set when the target was declared by the same statement. Reassignments
 * only know {@code targetName} and are resolved against {@code scopeId} by the builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentInfo {
    private String targetId;
    private String targetName;
    private String scopeId;

    // ASSIGNED_FROM, or DERIVES_FROM for loop variables
    @Builder.Default
    private EdgeType edgeType = EdgeType.ASSIGNED_FROM;

    private ValueSource source;
    private int line;
    private int column;

    public ValueSource.Kind getSourceKind() {
        return source.getKind();
    }

    public ExpressionRecord getExpression() {
        return source.getExpression();
    }

    public boolean isReassignment() {
        return targetId == null;
    }
}
