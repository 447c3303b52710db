package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.graph.EdgeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A control-flow construct. Condition and arm records are only present when the
 * corresponding expression produces an Expression node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchInfo {

    public static final String IF = "if";
    public static final String TERNARY = "ternary";
    public static final String SWITCH = "switch";
    public static final String LOOP = "loop";
    public static final String TRY = "try";
    public static final String CATCH = "catch";
    public static final String FINALLY = "finally";

    private String id;
    private String branchKind;

    // for, for-in, for-of, while, do-while
    private String loopKind;

    private int line;
    private int column;
    private String containerId;
    private String scopeId;

    // test of if/ternary/loop, discriminant of switch
    private ExpressionRecord condition;

    // ternary arms
    private ExpressionRecord consequent;
    private ExpressionRecord alternate;

    // for-in/for-of right-hand side
    private ValueSource iterable;

    // catch/finally blocks hang off their try branch
    private String parentBranchId;
    private EdgeType parentEdgeType;

    private int caseCount;
}
