package com.architecture.memory.flowgraph.model.graph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Directed edge types. Data-flow edges point from the consumer to the value it came from.
 */
public enum EdgeType {
    ASSIGNED_FROM,
    DERIVES_FROM,
    USES,
    RETURNS,
    CONTAINS,
    HAS_CONDITION,
    HAS_CONSEQUENT,
    HAS_ALTERNATE,
    HAS_CATCH,
    HAS_FINALLY,
    ITERATES_OVER,
    HAS_PROPERTY,
    HAS_ELEMENT;

    public static final Set<EdgeType> LINEAGE = EnumSet.of(ASSIGNED_FROM, DERIVES_FROM);

    public boolean isLineage() {
        return LINEAGE.contains(this);
    }
}
