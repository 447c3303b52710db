package com.architecture.memory.flowgraph.dto;

public enum IssueSeverity {
    ERROR,
    WARNING,
    INFO
}
