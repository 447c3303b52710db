package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Intermediate representation of one analysed unit (one file's program).
 * Records are resolved against {@link #scope} and turned into graph mutations by the builders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedUnit {
    private String file;
    private String moduleId;

    @Builder.Default
    private List<ParsedDeclaration> declarations = new ArrayList<>();

    @Builder.Default
    private List<CallInfo> calls = new ArrayList<>();

    @Builder.Default
    private List<AssignmentInfo> assignments = new ArrayList<>();

    @Builder.Default
    private List<ReturnInfo> returns = new ArrayList<>();

    @Builder.Default
    private List<BranchInfo> branches = new ArrayList<>();

    private ScopeContext scope;
}
