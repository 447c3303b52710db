package com.architecture.memory.flowgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of a whole-project run: build counts, failed units, integrity and validation issues,
 * and the aggregated extractor coverage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectAnalysisReport {

    private int unitsAnalyzed;
    private int nodeCount;
    private int edgeCount;

    @Builder.Default
    private List<UnitFailure> failures = new ArrayList<>();

    @Builder.Default
    private List<DataFlowIssue> integrityIssues = new ArrayList<>();

    @Builder.Default
    private List<DataFlowIssue> validationIssues = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> unhandledTypes = new TreeMap<>();

    @Builder.Default
    private Map<String, Integer> unresolvedIdentifiers = new TreeMap<>();

    private boolean cancelled;

    public List<DataFlowIssue> allIssues() {
        List<DataFlowIssue> all = new ArrayList<>(integrityIssues);
        all.addAll(validationIssues);
        return all;
    }

    public long countByCode(String code) {
        return allIssues().stream().filter(i -> code.equals(i.getCode())).count();
    }
}
