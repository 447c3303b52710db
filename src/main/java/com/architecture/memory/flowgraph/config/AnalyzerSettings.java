package com.architecture.memory.flowgraph.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable analyzer settings, bound from {@code flowgraph.*} properties.
 */
@Value
@Builder
public class AnalyzerSettings {

    @Builder.Default
    int workerThreads = 4;

    // Hard bound on one lineage traversal, independent of cycle detection
    @Builder.Default
    int validationMaxDepth = 256;

    @Builder.Default
    boolean parallelValidation = false;

    // Parameters receive their value from callers; inter-procedural flow is not traced
    @Builder.Default
    boolean parametersAsLeaves = true;

    public static AnalyzerSettings defaults() {
        return AnalyzerSettings.builder().build();
    }
}
