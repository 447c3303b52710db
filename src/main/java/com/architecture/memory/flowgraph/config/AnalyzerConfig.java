package com.architecture.memory.flowgraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Reads analyzer tuning from application.yml.
 */
@Configuration
@Slf4j
public class AnalyzerConfig {

    @Value("${flowgraph.analysis.worker-threads:4}")
    private int workerThreads;

    @Value("${flowgraph.validation.max-depth:256}")
    private int maxDepth;

    @Value("${flowgraph.validation.parallel:false}")
    private boolean parallelValidation;

    @Value("${flowgraph.validation.parameters-as-leaves:true}")
    private boolean parametersAsLeaves;

    @Bean
    public AnalyzerSettings analyzerSettings() {
        log.info("[config] workerThreads={}, maxDepth={}, parallelValidation={}, parametersAsLeaves={}",
                workerThreads, maxDepth, parallelValidation, parametersAsLeaves);
        return AnalyzerSettings.builder()
                .workerThreads(Math.max(1, workerThreads))
                .validationMaxDepth(Math.max(1, maxDepth))
                .parallelValidation(parallelValidation)
                .parametersAsLeaves(parametersAsLeaves)
                .build();
    }
}
