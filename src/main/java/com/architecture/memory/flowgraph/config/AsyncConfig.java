package com.architecture.memory.flowgraph.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // Units of different files run in parallel; each task owns its scope tables and buffer
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(AnalyzerSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWorkerThreads());
        executor.setMaxPoolSize(settings.getWorkerThreads());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("flowgraph-");
        executor.initialize();
        return executor;
    }
}
