package com.budgetaudit.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools of the audit pipeline. Each level of blocking gets its own pool so that a job waiting
 * on its detectors, or a window waiting on a provider call, can never starve the work it waits for.
 */
@Configuration
public class WorkerConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConfig.class);

    @Value("${budgetaudit.jobs.max-concurrent:4}")
    private int maxConcurrentJobs;

    @Value("${budgetaudit.ai.window-threads:8}")
    private int windowThreads;

    @Value("${budgetaudit.ai.provider-call-threads:16}")
    private int providerCallThreads;

    @Value("${budgetaudit.ai.enabled:true}")
    private boolean aiEnabled;

    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor() {
        return Executors.newFixedThreadPool(maxConcurrentJobs, new CustomizableThreadFactory("audit-job-"));
    }

    @Bean(name = "detectorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService detectorExecutor() {
        return Executors.newFixedThreadPool(maxConcurrentJobs * 2, new CustomizableThreadFactory("audit-detector-"));
    }

    @Bean(name = "windowExecutor", destroyMethod = "shutdownNow")
    public ExecutorService windowExecutor() {
        return Executors.newFixedThreadPool(windowThreads, new CustomizableThreadFactory("audit-window-"));
    }

    @Bean(name = "providerCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newFixedThreadPool(providerCallThreads, new CustomizableThreadFactory("audit-provider-"));
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Audit workers: jobs={}, detectors={}, windows={}, providerCalls={}, aiEnabled={}",
                maxConcurrentJobs, maxConcurrentJobs * 2, windowThreads, providerCallThreads, aiEnabled);
    }
}
