package com.budgetaudit.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed audit metrics.
 * Only active when budgetaudit.metrics.enabled=true.
 *
 * Metrics:
 * - budgetaudit.ai.latency_ms: Timer for provider call latency, by tier and model
 * - budgetaudit.ai.failures: Counter for failed provider calls, by tier and error type
 * - budgetaudit.ai.failover: Counter for requests served by a non-primary tier
 * - budgetaudit.ai.tokens: Counter for model token usage
 * - budgetaudit.ai.validation_failures: Counter for hits rejected by span validation
 * - budgetaudit.detector.degraded: Counter for detectors that failed inside a finished job
 * - budgetaudit.job.duration: Timer for job processing duration
 * - budgetaudit.job.success: Counter for jobs finished as done
 * - budgetaudit.job.failure: Counter for jobs finished as error
 */
@Service
@ConditionalOnProperty(name = "budgetaudit.metrics.enabled", havingValue = "true", matchIfMissing = false)
public class AuditMetricsService implements MetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(AuditMetricsService.class);
    private static final String SERVICE = "budget-audit";

    private final MeterRegistry meterRegistry;

    private Timer jobDurationTimer;
    private Counter jobSuccessCounter;

    @Autowired
    public AuditMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initializeMetrics() {
        jobDurationTimer = Timer.builder("budgetaudit.job.duration")
                .description("Job processing duration in milliseconds")
                .tag("service", SERVICE)
                .register(meterRegistry);

        jobSuccessCounter = Counter.builder("budgetaudit.job.success")
                .description("Number of jobs finished as done")
                .tag("service", SERVICE)
                .register(meterRegistry);

        logger.info("Audit metrics service initialized");
    }

    @Override
    public void recordProviderLatency(long durationMs, String tier, String model) {
        Timer.builder("budgetaudit.ai.latency_ms")
                .description("AI provider call latency in milliseconds")
                .tag("service", SERVICE)
                .tag("tier", tier != null ? tier : "unknown")
                .tag("model", model != null ? model : "unknown")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded provider latency: {}ms for tier={}, model={}", durationMs, tier, model);
    }

    @Override
    public void recordProviderFailure(String tier, String errorType) {
        Counter.builder("budgetaudit.ai.failures")
                .description("Failed AI provider calls")
                .tag("service", SERVICE)
                .tag("tier", tier != null ? tier : "unknown")
                .tag("error_type", errorType != null ? errorType : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordFailover(String servedBy) {
        Counter.builder("budgetaudit.ai.failover")
                .description("Requests served by a tier other than primary")
                .tag("service", SERVICE)
                .tag("served_by", servedBy != null ? servedBy : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordTokens(int tokens, String model, String task) {
        if (tokens <= 0) {
            return;
        }
        Counter.builder("budgetaudit.ai.tokens")
                .description("Model tokens used")
                .tag("service", SERVICE)
                .tag("model", model != null ? model : "unknown")
                .tag("task", task != null ? task : "unknown")
                .register(meterRegistry)
                .increment(tokens);
    }

    @Override
    public void recordValidationFailures(int count, String task) {
        if (count <= 0) {
            return;
        }
        Counter.builder("budgetaudit.ai.validation_failures")
                .description("Extraction hits rejected because a span did not match the source text")
                .tag("service", SERVICE)
                .tag("task", task != null ? task : "unknown")
                .register(meterRegistry)
                .increment(count);
        logger.debug("Recorded {} validation failures for task={}", count, task);
    }

    @Override
    public void recordDetectorDegraded(String detector) {
        Counter.builder("budgetaudit.detector.degraded")
                .description("Detectors that failed inside a job that still finished")
                .tag("service", SERVICE)
                .tag("detector", detector != null ? detector : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordJobDuration(long durationMs) {
        jobDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded job duration: {}ms", durationMs);
    }

    @Override
    public void recordJobSuccess() {
        jobSuccessCounter.increment();
    }

    @Override
    public void recordJobFailure(String errorType) {
        Counter.builder("budgetaudit.job.failure")
                .description("Jobs finished as error")
                .tag("service", SERVICE)
                .tag("error_type", errorType != null ? errorType : "unknown")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded job failure, errorType={}", errorType);
    }
}
