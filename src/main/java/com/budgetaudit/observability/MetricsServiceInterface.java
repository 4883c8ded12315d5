package com.budgetaudit.observability;

/**
 * Interface for the audit metrics service to support both enabled and disabled modes.
 */
public interface MetricsServiceInterface {
    void recordProviderLatency(long durationMs, String tier, String model);
    void recordProviderFailure(String tier, String errorType);
    void recordFailover(String servedBy);
    void recordTokens(int tokens, String model, String task);
    void recordValidationFailures(int count, String task);
    void recordDetectorDegraded(String detector);
    void recordJobDuration(long durationMs);
    void recordJobSuccess();
    void recordJobFailure(String errorType);
}
