package com.budgetaudit.processing.ai;

import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.processing.CancellationToken;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered failover over the configured tiers (primary, backup, disasterPrimary, disasterBackup),
 * ending in the regex fallback.
 *
 * <p>Each attempt runs on the provider-call executor with its own timeout and is interrupted when it
 * times out or the job is cancelled. Network errors get one immediate re-attempt on the same tier;
 * any other failure moves on. A tier that fails {@code failureThreshold} times in a row is skipped
 * until {@link #resetStale(Duration)} puts it back in rotation.
 */
public class ProviderChain {

    private static final Logger logger = LoggerFactory.getLogger(ProviderChain.class);

    private final List<TierBinding> tiers;
    private final AiProvider fallback;
    private final ExecutorService callExecutor;
    private final Duration attemptTimeout;
    private final int failureThreshold;
    private final Clock clock;
    private final MetricsServiceInterface metricsService;
    private final ReentrantLock stateLock = new ReentrantLock();

    public ProviderChain(List<TierBinding> tiers, AiProvider fallback, ExecutorService callExecutor,
                         Duration attemptTimeout, int failureThreshold, Clock clock,
                         MetricsServiceInterface metricsService) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.tiers = new ArrayList<>(tiers);
        this.fallback = fallback;
        this.callExecutor = callExecutor;
        this.attemptTimeout = attemptTimeout;
        this.failureThreshold = failureThreshold;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Serves one request, walking the tiers in order.
     *
     * @throws CancellationException if the token is cancelled before a response is produced
     */
    public ChainResult extract(ExtractRequest request, CancellationToken token) {
        List<ProviderAttempt> attempts = new ArrayList<>();
        ProviderTier firstTier = tiers.isEmpty() ? ProviderTier.REGEX_FALLBACK : tiers.get(0).getTier();

        for (TierBinding binding : tiers) {
            token.throwIfCancelled();
            if (!isAlive(binding)) {
                logger.debug("Skipping dead tier {} ({})", binding.getTier().getKey(), binding.getProvider().getModelId());
                continue;
            }

            boolean reattempted = false;
            while (true) {
                long startedAt = clock.millis();
                try {
                    ExtractResponse response = invoke(binding.getProvider(), request, token);
                    long latencyMs = clock.millis() - startedAt;
                    recordSuccess(binding, latencyMs);
                    attempts.add(new ProviderAttempt(binding.getTier(), binding.getProvider().getModelId(), true, latencyMs, null));

                    boolean fellBack = binding.getTier() != firstTier;
                    if (fellBack) {
                        logger.warn("Task {} served by {} tier ({}) after failover",
                                request.getTask(), binding.getTier().getKey(), binding.getProvider().getModelId());
                        metricsService.recordFailover(binding.getTier().getKey());
                    }
                    return new ChainResult(response, binding.getTier(), binding.getProvider().getModelId(),
                            fellBack, latencyMs, attempts);
                } catch (ProviderException e) {
                    long latencyMs = clock.millis() - startedAt;
                    if (e.getErrorType() == ProviderErrorType.CANCELLED) {
                        throw cancellation(e);
                    }
                    attempts.add(new ProviderAttempt(binding.getTier(), binding.getProvider().getModelId(), false,
                            latencyMs, e.getErrorType()));
                    recordFailure(binding, e);
                    if (e.isTransient() && !reattempted && isAlive(binding)) {
                        reattempted = true;
                        logger.info("Transient error on {} tier, re-attempting once: {}", binding.getTier().getKey(), e.getMessage());
                        continue;
                    }
                    logger.warn("Tier {} ({}) failed with {}: {}", binding.getTier().getKey(),
                            binding.getProvider().getModelId(), e.getErrorType(), e.getMessage());
                    break;
                }
            }
        }

        token.throwIfCancelled();
        logger.error("All AI provider tiers failed for task {}, falling back to regex extraction", request.getTask());
        long startedAt = clock.millis();
        ExtractResponse response = fallback.extract(request);
        long latencyMs = clock.millis() - startedAt;
        attempts.add(new ProviderAttempt(ProviderTier.REGEX_FALLBACK, fallback.getModelId(), true, latencyMs, null));
        metricsService.recordFailover(ProviderTier.REGEX_FALLBACK.getKey());
        return new ChainResult(response, ProviderTier.REGEX_FALLBACK, fallback.getModelId(), true, latencyMs, attempts);
    }

    private ExtractResponse invoke(AiProvider provider, ExtractRequest request, CancellationToken token) {
        Future<ExtractResponse> future = callExecutor.submit(() -> provider.extract(request));
        token.register(future);
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(provider.getName() + " timed out after " + attemptTimeout.toMillis() + "ms",
                    ProviderErrorType.TIMEOUT, null, e);
        } catch (CancellationException e) {
            throw new ProviderException(provider.getName() + " call cancelled", ProviderErrorType.CANCELLED, null, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(provider.getName() + " call interrupted", ProviderErrorType.CANCELLED, null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException(provider.getName() + " failed: " + cause, ProviderErrorType.SERVER, null, cause);
        } finally {
            token.unregister(future);
        }
    }

    private static CancellationException cancellation(ProviderException cause) {
        CancellationException cancelled = new CancellationException("Extraction cancelled");
        cancelled.initCause(cause);
        return cancelled;
    }

    private boolean isAlive(TierBinding binding) {
        stateLock.lock();
        try {
            return binding.state.isAlive();
        } finally {
            stateLock.unlock();
        }
    }

    private void recordSuccess(TierBinding binding, long latencyMs) {
        stateLock.lock();
        try {
            binding.state.recordSuccess(latencyMs, clock.instant());
        } finally {
            stateLock.unlock();
        }
        metricsService.recordProviderLatency(latencyMs, binding.getTier().getKey(), binding.getProvider().getModelId());
    }

    private void recordFailure(TierBinding binding, ProviderException e) {
        boolean markedDead;
        stateLock.lock();
        try {
            markedDead = binding.state.recordFailure(e.getErrorType() + ": " + e.getMessage(), clock.instant(), failureThreshold);
        } finally {
            stateLock.unlock();
        }
        metricsService.recordProviderFailure(binding.getTier().getKey(), e.getErrorType().name());
        if (markedDead) {
            logger.warn("Tier {} ({}) marked dead after {} consecutive failures",
                    binding.getTier().getKey(), binding.getProvider().getModelId(), failureThreshold);
        }
    }

    /**
     * Half-open reset: dead tiers whose last attempt is older than {@code halfOpenAfter} are put back in rotation.
     *
     * @return number of tiers revived
     */
    public int resetStale(Duration halfOpenAfter) {
        Instant cutoff = clock.instant().minus(halfOpenAfter);
        int revived = 0;
        stateLock.lock();
        try {
            for (TierBinding binding : tiers) {
                ProviderState state = binding.state;
                if (!state.isAlive() && (state.getLastAttemptAt() == null || state.getLastAttemptAt().isBefore(cutoff))) {
                    state.revive();
                    revived++;
                    logger.info("Tier {} ({}) back in rotation (half-open)",
                            binding.getTier().getKey(), binding.getProvider().getModelId());
                }
            }
        } finally {
            stateLock.unlock();
        }
        return revived;
    }

    public List<ProviderStateSnapshot> snapshots() {
        List<ProviderStateSnapshot> snapshots = new ArrayList<>();
        stateLock.lock();
        try {
            for (TierBinding binding : tiers) {
                snapshots.add(binding.state.snapshot());
            }
        } finally {
            stateLock.unlock();
        }
        return snapshots;
    }

    public int getConfiguredTierCount() {
        return tiers.size();
    }

    /**
     * A provider bound to its position in the chain.
     */
    public static class TierBinding {
        private final ProviderTier tier;
        private final AiProvider provider;
        private final ProviderState state;

        public TierBinding(ProviderTier tier, AiProvider provider) {
            this.tier = tier;
            this.provider = provider;
            this.state = new ProviderState(tier, provider.getModelId());
        }

        public ProviderTier getTier() {
            return tier;
        }

        public AiProvider getProvider() {
            return provider;
        }
    }
}
