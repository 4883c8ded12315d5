package com.budgetaudit.processing.ai;

import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.processing.CancellationToken;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for ProviderChain failover.
 * Tests tier ordering, timeouts, the single transient re-attempt, dead-tier skipping with half-open
 * reset, the regex fallback and cancellation.
 */
@ExtendWith(MockitoExtension.class)
class ProviderChainTest {

    private static final String TEXT = "行政运行。年初预算为50.00万元，支出决算为60.00万元，决算数大于预算数。";

    @Mock
    private MetricsServiceInterface metricsService;

    private ExecutorService callExecutor;
    private MutableClock clock;
    private ExtractRequest request;

    @BeforeEach
    void setUp() {
        callExecutor = Executors.newCachedThreadPool();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        request = new ExtractRequest("R33110_pairs_v1", TEXT, "hash", 3);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    void testTimeoutsFailOverToDisasterPrimaryExactlyOnce() {
        // Given: primary and backup hang past the attempt timeout
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.hang());
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.hang());
        ScriptedProvider disasterPrimary = new ScriptedProvider("disaster-primary", ScriptedProvider.ok());
        ScriptedProvider disasterBackup = new ScriptedProvider("disaster-backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofMillis(200), 3, primary, backup, disasterPrimary, disasterBackup);

        // When
        ChainResult result = chain.extract(request, new CancellationToken());

        // Then
        assertThat(result.getServedBy()).isEqualTo(ProviderTier.DISASTER_PRIMARY);
        assertThat(result.isFellBack()).isTrue();
        assertThat(result.isDegraded()).isFalse();
        assertThat(disasterPrimary.calls.get()).isEqualTo(1);
        assertThat(disasterBackup.calls.get()).isZero();
        assertThat(result.getAttempts())
                .extracting(ProviderAttempt::getErrorType)
                .containsExactly(ProviderErrorType.TIMEOUT, ProviderErrorType.TIMEOUT, null);
        verify(metricsService).recordFailover("disasterPrimary");
    }

    @Test
    void testPrimarySuccessIsNotFallback() {
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.ok());
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup);

        ChainResult result = chain.extract(request, new CancellationToken());

        assertThat(result.getServedBy()).isEqualTo(ProviderTier.PRIMARY);
        assertThat(result.isFellBack()).isFalse();
        assertThat(backup.calls.get()).isZero();
        verify(metricsService, never()).recordFailover(anyString());
    }

    @Test
    void testAllTiersFailingFallsBackToRegex() {
        // Given
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.fail(ProviderErrorType.SERVER));
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.fail(ProviderErrorType.RATE_LIMIT));
        ScriptedProvider disasterPrimary = new ScriptedProvider("disaster-primary", ScriptedProvider.fail(ProviderErrorType.AUTH));
        ScriptedProvider disasterBackup = new ScriptedProvider("disaster-backup", ScriptedProvider.fail(ProviderErrorType.PARSE));
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup, disasterPrimary, disasterBackup);

        // When
        ChainResult result = chain.extract(request, new CancellationToken());

        // Then
        assertThat(result.getServedBy()).isEqualTo(ProviderTier.REGEX_FALLBACK);
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.isFellBack()).isTrue();
        assertThat(result.getModelId()).isEqualTo(RegexFallbackProvider.MODEL_ID);
        assertThat(result.getResponse().getHits()).hasSize(1);
        assertThat(result.getAttempts()).hasSize(5);
        verify(metricsService).recordFailover("regexFallback");
    }

    @Test
    void testNetworkErrorIsReattemptedOnceOnSameTier() {
        // Given: one network blip, then success
        ScriptedProvider primary = new ScriptedProvider("primary",
                ScriptedProvider.fail(ProviderErrorType.NETWORK), ScriptedProvider.ok());
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup);

        // When
        ChainResult result = chain.extract(request, new CancellationToken());

        // Then
        assertThat(result.getServedBy()).isEqualTo(ProviderTier.PRIMARY);
        assertThat(primary.calls.get()).isEqualTo(2);
        assertThat(backup.calls.get()).isZero();
    }

    @Test
    void testSecondNetworkErrorMovesToNextTier() {
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.fail(ProviderErrorType.NETWORK));
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup);

        ChainResult result = chain.extract(request, new CancellationToken());

        assertThat(result.getServedBy()).isEqualTo(ProviderTier.BACKUP);
        assertThat(primary.calls.get()).isEqualTo(2);
    }

    @Test
    void testNonTransientErrorIsNotReattempted() {
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.fail(ProviderErrorType.RATE_LIMIT));
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup);

        chain.extract(request, new CancellationToken());

        assertThat(primary.calls.get()).isEqualTo(1);
        verify(metricsService).recordProviderFailure("primary", "RATE_LIMIT");
    }

    @Test
    void testUnexpectedExceptionCountsAsServerError() {
        ScriptedProvider primary = new ScriptedProvider("primary", () -> {
            throw new IllegalStateException("boom");
        });
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary, backup);

        ChainResult result = chain.extract(request, new CancellationToken());

        assertThat(result.getAttempts().get(0).getErrorType()).isEqualTo(ProviderErrorType.SERVER);
        assertThat(result.getServedBy()).isEqualTo(ProviderTier.BACKUP);
    }

    @Test
    void testDeadTierIsSkippedUntilHalfOpenReset() {
        // Given: primary fails every call, threshold 2
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.fail(ProviderErrorType.SERVER));
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 2, primary, backup);

        // When: two requests take primary out of rotation
        chain.extract(request, new CancellationToken());
        chain.extract(request, new CancellationToken());
        chain.extract(request, new CancellationToken());

        // Then
        assertThat(primary.calls.get()).isEqualTo(2);
        ProviderStateSnapshot primaryState = chain.snapshots().get(0);
        assertThat(primaryState.isAlive()).isFalse();
        assertThat(primaryState.getConsecutiveFailures()).isEqualTo(2);
        assertThat(primaryState.getLastError()).startsWith("SERVER");
        assertThat(chain.snapshots().get(1).isAlive()).isTrue();

        // When: not stale yet, then past the half-open window
        assertThat(chain.resetStale(Duration.ofSeconds(60))).isZero();
        clock.advance(Duration.ofSeconds(61));
        assertThat(chain.resetStale(Duration.ofSeconds(60))).isEqualTo(1);

        // Then: primary is tried again
        chain.extract(request, new CancellationToken());
        assertThat(primary.calls.get()).isEqualTo(3);
    }

    @Test
    void testSuccessResetsFailureCount() {
        ScriptedProvider primary = new ScriptedProvider("primary",
                ScriptedProvider.fail(ProviderErrorType.SERVER), ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 2, primary);

        chain.extract(request, new CancellationToken());
        chain.extract(request, new CancellationToken());

        ProviderStateSnapshot state = chain.snapshots().get(0);
        assertThat(state.isAlive()).isTrue();
        assertThat(state.getConsecutiveFailures()).isZero();
        assertThat(state.getLastError()).isNull();
    }

    @Test
    void testCancelledTokenStopsBeforeAnyCall() {
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(5), 3, primary);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> chain.extract(request, token)).isInstanceOf(CancellationException.class);
        assertThat(primary.calls.get()).isZero();
    }

    @Test
    void testCancellationInterruptsInFlightCall() throws Exception {
        // Given: primary hangs far longer than the test is willing to wait
        ScriptedProvider primary = new ScriptedProvider("primary", ScriptedProvider.hang());
        ScriptedProvider backup = new ScriptedProvider("backup", ScriptedProvider.ok());
        ProviderChain chain = chain(Duration.ofSeconds(30), 3, primary, backup);
        CancellationToken token = new CancellationToken();
        ExecutorService canceller = Executors.newSingleThreadExecutor();

        try {
            // When
            canceller.submit(() -> {
                Thread.sleep(200);
                token.cancel();
                return null;
            });
            long startedAt = System.nanoTime();

            // Then
            assertThatThrownBy(() -> chain.extract(request, token)).isInstanceOf(CancellationException.class);
            assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startedAt)).isLessThan(10);
            assertThat(backup.calls.get()).isZero();
            assertThat(primary.interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    void testThresholdMustBePositive() {
        assertThatThrownBy(() -> chain(Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ProviderChain chain(Duration attemptTimeout, int threshold, AiProvider... providers) {
        ProviderTier[] order = {ProviderTier.PRIMARY, ProviderTier.BACKUP, ProviderTier.DISASTER_PRIMARY, ProviderTier.DISASTER_BACKUP};
        List<ProviderChain.TierBinding> bindings = new ArrayList<>();
        for (int i = 0; i < providers.length; i++) {
            bindings.add(new ProviderChain.TierBinding(order[i], providers[i]));
        }
        return new ProviderChain(bindings, new RegexFallbackProvider(), callExecutor, attemptTimeout, threshold, clock, metricsService);
    }

    /**
     * Provider that plays a script of behaviors, repeating the last one.
     */
    static class ScriptedProvider implements AiProvider {
        private final String name;
        private final List<Supplier<ExtractResponse>> script;
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch interrupted = new CountDownLatch(1);

        @SafeVarargs
        ScriptedProvider(String name, Supplier<ExtractResponse>... script) {
            this.name = name;
            this.script = Arrays.asList(script);
        }

        static Supplier<ExtractResponse> ok() {
            return () -> new ExtractResponse(new ArrayList<>(), new ExtractResponse.Meta("scripted", false, 10));
        }

        static Supplier<ExtractResponse> fail(ProviderErrorType type) {
            return () -> {
                throw new ProviderException("scripted " + type, type);
            };
        }

        static Supplier<ExtractResponse> hang() {
            return () -> {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException("interrupted", ProviderErrorType.NETWORK);
                }
                return new ExtractResponse(Collections.emptyList(), new ExtractResponse.Meta());
            };
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getModelId() {
            return name + "-model";
        }

        @Override
        public ExtractResponse extract(ExtractRequest request) {
            int call = calls.getAndIncrement();
            Supplier<ExtractResponse> step = script.get(Math.min(call, script.size() - 1));
            try {
                return step.get();
            } finally {
                if (Thread.currentThread().isInterrupted()) {
                    interrupted.countDown();
                }
            }
        }
    }

    static class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
