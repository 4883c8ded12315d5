package com.budgetaudit.processing;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Per-job cancellation signal. Provider calls register their futures here; cancelling the token
 * interrupts every registered call and makes later checks throw {@link CancellationException}.
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Job cancelled");
        }
    }

    /**
     * Tracks an in-flight call. A call registered after cancellation is cancelled at once.
     */
    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }
}
