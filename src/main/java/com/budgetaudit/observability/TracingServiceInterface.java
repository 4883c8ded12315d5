package com.budgetaudit.observability;

import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Interface for tracing service to support both enabled and disabled modes.
 */
public interface TracingServiceInterface {
    <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation);
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);
}
