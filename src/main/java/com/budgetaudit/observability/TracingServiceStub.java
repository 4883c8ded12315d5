package com.budgetaudit.observability;

import com.budgetaudit.util.NonNulls;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Stub implementation when tracing is disabled. Spans come from the no-op OpenTelemetry
 * instance, so callers never need a null check.
 */
@Service
@ConditionalOnProperty(name = "budgetaudit.tracing.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("com.budgetaudit");

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return operation.get();
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return NonNulls.nn(tracer.spanBuilder(spanName), "Tracer.spanBuilder returned null");
    }
}
