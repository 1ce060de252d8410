package com.lattice.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * correlation ID, tenant and namespace.
 *
 * <p>Does not configure the SDK. Without a configured SDK the tracer is a no-op and the wrapped
 * work simply runs.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Helper whose spans go nowhere. Used when no tracer is wired. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("lattice"));
    }

    /**
     * Runs {@code work} inside an INTERNAL span.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span of the given kind. Runtime exceptions are recorded on the span
     * and rethrown unchanged.
     *
     * @param spanName   span name
     * @param kind       span kind (CLIENT for backend calls, INTERNAL otherwise)
     * @param attributes extra string attributes
     * @param work       the work to run
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                        Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.namespace() != null) {
                span.setAttribute("tenant.namespace", ctx.namespace());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, Supplier)}. */
    public void runInSpan(String spanName, Runnable work) {
        inSpan(spanName, () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
