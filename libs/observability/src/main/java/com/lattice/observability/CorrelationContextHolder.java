package com.lattice.observability;

import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys so every log statement on this thread carries the
 * correlation ID, tenant and namespace. Clearing removes them. Servlet containers reuse threads, so
 * the boundary filter must always clear in a {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with {@code update.apply(current)}. No-op when nothing is set.
     */
    public static void update(UnaryOperator<CorrelationContext> update) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(update.apply(current));
        }
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_NAMESPACE);
        MDC.remove(CorrelationContext.MDC_MODE);
    }

    /**
     * Runs {@code runnable} with {@code context} installed, then restores whatever was there before.
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        putOrRemove(CorrelationContext.MDC_NAMESPACE, ctx.namespace());
        putOrRemove(CorrelationContext.MDC_MODE, ctx.mode());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
