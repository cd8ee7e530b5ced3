package com.atlas.observability;

import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.MDC;

/**
 * Thread-local {@link CorrelationContext} kept in sync with the SLF4J MDC.
 * <p>
 * Request threads get their context from the web filter; the usage worker opens one per batch.
 * Work handed to another thread must carry the context across with
 * {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        put(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        put(CorrelationContext.MDC_USER_ID, context.userId());
        put(CorrelationContext.MDC_REQUEST_ID, context.requestId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Correlation id of the current thread, if a context is set. */
    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Replaces the current context with {@code change} applied to it. No-op without a context.
     * Used to attach the tenant or user once they become known mid-request.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Runs {@code work} under {@code context}, then restores whatever was set before.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            work.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
