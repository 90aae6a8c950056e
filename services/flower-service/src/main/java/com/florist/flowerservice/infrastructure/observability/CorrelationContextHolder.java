package com.florist.flowerservice.infrastructure.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys so every log line on the thread carries them;
 * clearing removes both. Servlet threads are pooled, so whoever sets a context must clear it.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {}

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
        putMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putMdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation id, or null outside a request. */
    public static String currentCorrelationId() {
        CorrelationContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    private static void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
