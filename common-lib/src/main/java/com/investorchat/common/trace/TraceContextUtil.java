package com.investorchat.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the per-chat-request id through a reactive pipeline.
 *
 * <p>The id lives in the Reactor Context of the request's {@code Mono}; MDC is populated
 * only while a single log statement runs.
 *
 * <pre>
 *     String requestId = TraceContextUtil.newRequestId();
 *     return TraceContextUtil.withRequestId(pipeline, requestId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /** Attach at the end of pipeline assembly; {@code contextWrite} is visible upstream only. */
    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /** {@code "unknown"} outside a chat request. */
    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String requestId, Runnable logAction) {
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
