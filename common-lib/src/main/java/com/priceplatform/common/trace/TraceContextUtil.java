package com.priceplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the refresh request id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id; MDC is written only for the duration of a
 * single log statement via {@link #withMdc}, so pooled threads never leak it.
 *
 * <pre>
 *     return TraceContextUtil.withRequestId(pipeline, requestId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /** Returns {@code "none"} when the context carries no request id. */
    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, "none");
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
