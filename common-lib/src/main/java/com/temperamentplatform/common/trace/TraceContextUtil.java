package com.temperamentplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a trace id through reactive evaluation pipelines.
 *
 * <p>The Reactor Context holds the trace id. MDC is written only for the duration of a
 * single log statement via {@link #withMdc(String, Runnable)}.
 *
 * <pre>
 *     Mono&lt;Summary&gt; run = TraceContextUtil.logWithTrace(() -&gt; log.info(...))
 *         .then(batch);
 *     return TraceContextUtil.withTraceId(run, TraceContextUtil.newTraceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context. {@code contextWrite} propagates
     * upstream, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, or {@value #UNKNOWN}; never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with {@code traceId} in MDC, then removes it. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /** Reads the trace id from the current subscriber context and logs with it in MDC. */
    public static Mono<Void> logWithTrace(Runnable logAction) {
        return Mono.deferContextual(ctx -> {
            withMdc(getTraceId(ctx), logAction);
            return Mono.empty();
        });
    }
}
