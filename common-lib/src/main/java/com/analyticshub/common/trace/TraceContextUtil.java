package com.analyticshub.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries an agent invocation's {@code executionRef} through a Reactor pipeline.
 *
 * <p>The reference lives in the Reactor Context. The {@code executionRef} MDC key, which
 * {@code logback-spring.xml} prints, is set only while a single log statement runs.
 *
 * <pre>
 *     String ref = TraceContextUtil.executionRefOrNew(request.executionRef());
 *     return TraceContextUtil.withExecutionRef(pipeline, ref);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String EXECUTION_REF_KEY = "executionRef";

    static final String UNKNOWN_REF = "unknown";

    private TraceContextUtil() {}

    /** The caller's reference when it has one, otherwise a random UUID. */
    public static String executionRefOrNew(String requested) {
        return requested != null && !requested.isBlank() ? requested : UUID.randomUUID().toString();
    }

    /** Must be applied last: {@code contextWrite} is visible only to operators above it. */
    public static <T> Mono<T> withExecutionRef(Mono<T> mono, String executionRef) {
        return mono.contextWrite(ctx -> ctx.put(EXECUTION_REF_KEY, executionRef));
    }

    /** Reads the reference from a {@code Signal}'s context view; {@value #UNKNOWN_REF} outside a traced pipeline. */
    public static String getExecutionRef(ContextView ctx) {
        return ctx.getOrDefault(EXECUTION_REF_KEY, UNKNOWN_REF);
    }

    public static void withMdc(String executionRef, Runnable logAction) {
        MDC.put(EXECUTION_REF_KEY, executionRef);
        try {
            logAction.run();
        } finally {
            MDC.remove(EXECUTION_REF_KEY);
        }
    }
}
