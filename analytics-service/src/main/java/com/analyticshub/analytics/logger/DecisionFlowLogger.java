package com.analyticshub.analytics.logger;

import com.analyticshub.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the lifecycle of one agent invocation.
 *
 * <p>Logs each stage without touching pipeline behavior. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: request decoded and validated</li>
 *   <li>{@link #SIGNALS_RESOLVED}: signals taken inline or fetched from the signal store</li>
 *   <li>{@link #CONSENSUS_COMPUTED}: consensus engine returned</li>
 *   <li>{@link #TRENDS_ANALYZED}: strategic pipeline finished trend and correlation passes</li>
 *   <li>{@link #RECOMMENDATIONS_SYNTHESIZED}: ranked, filtered recommendation list ready</li>
 *   <li>{@link #DECISION_RECORD_BUILT}: decision record assembled and hashed</li>
 *   <li>{@link #DECISION_EVENT_DISPATCHED}: record handed to the publisher</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads executionRef from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.CONSENSUS_COMPUTED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED            = "REQUEST_RECEIVED";
    public static final String SIGNALS_RESOLVED            = "SIGNALS_RESOLVED";
    public static final String CONSENSUS_COMPUTED          = "CONSENSUS_COMPUTED";
    public static final String TRENDS_ANALYZED             = "TRENDS_ANALYZED";
    public static final String RECOMMENDATIONS_SYNTHESIZED = "RECOMMENDATIONS_SYNTHESIZED";
    public static final String DECISION_RECORD_BUILT       = "DECISION_RECORD_BUILT";
    public static final String DECISION_EVENT_DISPATCHED   = "DECISION_EVENT_DISPATCHED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage.
     *
     * <p>Reads executionRef from the Reactor Context embedded in the {@link Signal}, never
     * from MDC. Only fires on {@code onNext} signals.
     *
     * @param stageName one of the stage constants defined in this class
     * @param <T>       the upstream element type (not used in logging)
     * @return a consumer suitable for {@code .doOnEach(...)}
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String executionRef = TraceContextUtil.getExecutionRef(signal.getContextView());
            TraceContextUtil.withMdc(executionRef, () ->
                log.info("[DecisionFlow] stage={} executionRef={}", stageName, executionRef)
            );
        };
    }

    /**
     * Logs a stage when the executionRef is already at hand, e.g. inside a {@code doOnNext}
     * that works on a decision record.
     */
    public void logWithExecutionRef(String stageName, String executionRef) {
        TraceContextUtil.withMdc(executionRef, () ->
            log.info("[DecisionFlow] stage={} executionRef={}", stageName, executionRef)
        );
    }

    /** Compact outcome line for an invocation; called once per request. */
    public void logOutcome(String agentId, String executionRef, double confidence, long durationMs) {
        TraceContextUtil.withMdc(executionRef, () ->
            log.info("[DecisionFlow] completed agentId={} confidence={} durationMs={} executionRef={}",
                     agentId, confidence, durationMs, executionRef)
        );
    }
}
