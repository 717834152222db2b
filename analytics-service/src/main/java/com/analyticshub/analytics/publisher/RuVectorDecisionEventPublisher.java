package com.analyticshub.analytics.publisher;

import com.analyticshub.common.decision.DecisionEventPublisher;
import com.analyticshub.common.decision.DecisionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * REST-based implementation of {@link DecisionEventPublisher}.
 *
 * <p>POSTs each {@link DecisionRecord} to ruvector-service (fire-and-forget). Every attempt
 * is bounded by {@code analytics.ruvector.timeout-ms}; {@code analytics.ruvector.retry-attempts}
 * is the total number of attempts, spaced {@code retry-delay-ms} apart. A record that still
 * cannot be delivered is logged and dropped. No reactor thread is ever blocked.
 */
@Component
public class RuVectorDecisionEventPublisher implements DecisionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RuVectorDecisionEventPublisher.class);

    static final String DECISION_EVENTS_PATH = "/api/v1/decision-events";

    private final WebClient ruvectorClient;
    private final Duration timeout;
    private final int retryAttempts;
    private final Duration retryDelay;

    public RuVectorDecisionEventPublisher(
            WebClient ruvectorClient,
            @Value("${analytics.ruvector.timeout-ms:5000}") long timeoutMs,
            @Value("${analytics.ruvector.retry-attempts:3}") int retryAttempts,
            @Value("${analytics.ruvector.retry-delay-ms:1000}") long retryDelayMs) {
        this.ruvectorClient = ruvectorClient;
        this.timeout        = Duration.ofMillis(timeoutMs);
        this.retryAttempts  = Math.max(1, retryAttempts);
        this.retryDelay     = Duration.ofMillis(retryDelayMs);
    }

    @Override
    public void publish(DecisionRecord<?> record) {
        send(record).subscribe(
            r   -> log.info("Decision event persisted. agentId={} executionRef={} status={}",
                            record.agentId(), record.executionRef(), r.getStatusCode()),
            err -> log.error("Decision event persistence failed (non-critical). agentId={} executionRef={}",
                             record.agentId(), record.executionRef(), err)
        );
    }

    Mono<ResponseEntity<Void>> send(DecisionRecord<?> record) {
        return Mono.defer(() -> ruvectorClient.post()
                .uri(DECISION_EVENTS_PATH)
                .header("X-Execution-Ref", record.executionRef())
                .bodyValue(record)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout))
            .doOnError(e -> log.warn("Decision event persistence attempt failed. executionRef={} reason={}",
                                     record.executionRef(), e.getMessage()))
            .retryWhen(Retry.fixedDelay(retryAttempts - 1L, retryDelay));
    }
}
