package com.analyticshub.analytics.controller;

import com.analyticshub.analytics.exception.AnalyticsExceptionHandler;
import com.analyticshub.analytics.logger.DecisionFlowLogger;
import com.analyticshub.analytics.service.ConsensusService;
import com.analyticshub.analytics.validation.RequestValidator;
import com.analyticshub.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.analyticshub.common.decision.DecisionEventPublisher;
import com.analyticshub.common.decision.DecisionRecordBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Standalone WebFlux tests for {@link ConsensusController}: request decoding, response
 * envelope, agent headers and error mapping.
 */
class ConsensusControllerTest {

    private WebTestClient webTestClient;

    @Mock
    private DecisionEventPublisher decisionEventPublisher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ConsensusService service = new ConsensusService(
            new ConfidenceWeightedConsensusStrategy(),
            new DecisionRecordBuilder(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC)),
            decisionEventPublisher,
            new DecisionFlowLogger(),
            new RequestValidator(),
            "1.0.0");
        webTestClient = WebTestClient.bindToController(new ConsensusController(service))
            .controllerAdvice(new AnalyticsExceptionHandler())
            .build();
    }

    @Test
    void compute_returns200WithDecisionEvent() {
        webTestClient.post().uri("/api/v1/consensus")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"signals":[
                   {"signalId":"s1","sourceLayer":"observatory","timestamp":"2026-03-01T00:00:00Z","value":10,"confidence":0.9},
                   {"signalId":"s2","sourceLayer":"cost-ops","timestamp":"2026-03-01T00:00:00Z","value":12,"confidence":0.9},
                   {"signalId":"s3","sourceLayer":"governance","timestamp":"2026-03-01T00:00:00Z","value":100,"confidence":0.9}],
                 "timeRange":{"start":"2026-03-01T00:00:00Z","end":"2026-03-01T01:00:00Z"},
                 "options":{"aggregationMethod":"median","minAgreementThreshold":0.8},
                 "executionRef":"exec-9"}
                """)
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals("X-Agent-Id", "consensus-agent")
            .expectHeader().valueEquals("X-Agent-Version", "1.0.0")
            .expectBody()
            .jsonPath("$.success").isEqualTo(true)
            .jsonPath("$.consensusAchieved").isEqualTo(false)
            .jsonPath("$.decisionEvent.agent_id").isEqualTo("consensus-agent")
            .jsonPath("$.decisionEvent.decision_type").isEqualTo("analytics_consensus_summary")
            .jsonPath("$.decisionEvent.execution_ref").isEqualTo("exec-9")
            .jsonPath("$.decisionEvent.outputs.consensusValue").isEqualTo(12.0)
            .jsonPath("$.decisionEvent.outputs.agreementCount").isEqualTo(2)
            .jsonPath("$.decisionEvent.outputs.divergentSignals[0].signalId").isEqualTo("s3")
            .jsonPath("$.decisionEvent.constraints_applied[0].scope").isEqualTo("all")
            .jsonPath("$.processingMetadata.method").isEqualTo("median")
            .jsonPath("$.processingMetadata.signalsProcessed").isEqualTo(3);

        verify(decisionEventPublisher).publish(any());
    }

    @Test
    void compute_emptySignals_returns400InsufficientSignals() {
        webTestClient.post().uri("/api/v1/consensus")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"signals":[],"timeRange":{"start":"2026-03-01T00:00:00Z","end":"2026-03-01T01:00:00Z"}}
                """)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.success").isEqualTo(false)
            .jsonPath("$.error.code").isEqualTo("CONSENSUS_INSUFFICIENT_SIGNALS");

        verify(decisionEventPublisher, never()).publish(any());
    }

    @Test
    void compute_unknownAggregationMethod_returns400ValidationFailure() {
        webTestClient.post().uri("/api/v1/consensus")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"signals":[{"signalId":"s1","sourceLayer":"observatory","timestamp":"2026-03-01T00:00:00Z","value":1,"confidence":0.5}],
                 "timeRange":{"start":"2026-03-01T00:00:00Z","end":"2026-03-01T01:00:00Z"},
                 "options":{"aggregationMethod":"geometric"}}
                """)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error.code").isEqualTo("CONSENSUS_VALIDATION_FAILURE");
    }

    @Test
    void compute_confidenceOutOfRange_returns400WithDetails() {
        webTestClient.post().uri("/api/v1/consensus")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"signals":[{"signalId":"s1","sourceLayer":"observatory","timestamp":"2026-03-01T00:00:00Z","value":1,"confidence":2}],
                 "timeRange":{"start":"2026-03-01T00:00:00Z","end":"2026-03-01T01:00:00Z"}}
                """)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error.code").isEqualTo("CONSENSUS_VALIDATION_FAILURE")
            .jsonPath("$.error.details.errors[0]").isEqualTo("signals[0].confidence must be within [0, 1]");
    }

    @Test
    void health_returnsOk() {
        webTestClient.get().uri("/api/v1/consensus/health")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals("X-Agent-Id", "consensus-agent")
            .expectBody(String.class).isEqualTo("OK");
    }
}
