package com.analyticshub.analytics.service;

import com.analyticshub.analytics.dto.ConsensusOptionsRequest;
import com.analyticshub.analytics.dto.ConsensusRequest;
import com.analyticshub.analytics.dto.ConsensusResponse;
import com.analyticshub.analytics.logger.DecisionFlowLogger;
import com.analyticshub.analytics.validation.RequestValidator;
import com.analyticshub.common.consensus.AggregationMethod;
import com.analyticshub.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.analyticshub.common.consensus.ConfidenceWeighting;
import com.analyticshub.common.consensus.ConsensusEngine;
import com.analyticshub.common.consensus.ConsensusOutput;
import com.analyticshub.common.decision.DecisionEventPublisher;
import com.analyticshub.common.decision.DecisionRecord;
import com.analyticshub.common.decision.DecisionRecordBuilder;
import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.SignalValue;
import com.analyticshub.common.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ConsensusServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    private static final TimeWindow RANGE = new TimeWindow(T0, T0.plusSeconds(3600));

    @Mock
    private DecisionEventPublisher decisionEventPublisher;

    private ConsensusService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = newService(new ConfidenceWeightedConsensusStrategy());
    }

    private ConsensusService newService(ConsensusEngine engine) {
        return new ConsensusService(
            engine,
            new DecisionRecordBuilder(Clock.fixed(T0, ZoneOffset.UTC)),
            decisionEventPublisher,
            new DecisionFlowLogger(),
            new RequestValidator(),
            "1.0.0");
    }

    private static List<Signal> outlierSignals() {
        return List.of(
            Signal.numeric("s1", "observatory", T0, "latency", 10, 0.9),
            Signal.numeric("s2", "cost-ops", T0, "latency", 12, 0.9),
            Signal.numeric("s3", "governance", T0, "latency", 100, 0.9));
    }

    private static ConsensusOptionsRequest medianAt(double threshold) {
        return new ConsensusOptionsRequest(AggregationMethod.MEDIAN, ConfidenceWeighting.PROPORTIONAL,
                                           threshold, null, null);
    }

    @Test
    @DisplayName("computes consensus, builds one decision record and hands it to the publisher")
    void happyPath() {
        ConsensusRequest request = new ConsensusRequest(outlierSignals(), RANGE, medianAt(0.8), "exec-42");

        StepVerifier.create(service.computeConsensus(request))
            .assertNext(response -> {
                assertTrue(response.success());
                assertFalse(response.consensusAchieved());
                DecisionRecord<ConsensusOutput> record = response.decisionEvent();
                assertEquals("consensus-agent", record.agentId());
                assertEquals("exec-42", record.executionRef());
                assertEquals(T0, record.timestamp());
                assertEquals(12.0, record.outputs().consensusValue().asNumber());
                assertEquals(0.55, record.confidence());
                assertEquals("all", record.constraintsApplied().get(0).scope());
                assertEquals(3, response.processingMetadata().signalsProcessed());
                assertEquals(AggregationMethod.MEDIAN, response.processingMetadata().method());
                assertEquals("Consensus not achieved (threshold not met). "
                             + "Agreement level: 61.1% (2/3 signals agree). "
                             + "Consensus value: 12.0000. "
                             + "1 divergent signal(s) identified. "
                             + "Confidence: 55.0%.", response.summary());
            })
            .verifyComplete();

        ArgumentCaptor<DecisionRecord<?>> captor = ArgumentCaptor.forClass(DecisionRecord.class);
        verify(decisionEventPublisher, times(1)).publish(captor.capture());
        assertEquals("exec-42", captor.getValue().executionRef());
    }

    @Test
    @DisplayName("consensusAchieved when agreementLevel meets the threshold")
    void consensusAchieved() {
        ConsensusRequest request = new ConsensusRequest(outlierSignals(), RANGE, medianAt(0.6), null);

        ConsensusResponse response = service.computeConsensus(request).block();

        assertNotNull(response);
        assertTrue(response.consensusAchieved());
        assertTrue(response.summary().startsWith("Consensus achieved across 3 signals."));
    }

    @Test
    @DisplayName("missing executionRef → generated; inputs hash ignores it")
    void executionRefGeneratedAndExcludedFromHash() {
        ConsensusResponse generated = service.computeConsensus(
            new ConsensusRequest(outlierSignals(), RANGE, null, null)).block();
        ConsensusResponse supplied = service.computeConsensus(
            new ConsensusRequest(outlierSignals(), RANGE, null, "mine")).block();

        assertNotNull(generated);
        assertNotNull(supplied);
        assertFalse(generated.decisionEvent().executionRef().isBlank());
        assertEquals("mine", supplied.decisionEvent().executionRef());
        assertEquals(generated.decisionEvent().inputsHash(), supplied.decisionEvent().inputsHash());
    }

    @Test
    @DisplayName("empty signal list → INSUFFICIENT_SIGNALS, nothing published")
    void insufficientSignals() {
        StepVerifier.create(service.computeConsensus(new ConsensusRequest(List.of(), RANGE, null, null)))
            .expectErrorSatisfies(e -> {
                AnalyticsException ex = assertInstanceOf(AnalyticsException.class, e);
                assertEquals(ErrorCode.CONSENSUS_INSUFFICIENT_SIGNALS, ex.getErrorCode());
            })
            .verify();

        verify(decisionEventPublisher, never()).publish(any());
    }

    @Test
    @DisplayName("unexpected engine failure → CONSENSUS_COMPUTATION_ERROR")
    void engineFailure() {
        ConsensusEngine failing = (signals, options) -> {
            throw new IllegalStateException("boom");
        };

        StepVerifier.create(newService(failing).computeConsensus(
                new ConsensusRequest(outlierSignals(), RANGE, null, null)))
            .expectErrorSatisfies(e -> {
                AnalyticsException ex = assertInstanceOf(AnalyticsException.class, e);
                assertEquals(ErrorCode.CONSENSUS_COMPUTATION_ERROR, ex.getErrorCode());
                assertInstanceOf(IllegalStateException.class, ex.getCause());
            })
            .verify();
    }

    @Test
    @DisplayName("unhashable inputs → CONSENSUS_COMPUTATION_ERROR attributed to the consensus agent")
    void unhashableInputs() {
        Signal opaque = new Signal("s1", "observatory", T0, "latency", SignalValue.numeric(10), 0.9,
                                   Map.of("handle", new Object()));
        ConsensusRequest request = new ConsensusRequest(List.of(opaque), RANGE, null, "exec-h");

        StepVerifier.create(service.computeConsensus(request))
            .expectErrorSatisfies(e -> {
                AnalyticsException ex = assertInstanceOf(AnalyticsException.class, e);
                assertEquals(ErrorCode.CONSENSUS_COMPUTATION_ERROR, ex.getErrorCode());
                assertEquals("consensus-agent", ex.getAgentId());
                assertInstanceOf(IllegalArgumentException.class, ex.getCause());
            })
            .verify();

        verify(decisionEventPublisher, never()).publish(any());
    }
}
