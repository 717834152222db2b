package com.analyticshub.analytics.service;

import com.analyticshub.analytics.dto.ConsensusOptionsRequest;
import com.analyticshub.analytics.dto.ConsensusRequest;
import com.analyticshub.analytics.dto.ConsensusResponse;
import com.analyticshub.analytics.dto.ProcessingMetadata;
import com.analyticshub.analytics.logger.DecisionFlowLogger;
import com.analyticshub.analytics.validation.RequestValidator;
import com.analyticshub.common.consensus.ConsensusEngine;
import com.analyticshub.common.consensus.ConsensusOptions;
import com.analyticshub.common.consensus.ConsensusOutput;
import com.analyticshub.common.consensus.ConsensusResult;
import com.analyticshub.common.decision.AgentIdentity;
import com.analyticshub.common.decision.ConstraintApplied;
import com.analyticshub.common.decision.DecisionEventPublisher;
import com.analyticshub.common.decision.DecisionRecord;
import com.analyticshub.common.decision.DecisionRecordBuilder;
import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import com.analyticshub.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Consensus agent invocation: validate, compute, record, persist, respond.
 *
 * <p>Exactly one {@link DecisionRecord} is built per successful invocation. Its persistence
 * is fire-and-forget and never affects the response.
 */
@Service
public class ConsensusService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusService.class);

    private final ConsensusEngine consensusEngine;
    private final DecisionRecordBuilder decisionRecordBuilder;
    private final DecisionEventPublisher decisionEventPublisher;
    private final DecisionFlowLogger decisionFlowLogger;
    private final RequestValidator requestValidator;
    private final AgentIdentity identity;

    public ConsensusService(
            ConsensusEngine consensusEngine,
            DecisionRecordBuilder decisionRecordBuilder,
            DecisionEventPublisher decisionEventPublisher,
            DecisionFlowLogger decisionFlowLogger,
            RequestValidator requestValidator,
            @Value("${analytics.agent.version:1.0.0}") String agentVersion) {
        this.consensusEngine        = consensusEngine;
        this.decisionRecordBuilder  = decisionRecordBuilder;
        this.decisionEventPublisher = decisionEventPublisher;
        this.decisionFlowLogger     = decisionFlowLogger;
        this.requestValidator       = requestValidator;
        this.identity               = AgentIdentity.consensus(agentVersion);
    }

    public AgentIdentity identity() {
        return identity;
    }

    public Mono<ConsensusResponse> computeConsensus(ConsensusRequest request) {
        return Mono.defer(() -> {
            requestValidator.validateConsensus(request);
            String executionRef = TraceContextUtil.executionRefOrNew(request.executionRef());
            ConsensusOptions options = ConsensusOptionsRequest.resolve(request.options());
            final long[] computationTimeMs = {0L};

            Mono<ConsensusResponse> pipeline = Mono.just(request)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
                .map(r -> {
                    long start = System.nanoTime();
                    ConsensusResult result = consensusEngine.computeConsensus(r.signals(), options);
                    computationTimeMs[0] = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    return result;
                })
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.CONSENSUS_COMPUTED))
                .map(result -> buildResponse(request, options, result, executionRef, computationTimeMs[0]))
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.DECISION_RECORD_BUILT))
                .doOnNext(response -> {
                    decisionEventPublisher.publish(response.decisionEvent());
                    decisionFlowLogger.logWithExecutionRef(DecisionFlowLogger.DECISION_EVENT_DISPATCHED, executionRef);
                    decisionFlowLogger.logOutcome(identity.agentId(), executionRef,
                        response.decisionEvent().confidence(), computationTimeMs[0]);
                })
                .onErrorMap(e -> !(e instanceof AnalyticsException), e -> {
                    log.error("Consensus computation failed. executionRef={}", executionRef, e);
                    return new AnalyticsException(identity.agentId(), ErrorCode.CONSENSUS_COMPUTATION_ERROR,
                                                  "Consensus computation failed: " + e.getMessage(), e);
                });

            return TraceContextUtil.withExecutionRef(pipeline, executionRef);
        });
    }

    private ConsensusResponse buildResponse(ConsensusRequest request, ConsensusOptions options,
                                            ConsensusResult result, String executionRef,
                                            long computationTimeMs) {
        DecisionRecord<ConsensusOutput> record = decisionRecordBuilder.build(
            identity,
            hashedInputs(request, options),
            ConsensusOutput.from(result),
            result.confidence(),
            List.of(ConstraintApplied.forConsensus(request.timeRange(), options)),
            executionRef);

        boolean consensusAchieved = result.agreementLevel() >= options.minAgreementThreshold();
        return new ConsensusResponse(
            true,
            consensusAchieved,
            record,
            summarize(result, consensusAchieved),
            new ProcessingMetadata(result.totalSignals(), computationTimeMs, result.method()));
    }

    /** The caller's payload with options resolved; the generated executionRef is not part of it. */
    private static Map<String, Object> hashedInputs(ConsensusRequest request, ConsensusOptions options) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("signals", request.signals());
        inputs.put("timeRange", request.timeRange());
        inputs.put("options", options);
        return inputs;
    }

    static String summarize(ConsensusResult result, boolean consensusAchieved) {
        List<String> parts = new ArrayList<>();
        parts.add(consensusAchieved
            ? String.format(Locale.ROOT, "Consensus achieved across %d signals.", result.totalSignals())
            : "Consensus not achieved (threshold not met).");
        parts.add(String.format(Locale.ROOT, "Agreement level: %.1f%% (%d/%d signals agree).",
                                result.agreementLevel() * 100, result.agreementCount(), result.totalSignals()));
        if (result.hasConsensusValue() && result.consensusValue().isNumeric()) {
            parts.add(String.format(Locale.ROOT, "Consensus value: %.4f.", result.consensusValue().asNumber()));
        }
        if (!result.divergentSignals().isEmpty()) {
            parts.add(result.divergentSignals().size() + " divergent signal(s) identified.");
        }
        parts.add(String.format(Locale.ROOT, "Confidence: %.1f%%.", result.confidence() * 100));
        return String.join(" ", parts);
    }
}
