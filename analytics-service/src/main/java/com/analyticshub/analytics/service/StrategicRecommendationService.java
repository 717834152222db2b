package com.analyticshub.analytics.service;

import com.analyticshub.analytics.dto.StrategicRecommendationRequest;
import com.analyticshub.analytics.dto.StrategicRecommendationResponse;
import com.analyticshub.analytics.logger.DecisionFlowLogger;
import com.analyticshub.analytics.store.SignalStore;
import com.analyticshub.analytics.validation.RequestValidator;
import com.analyticshub.common.decision.AgentIdentity;
import com.analyticshub.common.decision.ConstraintApplied;
import com.analyticshub.common.decision.DecisionEventPublisher;
import com.analyticshub.common.decision.DecisionRecord;
import com.analyticshub.common.decision.DecisionRecordBuilder;
import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import com.analyticshub.common.model.Signal;
import com.analyticshub.common.pipeline.StrategicAnalysisPipeline;
import com.analyticshub.common.pipeline.StrategicAnalysisRequest;
import com.analyticshub.common.pipeline.StrategicRecommendationReport;
import com.analyticshub.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategic recommendation agent invocation.
 *
 * <p>Signals come inline from the request or, when absent, from the {@link SignalStore}.
 * The analysis itself is {@link StrategicAnalysisPipeline}; this class only adds timing,
 * the decision record and its persistence.
 */
@Service
public class StrategicRecommendationService {

    private static final Logger log = LoggerFactory.getLogger(StrategicRecommendationService.class);

    private final SignalStore signalStore;
    private final DecisionRecordBuilder decisionRecordBuilder;
    private final DecisionEventPublisher decisionEventPublisher;
    private final DecisionFlowLogger decisionFlowLogger;
    private final RequestValidator requestValidator;
    private final AgentIdentity identity;

    public StrategicRecommendationService(
            SignalStore signalStore,
            DecisionRecordBuilder decisionRecordBuilder,
            DecisionEventPublisher decisionEventPublisher,
            DecisionFlowLogger decisionFlowLogger,
            RequestValidator requestValidator,
            @Value("${analytics.agent.version:1.0.0}") String agentVersion) {
        this.signalStore            = signalStore;
        this.decisionRecordBuilder  = decisionRecordBuilder;
        this.decisionEventPublisher = decisionEventPublisher;
        this.decisionFlowLogger     = decisionFlowLogger;
        this.requestValidator       = requestValidator;
        this.identity               = AgentIdentity.strategicRecommendation(agentVersion);
    }

    public AgentIdentity identity() {
        return identity;
    }

    public Mono<StrategicRecommendationResponse> analyze(StrategicRecommendationRequest request) {
        return Mono.defer(() -> {
            requestValidator.validateStrategic(request);
            String executionRef = TraceContextUtil.executionRefOrNew(request.executionRef());
            StrategicAnalysisRequest analysisRequest = request.toAnalysisRequest();
            final long startTime = System.currentTimeMillis();

            Mono<StrategicRecommendationResponse> pipeline = Mono.just(analysisRequest)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
                .flatMap(r -> resolveSignals(request, r, executionRef))
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SIGNALS_RESOLVED))
                .flatMap(signalsByLayer -> Mono.just(signalsByLayer)
                    .map(signals -> StrategicAnalysisPipeline.analyzeTrends(analysisRequest, signals))
                    .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.TRENDS_ANALYZED))
                    .map(findings -> StrategicAnalysisPipeline.recommend(analysisRequest, findings)
                        .withProcessingDuration(System.currentTimeMillis() - startTime))
                    .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.RECOMMENDATIONS_SYNTHESIZED))
                    .doOnNext(report -> log.info("Strategic analysis complete. signals={} trends={} "
                                                 + "correlations={} recommendations={} executionRef={}",
                        report.totalSignalsAnalyzed(), report.trendsIdentified(),
                        report.correlationsFound(), report.recommendations().size(), executionRef))
                    .map(report -> buildResponse(analysisRequest, signalsByLayer, report, executionRef)))
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.DECISION_RECORD_BUILT))
                .doOnNext(response -> {
                    decisionEventPublisher.publish(response.decisionEvent());
                    decisionFlowLogger.logWithExecutionRef(DecisionFlowLogger.DECISION_EVENT_DISPATCHED, executionRef);
                    decisionFlowLogger.logOutcome(identity.agentId(), executionRef,
                        response.decisionEvent().confidence(),
                        response.output().analysisMetadata().processingDurationMs());
                })
                .onErrorMap(e -> !(e instanceof AnalyticsException), e -> {
                    log.error("Strategic analysis failed. executionRef={}", executionRef, e);
                    return new AnalyticsException(identity.agentId(), ErrorCode.STRATEGIC_COMPUTATION_ERROR,
                                                  "Strategic analysis failed: " + e.getMessage(), e);
                });

            return TraceContextUtil.withExecutionRef(pipeline, executionRef);
        });
    }

    private Mono<Map<String, List<Signal>>> resolveSignals(StrategicRecommendationRequest request,
                                                           StrategicAnalysisRequest analysisRequest,
                                                           String executionRef) {
        if (request.hasInlineSignals()) {
            return Mono.just(request.signalsByLayer());
        }
        return signalStore.fetchSignals(analysisRequest.sourceLayers(), analysisRequest.timeWindow(), executionRef);
    }

    private StrategicRecommendationResponse buildResponse(StrategicAnalysisRequest analysisRequest,
                                                          Map<String, List<Signal>> signalsByLayer,
                                                          StrategicRecommendationReport report,
                                                          String executionRef) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("request", analysisRequest);
        inputs.put("signalsByLayer", signalsByLayer);

        DecisionRecord<StrategicRecommendationReport> record = decisionRecordBuilder.build(
            identity,
            inputs,
            report,
            report.overallConfidence(),
            List.of(ConstraintApplied.forStrategicAnalysis(
                analysisRequest.timeWindow(), analysisRequest.sourceLayers(), analysisRequest.minConfidence())),
            executionRef);
        return new StrategicRecommendationResponse(true, report, record);
    }
}
