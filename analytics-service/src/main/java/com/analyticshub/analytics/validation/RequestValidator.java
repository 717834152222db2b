package com.analyticshub.analytics.validation;

import com.analyticshub.analytics.dto.ConsensusRequest;
import com.analyticshub.analytics.dto.StrategicRecommendationRequest;
import com.analyticshub.common.decision.AgentIdentity;
import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.SignalValue;
import com.analyticshub.common.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Boundary checks for incoming requests. The analytics core assumes well-formed input;
 * everything it would silently mis-handle is rejected here with a 400-class code.
 *
 * <p>All violations of a request are collected and reported together under
 * {@code details.errors}.
 */
@Component
public class RequestValidator {

    public void validateConsensus(ConsensusRequest request) {
        String agentId = AgentIdentity.CONSENSUS_AGENT_ID;
        if (request == null) {
            throw invalid(agentId, ErrorCode.CONSENSUS_VALIDATION_FAILURE, List.of("request body is required"));
        }
        List<String> errors = new ArrayList<>();
        if (request.signals() == null) {
            errors.add("signals is required");
        } else {
            validateSignals("signals", request.signals(), false, errors);
        }
        validateTimeWindow("timeRange", request.timeRange(), errors);
        if (request.options() != null && request.options().minAgreementThreshold() != null) {
            checkUnitInterval("options.minAgreementThreshold", request.options().minAgreementThreshold(), errors);
        }
        if (request.options() != null && request.options().scopeFilter() != null
                && request.options().scopeFilter().stream().anyMatch(RequestValidator::isBlank)) {
            errors.add("options.scopeFilter must not contain blank entries");
        }
        if (!errors.isEmpty()) {
            throw invalid(agentId, ErrorCode.CONSENSUS_VALIDATION_FAILURE, errors);
        }
        if (request.signals().isEmpty()) {
            throw new AnalyticsException(agentId, ErrorCode.CONSENSUS_INSUFFICIENT_SIGNALS,
                                         "No signals provided for consensus computation");
        }
    }

    public void validateStrategic(StrategicRecommendationRequest request) {
        String agentId = AgentIdentity.STRATEGIC_AGENT_ID;
        if (request == null) {
            throw invalid(agentId, ErrorCode.STRATEGIC_VALIDATION_FAILURE, List.of("request body is required"));
        }
        List<String> errors = new ArrayList<>();
        validateTimeWindow("timeWindow", request.timeWindow(), errors);
        if (request.sourceLayers() != null
                && request.sourceLayers().stream().anyMatch(l -> l == null || l.isBlank())) {
            errors.add("sourceLayers must not contain blank entries");
        }
        if (request.minConfidence() != null) {
            checkUnitInterval("minConfidence", request.minConfidence(), errors);
        }
        if (request.maxRecommendations() != null && request.maxRecommendations() < 1) {
            errors.add("maxRecommendations must be at least 1");
        }
        if (request.focusCategories() != null && request.focusCategories().stream().anyMatch(Objects::isNull)) {
            errors.add("focusCategories must not contain null entries");
        }
        if (request.hasInlineSignals()) {
            request.signalsByLayer().forEach((layer, signals) -> {
                if (signals == null) {
                    errors.add("signalsByLayer." + layer + " must be a list");
                } else {
                    validateSignals("signalsByLayer." + layer, signals, true, errors);
                }
            });
        }
        if (!errors.isEmpty()) {
            throw invalid(agentId, ErrorCode.STRATEGIC_VALIDATION_FAILURE, errors);
        }
    }

    /** Trend analysis regresses numbers per metric, so strategic signals need a numeric value and a metricType. */
    private static void validateSignals(String path, List<Signal> signals, boolean trendInput, List<String> errors) {
        for (int i = 0; i < signals.size(); i++) {
            Signal s = signals.get(i);
            String at = path + "[" + i + "]";
            if (s == null) {
                errors.add(at + " must not be null");
                continue;
            }
            if (isBlank(s.signalId()))    errors.add(at + ".signalId is required");
            if (isBlank(s.sourceLayer())) errors.add(at + ".sourceLayer is required");
            if (s.timestamp() == null)    errors.add(at + ".timestamp is required");
            if (s.value() == null)        errors.add(at + ".value is required");
            if (trendInput) {
                if (s.value() != null && !(s.value() instanceof SignalValue.Numeric)) {
                    errors.add(at + ".value must be numeric");
                }
                if (isBlank(s.metricType())) errors.add(at + ".metricType is required");
            }
            checkUnitInterval(at + ".confidence", s.confidence(), errors);
        }
    }

    private static void validateTimeWindow(String path, TimeWindow window, List<String> errors) {
        if (window == null || window.startTime() == null || window.endTime() == null) {
            errors.add(path + " requires both start and end");
        } else if (window.startTime().isAfter(window.endTime())) {
            errors.add(path + " start must not be after end");
        }
    }

    private static void checkUnitInterval(String field, double value, List<String> errors) {
        // NaN fails both comparisons
        if (!(value >= 0.0 && value <= 1.0)) {
            errors.add(field + " must be within [0, 1]");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static AnalyticsException invalid(String agentId, ErrorCode code, List<String> errors) {
        return new AnalyticsException(agentId, code, "Invalid input: " + String.join("; ", errors),
                                      Map.of("errors", List.copyOf(errors)));
    }
}
