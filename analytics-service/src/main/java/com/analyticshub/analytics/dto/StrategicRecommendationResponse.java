package com.analyticshub.analytics.dto;

import com.analyticshub.common.decision.DecisionRecord;
import com.analyticshub.common.pipeline.StrategicRecommendationReport;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StrategicRecommendationResponse(
    @JsonProperty("success")       boolean success,
    @JsonProperty("output")        StrategicRecommendationReport output,
    @JsonProperty("decisionEvent") DecisionRecord<StrategicRecommendationReport> decisionEvent
) {}
