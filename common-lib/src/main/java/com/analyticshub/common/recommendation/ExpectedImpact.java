package com.analyticshub.common.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Estimated effect of acting on a recommendation; unset dimensions are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpectedImpact(
    @JsonProperty("costSavings")     Double costSavings,
    @JsonProperty("performanceGain") Double performanceGain,
    @JsonProperty("riskReduction")   Double riskReduction
) {}
