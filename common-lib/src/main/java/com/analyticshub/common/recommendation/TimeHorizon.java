package com.analyticshub.common.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TimeHorizon {
    @JsonProperty("immediate")   IMMEDIATE,
    @JsonProperty("short-term")  SHORT_TERM,
    @JsonProperty("medium-term") MEDIUM_TERM,
    @JsonProperty("long-term")   LONG_TERM
}
