package com.analyticshub.analytics.dto;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ConsensusRequest(
    @JsonProperty("signals")      List<Signal> signals,
    @JsonProperty("timeRange")    TimeWindow timeRange,
    @JsonProperty("options")      ConsensusOptionsRequest options,
    @JsonProperty("executionRef") String executionRef
) {}
