package com.analyticshub.common.pipeline;

import com.analyticshub.common.model.TimeWindow;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalysisMetadata(
    @JsonProperty("timeWindow")         TimeWindow timeWindow,
    @JsonProperty("layersAnalyzed")     List<String> layersAnalyzed,
    @JsonProperty("processingDuration") long processingDurationMs
) {}
