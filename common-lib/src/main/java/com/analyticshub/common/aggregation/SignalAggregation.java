package com.analyticshub.common.aggregation;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Signals of the requested layers inside one time window, keyed by layer in request order. */
public record SignalAggregation(
    @JsonProperty("timeWindow")     TimeWindow timeWindow,
    @JsonProperty("signalsByLayer") Map<String, List<Signal>> signalsByLayer,
    @JsonProperty("totalSignals")   int totalSignals,
    @JsonProperty("layersIncluded") List<String> layersIncluded
) {}
