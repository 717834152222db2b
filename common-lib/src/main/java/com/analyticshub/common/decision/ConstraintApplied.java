package com.analyticshub.common.decision;

import com.analyticshub.common.consensus.ConsensusOptions;
import com.analyticshub.common.model.TimeWindow;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Boundaries under which a decision was computed: scope, time range, layers and the
 * confidence band the caller asked for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConstraintApplied(
    @JsonProperty("scope")                 String scope,
    @JsonProperty("dataBoundaries")        DataBoundaries dataBoundaries,
    @JsonProperty("confidenceBands")       ConfidenceBand confidenceBands,
    @JsonProperty("minAgreementThreshold") Double minAgreementThreshold
) {
    static final String ALL_SCOPE       = "all";
    static final String STRATEGIC_SCOPE = "strategic-analysis";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DataBoundaries(
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("endTime")   Instant endTime,
        @JsonProperty("layers")    List<String> layers
    ) {}

    public record ConfidenceBand(
        @JsonProperty("lower") double lower,
        @JsonProperty("upper") double upper
    ) {
        public static ConfidenceBand from(double lower) {
            return new ConfidenceBand(lower, 1.0);
        }
    }

    /** Scope is the comma-joined scope filter, or {@code "all"} without one. */
    public static ConstraintApplied forConsensus(TimeWindow timeRange, ConsensusOptions options) {
        List<String> layers = options.hasScopeFilter() ? options.scopeFilter() : null;
        return new ConstraintApplied(
            options.hasScopeFilter() ? String.join(",", options.scopeFilter()) : ALL_SCOPE,
            new DataBoundaries(timeRange.startTime(), timeRange.endTime(), layers),
            ConfidenceBand.from(options.minAgreementThreshold()),
            options.minAgreementThreshold());
    }

    public static ConstraintApplied forStrategicAnalysis(TimeWindow timeWindow, List<String> sourceLayers,
                                                         double minConfidence) {
        return new ConstraintApplied(
            STRATEGIC_SCOPE,
            new DataBoundaries(timeWindow.startTime(), timeWindow.endTime(), List.copyOf(sourceLayers)),
            ConfidenceBand.from(minConfidence),
            null);
    }
}
