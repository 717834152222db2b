package com.analyticshub.common.pipeline;

import com.analyticshub.common.aggregation.SignalAggregation;
import com.analyticshub.common.correlation.CrossDomainCorrelation;
import com.analyticshub.common.trend.TrendAnalysis;

import java.util.List;

/** Output of the trend and correlation passes, input to recommendation synthesis. */
public record TrendFindings(
    SignalAggregation aggregation,
    List<TrendAnalysis> trends,
    List<CrossDomainCorrelation> correlations
) {
    public TrendFindings {
        trends = List.copyOf(trends);
        correlations = List.copyOf(correlations);
    }
}
