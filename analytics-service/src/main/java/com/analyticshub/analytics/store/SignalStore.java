package com.analyticshub.analytics.store;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Source of upstream signals when a strategic analysis request carries none inline.
 */
public interface SignalStore {

    /**
     * Fetches the signals of each requested layer inside {@code timeWindow}.
     * Implementations MUST NOT fail the whole lookup because one layer is unavailable;
     * that layer maps to an empty list instead.
     *
     * @return signals keyed by layer, one entry per requested layer, in request order
     */
    Mono<Map<String, List<Signal>>> fetchSignals(List<String> layers, TimeWindow timeWindow, String executionRef);
}
