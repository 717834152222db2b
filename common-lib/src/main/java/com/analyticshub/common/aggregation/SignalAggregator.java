package com.analyticshub.common.aggregation;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds a raw signal set to the requested layers and time window.
 *
 * <p>Layers appear in the order requested; a requested layer without signals maps to an
 * empty list. Signals of unrequested layers and signals outside {@code [start, end]} are
 * dropped.
 */
public final class SignalAggregator {

    private SignalAggregator() {}

    public static SignalAggregation aggregate(TimeWindow timeWindow,
                                              List<String> sourceLayers,
                                              Map<String, List<Signal>> signalsByLayer) {
        Map<String, List<Signal>> bounded = new LinkedHashMap<>();
        int total = 0;
        for (String layer : sourceLayers) {
            List<Signal> layerSignals = signalsByLayer.getOrDefault(layer, List.of()).stream()
                .filter(s -> timeWindow.contains(s.timestamp()))
                .toList();
            bounded.put(layer, layerSignals);
            total += layerSignals.size();
        }
        return new SignalAggregation(timeWindow, Collections.unmodifiableMap(bounded), total,
                                     List.copyOf(sourceLayers));
    }
}
