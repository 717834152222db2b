package com.analyticshub.common.aggregation;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalAggregatorTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant END   = Instant.parse("2026-03-01T06:00:00Z");

    private static Signal at(String id, String layer, Instant ts) {
        return Signal.numeric(id, layer, ts, "latency", 1.0, 0.5);
    }

    @Test
    @DisplayName("keeps requested layers in request order; window bounds are inclusive")
    void boundsLayersAndWindow() {
        Map<String, List<Signal>> raw = Map.of(
            "observatory", List.of(at("o1", "observatory", START), at("o2", "observatory", END),
                                   at("o3", "observatory", END.plusSeconds(1))),
            "cost-ops", List.of(at("c1", "cost-ops", START.minusSeconds(1))),
            "governance", List.of(at("g1", "governance", START.plusSeconds(60))));

        SignalAggregation aggregation = SignalAggregator.aggregate(
            new TimeWindow(START, END), List.of("cost-ops", "observatory", "consensus"), raw);

        assertEquals(List.of("cost-ops", "observatory", "consensus"),
                     List.copyOf(aggregation.signalsByLayer().keySet()));
        assertEquals(List.of(), aggregation.signalsByLayer().get("cost-ops"));
        assertEquals(2, aggregation.signalsByLayer().get("observatory").size());
        assertEquals(List.of(), aggregation.signalsByLayer().get("consensus"));
        assertFalse(aggregation.signalsByLayer().containsKey("governance"));
        assertEquals(2, aggregation.totalSignals());
        assertEquals(List.of("cost-ops", "observatory", "consensus"), aggregation.layersIncluded());
    }
}
