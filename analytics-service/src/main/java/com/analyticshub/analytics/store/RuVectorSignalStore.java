package com.analyticshub.analytics.store;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads layer signals from ruvector-service, one {@code GET /api/v1/signals} per layer.
 *
 * <p>Errors are swallowed per layer with an empty-list fallback so that one unreachable
 * layer never blocks the analysis of the others.
 */
@Component
public class RuVectorSignalStore implements SignalStore {

    private static final Logger log = LoggerFactory.getLogger(RuVectorSignalStore.class);

    static final String SIGNALS_PATH = "/api/v1/signals";

    private final WebClient ruvectorClient;
    private final Duration timeout;

    public RuVectorSignalStore(WebClient ruvectorClient,
                               @Value("${analytics.ruvector.timeout-ms:5000}") long timeoutMs) {
        this.ruvectorClient = ruvectorClient;
        this.timeout        = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<Map<String, List<Signal>>> fetchSignals(List<String> layers, TimeWindow timeWindow,
                                                        String executionRef) {
        return Flux.fromIterable(layers)
            .concatMap(layer -> fetchLayer(layer, timeWindow, executionRef).map(s -> Map.entry(layer, s)))
            .collect(LinkedHashMap<String, List<Signal>>::new, (m, e) -> m.put(e.getKey(), e.getValue()))
            .map(m -> (Map<String, List<Signal>>) m);
    }

    private Mono<List<Signal>> fetchLayer(String layer, TimeWindow timeWindow, String executionRef) {
        return ruvectorClient.get()
            .uri(b -> b.path(SIGNALS_PATH)
                .queryParam("layer", layer)
                .queryParam("startTime", timeWindow.startTime().toString())
                .queryParam("endTime", timeWindow.endTime().toString())
                .build())
            .header("X-Execution-Ref", executionRef)
            .retrieve()
            .bodyToMono(new ParameterizedTypeReference<List<Signal>>() {})
            .timeout(timeout)
            .defaultIfEmpty(List.of())
            .doOnNext(signals -> log.debug("Signals fetched. layer={} count={} executionRef={}",
                                           layer, signals.size(), executionRef))
            .onErrorResume(e -> {
                log.warn("Signal fetch failed, layer treated as empty. layer={} executionRef={} reason={}",
                         layer, executionRef, e.getMessage());
                return Mono.just(List.of());
            });
    }
}
