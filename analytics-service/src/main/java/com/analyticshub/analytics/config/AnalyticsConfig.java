package com.analyticshub.analytics.config;

import com.analyticshub.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.analyticshub.common.consensus.ConsensusEngine;
import com.analyticshub.common.decision.DecisionRecordBuilder;
import com.analyticshub.common.json.JsonSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class AnalyticsConfig {

    @Value("${analytics.ruvector.base-url}")
    private String ruvectorUrl;

    @Value("${analytics.ruvector.api-key:}")
    private String ruvectorApiKey;

    @Bean
    public WebClient ruvectorClient(WebClient.Builder builder) {
        builder.baseUrl(ruvectorUrl);
        if (!ruvectorApiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + ruvectorApiKey);
        }
        return builder.build();
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new ConfidenceWeightedConsensusStrategy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DecisionRecordBuilder decisionRecordBuilder(Clock clock) {
        return new DecisionRecordBuilder(clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.configure(JsonMapper.builder()).build();
    }
}
