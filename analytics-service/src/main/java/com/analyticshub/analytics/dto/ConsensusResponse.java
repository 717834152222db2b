package com.analyticshub.analytics.dto;

import com.analyticshub.common.consensus.ConsensusOutput;
import com.analyticshub.common.decision.DecisionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful consensus invocation.
 *
 * <p>{@code consensusAchieved} is {@code agreementLevel >= minAgreementThreshold}.
 */
public record ConsensusResponse(
    @JsonProperty("success")            boolean success,
    @JsonProperty("consensusAchieved")  boolean consensusAchieved,
    @JsonProperty("decisionEvent")      DecisionRecord<ConsensusOutput> decisionEvent,
    @JsonProperty("summary")            String summary,
    @JsonProperty("processingMetadata") ProcessingMetadata processingMetadata
) {}
