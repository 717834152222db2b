package com.analyticshub.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Canonical, hashable audit output of one agent invocation. Exactly one is produced per
 * invocation.
 *
 * <p>Serialized with snake_case keys, the contract of the decision-event store.
 *
 * @param <T> shape of the agent-specific {@code outputs}
 */
public record DecisionRecord<T>(
    @JsonProperty("agent_id")            String agentId,
    @JsonProperty("agent_version")       String agentVersion,
    @JsonProperty("decision_type")       String decisionType,
    @JsonProperty("inputs_hash")         String inputsHash,
    @JsonProperty("outputs")             T outputs,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("constraints_applied") List<ConstraintApplied> constraintsApplied,
    @JsonProperty("execution_ref")       String executionRef,
    @JsonProperty("timestamp")           Instant timestamp
) {
    public DecisionRecord {
        constraintsApplied = List.copyOf(constraintsApplied);
    }
}
