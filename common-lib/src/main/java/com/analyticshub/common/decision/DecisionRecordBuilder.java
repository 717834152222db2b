package com.analyticshub.common.decision;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Pure assembly of a {@link DecisionRecord}. The clock read for the timestamp is the only
 * non-deterministic part of an invocation's output.
 */
public class DecisionRecordBuilder {

    private final Clock clock;

    public DecisionRecordBuilder(Clock clock) {
        this.clock = clock;
    }

    public static DecisionRecordBuilder systemUtc() {
        return new DecisionRecordBuilder(Clock.systemUTC());
    }

    /**
     * @param identity     agent identity to copy into the record
     * @param inputs       the caller's input payload; hashed, not stored
     * @param outputs      agent-specific outputs
     * @param confidence   overall confidence of the decision, [0.0, 1.0]
     * @param constraints  constraints actually applied during the computation
     * @param executionRef reference to the invocation
     */
    public <T> DecisionRecord<T> build(AgentIdentity identity,
                                       Object inputs,
                                       T outputs,
                                       double confidence,
                                       List<ConstraintApplied> constraints,
                                       String executionRef) {
        return new DecisionRecord<>(
            identity.agentId(),
            identity.agentVersion(),
            identity.decisionType(),
            InputsHasher.hash(inputs),
            outputs,
            confidence,
            constraints,
            executionRef,
            Instant.now(clock));
    }
}
