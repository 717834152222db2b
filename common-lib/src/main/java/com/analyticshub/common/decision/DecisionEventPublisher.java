package com.analyticshub.common.decision;

/**
 * Abstraction for handing a {@link DecisionRecord} to the persistence layer once an
 * invocation completes.
 *
 * <p>Current implementation: {@code RuVectorDecisionEventPublisher} POSTs the record to
 * ruvector-service (fire-and-forget WebClient call).
 */
public interface DecisionEventPublisher {

    /**
     * Publish a completed decision record.
     * Implementations MUST be non-blocking and MUST NOT throw on delivery failure; a lost
     * record is logged, the invocation still succeeds.
     *
     * @param record the decision record to publish
     */
    void publish(DecisionRecord<?> record);
}
