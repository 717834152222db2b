package com.analyticshub.common.decision;

/**
 * Identity stamped onto every decision record an agent emits.
 */
public record AgentIdentity(String agentId, String agentVersion, String decisionType) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public static final String CONSENSUS_AGENT_ID           = "consensus-agent";
    public static final String CONSENSUS_DECISION_TYPE      = "analytics_consensus_summary";
    public static final String STRATEGIC_AGENT_ID           = "strategic-recommendation-agent";
    public static final String STRATEGIC_DECISION_TYPE      = "strategic_recommendation_summary";

    public static AgentIdentity consensus(String version) {
        return new AgentIdentity(CONSENSUS_AGENT_ID, version, CONSENSUS_DECISION_TYPE);
    }

    public static AgentIdentity strategicRecommendation(String version) {
        return new AgentIdentity(STRATEGIC_AGENT_ID, version, STRATEGIC_DECISION_TYPE);
    }
}
