package com.analyticshub.analytics.controller;

import com.analyticshub.common.decision.AgentIdentity;
import org.springframework.http.HttpHeaders;

final class AgentHeaders {

    static final String AGENT_ID      = "X-Agent-Id";
    static final String AGENT_VERSION = "X-Agent-Version";

    private AgentHeaders() {}

    static HttpHeaders of(AgentIdentity identity) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(AGENT_ID, identity.agentId());
        headers.set(AGENT_VERSION, identity.agentVersion());
        return headers;
    }
}
