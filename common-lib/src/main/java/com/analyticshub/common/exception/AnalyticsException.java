package com.analyticshub.common.exception;

import java.util.Map;

public class AnalyticsException extends RuntimeException {
    private final String agentId;
    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public AnalyticsException(String agentId, ErrorCode errorCode, String message) {
        this(agentId, errorCode, message, Map.of());
    }

    public AnalyticsException(String agentId, ErrorCode errorCode, String message,
                              Map<String, Object> details) {
        super("[" + agentId + "] " + message);
        this.agentId = agentId;
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public AnalyticsException(String agentId, ErrorCode errorCode, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
        this.agentId = agentId;
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    public String getAgentId() {
        return agentId;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
