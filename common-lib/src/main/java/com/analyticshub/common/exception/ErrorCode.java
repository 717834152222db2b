package com.analyticshub.common.exception;

/**
 * Failure codes surfaced to callers of the analytics agents.
 *
 * <p>Each code carries the HTTP status the service boundary maps it to. The core never
 * chooses a status itself; it only raises {@link AnalyticsException} with a code.
 */
public enum ErrorCode {

    CONSENSUS_VALIDATION_FAILURE(400),
    CONSENSUS_INSUFFICIENT_SIGNALS(400),
    CONSENSUS_COMPUTATION_ERROR(500),
    STRATEGIC_VALIDATION_FAILURE(400),
    STRATEGIC_COMPUTATION_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isClientError() {
        return httpStatus < 500;
    }
}
