package com.analyticshub.analytics.dto;

import com.analyticshub.common.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ErrorResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("error")   ErrorBody error
) {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ErrorBody(
        @JsonProperty("code")    ErrorCode code,
        @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, Object> details
    ) {}

    public static ErrorResponse of(ErrorCode code, String message, Map<String, Object> details) {
        return new ErrorResponse(false, new ErrorBody(code, message, details));
    }
}
