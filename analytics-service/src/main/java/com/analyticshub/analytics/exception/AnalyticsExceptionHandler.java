package com.analyticshub.analytics.exception;

import com.analyticshub.analytics.dto.ErrorResponse;
import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

/**
 * Maps failures to the {@code {success:false, error:{code, message, details?}}} envelope.
 *
 * <p>Codes of the strategic agent are used for requests under
 * {@code /api/v1/strategic-recommendations}, consensus codes everywhere else.
 */
@RestControllerAdvice
public class AnalyticsExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsExceptionHandler.class);

    static final String STRATEGIC_PATH_PREFIX = "/api/v1/strategic-recommendations";

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException ex) {
        ErrorCode code = ex.getErrorCode();
        if (code.isClientError()) {
            log.warn("Client error: code={} message={}", code, ex.getMessage());
        } else {
            log.error("Server error: code={} message={}", code, ex.getMessage(), ex);
        }
        return build(code, ex.getMessage(), ex.getDetails());
    }

    /** Undecodable bodies, unknown enum values and unsupported value types. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        ErrorCode code = isStrategic(exchange)
            ? ErrorCode.STRATEGIC_VALIDATION_FAILURE : ErrorCode.CONSENSUS_VALIDATION_FAILURE;
        String reason = ex.getMostSpecificCause().getMessage();
        log.warn("Malformed request body. path={} reason={}", exchange.getRequest().getPath(), reason);
        return build(code, "Invalid input: " + ex.getReason(), Map.of("cause", String.valueOf(reason)));
    }

    /** Routing and content-negotiation failures keep their own status. */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Void> handleStatus(ResponseStatusException ex) {
        log.debug("Request rejected. status={} reason={}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error. path={}", exchange.getRequest().getPath(), ex);
        ErrorCode code = isStrategic(exchange)
            ? ErrorCode.STRATEGIC_COMPUTATION_ERROR : ErrorCode.CONSENSUS_COMPUTATION_ERROR;
        return build(code, "An unexpected error occurred", null);
    }

    private static boolean isStrategic(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value().startsWith(STRATEGIC_PATH_PREFIX);
    }

    private static ResponseEntity<ErrorResponse> build(ErrorCode code, String message, Map<String, Object> details) {
        return ResponseEntity.status(code.getHttpStatus()).body(ErrorResponse.of(code, message, details));
    }
}
