package com.platform.hacontroller.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every REST endpoint on failure.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code, e.g. HA-510.
     */
    private String code;

    private String message;

    private String detail;

    /**
     * Fatal errors need an operator; recoverable ones can be retried.
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    /**
     * Correlates with the traceId in the log lines of the same request.
     */
    private String traceId;

    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
