package com.platform.governance.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of every non-2xx API response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * {@link ErrorCode} code, e.g. GV-520.
     */
    String code;
    
    String message;
    
    String detail;
    
    /**
     * True when compliance output can no longer be trusted and an operator must step in.
     */
    boolean fatal;
    
    int status;
    
    Instant timestamp;
    
    String path;
    
    /**
     * Correlation id of the request, as found in the logs.
     */
    String traceId;
    
    List<FieldError> fieldErrors;
    
    Map<String, Object> metadata;
    
    @Value
    public static class FieldError {
        String field;
        String message;
        Object rejectedValue;
    }
}
