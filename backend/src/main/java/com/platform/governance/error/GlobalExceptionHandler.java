package com.platform.governance.error;

import com.platform.governance.observability.LoggingConfig;
import com.platform.governance.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions from the policy and translation APIs to {@link ErrorResponse}.
 * 
 * Integrity and encryption failures are always fatal: the response tells the
 * caller that no compliance output for the key can be trusted.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Rejected request: {}", traceId, ex.getMessage());
        
        ErrorResponse.ErrorResponseBuilder body = base(ex.getErrorCode(), HttpStatus.BAD_REQUEST, ex.getMessage(), 
            request, traceId);
        if (ex.getField() != null) {
            body.fieldErrors(List.of(new ErrorResponse.FieldError(ex.getField(), ex.getMessage(), ex.getRejectedValue())));
        }
        return respond(ex.getErrorCode(), HttpStatus.BAD_REQUEST, body);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.info("[{}] {}", traceId, ex.getMessage());
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventType", ex.getPolicyKey().eventType().getValue());
        metadata.put("framework", ex.getPolicyKey().framework().getValue());
        if (ex.getVersion() != null) {
            metadata.put("version", ex.getVersion());
        }
        return respond(ex.getErrorCode(), HttpStatus.NOT_FOUND, 
            base(ex.getErrorCode(), HttpStatus.NOT_FOUND, ex.getMessage(), request, traceId).metadata(metadata));
    }
    
    @ExceptionHandler(PolicyIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(PolicyIntegrityException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Policy integrity failure on version {}: {}", 
            traceId, ex.getPolicyVersionId(), ex.getMessage(), ex);
        
        ErrorResponse.ErrorResponseBuilder body = base(ex.getErrorCode(), HttpStatus.INTERNAL_SERVER_ERROR, 
            ex.getMessage(), request, traceId);
        if (ex.getPolicyVersionId() != null) {
            body.metadata(Map.of("policyVersionId", ex.getPolicyVersionId()));
        }
        return respond(ex.getErrorCode(), HttpStatus.INTERNAL_SERVER_ERROR, body);
    }
    
    /**
     * Encryption, serialization and translation failures.
     */
    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<ErrorResponse> handleGovernance(GovernanceException ex, HttpServletRequest request) {
        String traceId = traceId();
        if (ex.isFatal()) {
            log.error("[{}] {} {}", traceId, ex.getErrorCode().getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} {}", traceId, ex.getErrorCode().getCode(), ex.getMessage());
        }
        HttpStatus status = ex.isFatal() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.BAD_REQUEST;
        return respond(ex.getErrorCode(), status, base(ex.getErrorCode(), status, ex.getMessage(), request, traceId));
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex, 
            HttpServletRequest request) {
        String traceId = traceId();
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage(), fe.getRejectedValue()))
            .toList();
        log.warn("[{}] Request body failed validation on {} field(s)", traceId, fieldErrors.size());
        
        return respond(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, 
            base(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, "Request validation failed", request, traceId)
                .fieldErrors(fieldErrors));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, 
            HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Unreadable request body: {}", traceId, ex.getMostSpecificCause().getMessage());
        
        return respond(ErrorCode.INVALID_REQUEST, HttpStatus.BAD_REQUEST, 
            base(ErrorCode.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "Request body could not be read", request, traceId)
                .detail(ex.getMostSpecificCause().getMessage()));
    }
    
    /**
     * Two writers raced on the same policy lineage.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentWrite(OptimisticLockingFailureException ex, 
            HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Concurrent policy write: {}", traceId, ex.getMessage());
        
        return respond(ErrorCode.OPTIMISTIC_LOCK_FAILURE, HttpStatus.CONFLICT, 
            base(ErrorCode.OPTIMISTIC_LOCK_FAILURE, HttpStatus.CONFLICT, 
                "Policy lineage changed concurrently, retry the request", request, traceId));
    }
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Policy store unavailable: {}", traceId, ex.getMessage(), ex);
        
        return respond(ErrorCode.DATABASE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, 
            base(ErrorCode.DATABASE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "Policy store operation failed", 
                request, traceId));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Unexpected {}: {}", traceId, ex.getClass().getSimpleName(), ex.getMessage(), ex);
        
        return respond(ErrorCode.UNEXPECTED_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, 
            base(ErrorCode.UNEXPECTED_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, 
                ErrorCode.UNEXPECTED_ERROR.getDefaultMessage(), request, traceId));
    }
    
    private static ErrorResponse.ErrorResponseBuilder base(ErrorCode errorCode, HttpStatus status, String message,
            HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }
    
    private ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, HttpStatus status, 
            ErrorResponse.ErrorResponseBuilder body) {
        metricsRegistry.recordError(errorCode);
        return ResponseEntity.status(status).body(body.build());
    }
    
    private static String traceId() {
        String correlationId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        return correlationId != null ? correlationId : UUID.randomUUID().toString().substring(0, 8);
    }
}
