package ai.toolrelay.backend.controller;

import ai.toolrelay.backend.model.dto.ErrorResponse;
import ai.toolrelay.backend.service.exception.ToolRelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps coordinator failures to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String VALIDATION_ERROR = "ValidationError";

    /**
     * Uses the status, code and retryability carried by the exception.
     */
    @ExceptionHandler(ToolRelayException.class)
    public ResponseEntity<ErrorResponse> handleToolRelay(ToolRelayException e) {
        if (e.getStatus().is5xxServerError()) {
            log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getErrorCode(), e.getMessage());
        }
        return build(e.getStatus(), e.getErrorCode(), e.getMessage(), e.isRetryable());
    }

    /**
     * Bean validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField() + " is invalid")
                .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, message, false);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return build(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Malformed request: " + e.getMessage(), false);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, boolean retryable) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .retryable(retryable)
                .timestamp(Instant.now())
                .build());
    }
}
