package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that are recoverable at the coordinator boundary.
 * Each subtype carries the HTTP status and error code returned to the caller
 * and whether the caller may retry the same request.
 */
public abstract class ToolRelayException extends RuntimeException {

    protected ToolRelayException(String message) {
        super(message);
    }

    protected ToolRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    public abstract String getErrorCode();

    public abstract boolean isRetryable();
}
