package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed registration or request. Rejected, not retried.
 */
public class ValidationException extends ToolRelayException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getErrorCode() {
        return "ValidationError";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
