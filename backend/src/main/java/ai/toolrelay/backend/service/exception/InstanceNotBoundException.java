package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * No live binding exists for an instance id, either because it was never created
 * or because its worker was evicted. The caller may create a fresh instance but
 * loses prior session state.
 */
public class InstanceNotBoundException extends ToolRelayException {

    public InstanceNotBoundException(String message) {
        super(message);
    }

    public InstanceNotBoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getErrorCode() {
        return "InstanceNotBound";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
