package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A create call for the same instance id is still waiting on its worker.
 */
public class InstanceCreationInProgressException extends ToolRelayException {

    public InstanceCreationInProgressException(String message) {
        super(message);
    }

    public InstanceCreationInProgressException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getErrorCode() {
        return "InstanceCreationInProgress";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
