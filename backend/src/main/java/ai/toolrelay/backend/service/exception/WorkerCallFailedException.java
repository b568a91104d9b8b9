package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * The selected worker was unreachable or answered with an error.
 */
public class WorkerCallFailedException extends ToolRelayException {

    public WorkerCallFailedException(String message) {
        super(message);
    }

    public WorkerCallFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String getErrorCode() {
        return "WorkerCallFailed";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
