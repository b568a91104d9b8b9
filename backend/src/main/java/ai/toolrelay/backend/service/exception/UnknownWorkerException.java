package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Heartbeat or lookup for a worker id that is not registered (or has gone OFFLINE).
 * The worker is expected to register again.
 */
public class UnknownWorkerException extends ToolRelayException {

    public UnknownWorkerException(String message) {
        super(message);
    }

    public UnknownWorkerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getErrorCode() {
        return "UnknownWorker";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
