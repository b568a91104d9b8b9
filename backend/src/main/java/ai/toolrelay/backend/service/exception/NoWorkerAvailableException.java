package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * No ONLINE worker advertises the requested tool.
 */
public class NoWorkerAvailableException extends ToolRelayException {

    public NoWorkerAvailableException(String message) {
        super(message);
    }

    public NoWorkerAvailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public String getErrorCode() {
        return "NoWorkerAvailable";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
