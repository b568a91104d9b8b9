package ai.toolrelay.backend.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A proxied call exceeded its deadline. The worker is not evicted on this basis.
 */
public class WorkerTimeoutException extends ToolRelayException {

    public WorkerTimeoutException(String message) {
        super(message);
    }

    public WorkerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.GATEWAY_TIMEOUT;
    }

    @Override
    public String getErrorCode() {
        return "WorkerTimeout";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
