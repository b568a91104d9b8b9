package ai.toolrelay.backend.tools;

/**
 * A tool could not serve a call, e.g. because the instance does not exist.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
