package ai.toolrelay.backend.worker;

/**
 * The master could not be reached or rejected a call for a reason other than
 * an unknown worker id.
 */
public class MasterUnavailableException extends RuntimeException {

    public MasterUnavailableException(String message) {
        super(message);
    }

    public MasterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
