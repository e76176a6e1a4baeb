package in.taskfarm.domain.common;

/**
 * Root of all errors surfaced by farm todo coordination.
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
