package in.taskfarm.domain.common;

/**
 * Persistence failure, including a bulk deadline overrun ({@link #isTimeout()}).
 * When raised from a bulk write, every record written before the failure has
 * already been rolled back.
 */
public class TodoStoreException extends CoordinationException {

    private final boolean timeout;

    public TodoStoreException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    private TodoStoreException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public static TodoStoreException timeout(String message) {
        return new TodoStoreException(message, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
