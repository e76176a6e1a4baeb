package in.taskfarm.domain.common;

import java.util.List;

/**
 * Rolling back a failed bulk write failed itself. The listed todos may be left
 * in an inconsistent state and need operator attention. Never retried.
 */
public class PartialRollbackException extends CoordinationException {

    private final List<String> inconsistentTodoIds;

    public PartialRollbackException(String message, List<String> inconsistentTodoIds, Throwable cause) {
        super(message + " (inconsistent todos: " + inconsistentTodoIds + ")", cause);
        this.inconsistentTodoIds = List.copyOf(inconsistentTodoIds);
    }

    public List<String> getInconsistentTodoIds() {
        return inconsistentTodoIds;
    }
}
