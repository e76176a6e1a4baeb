package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an agent todo.
 *
 * Allowed transitions:
 * - PENDING -> IN_PROGRESS | COMPLETED | CANCELLED
 * - IN_PROGRESS -> COMPLETED | CANCELLED
 * - COMPLETED, CANCELLED are terminal
 */
public enum TodoStatus {
    PENDING("pending"),
    IN_PROGRESS("inProgress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireName;

    TodoStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TodoStatus fromWire(String value) {
        for (TodoStatus status : values()) {
            if (status.wireName.equals(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown todo status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    /**
     * Check whether moving from this status to {@code target} is permitted.
     * Same-state transitions are never permitted.
     */
    public boolean canTransitionTo(TodoStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case PENDING -> true;
            case IN_PROGRESS -> target == COMPLETED || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
