package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Todo priority. Higher rank sorts first inside a priority bucket.
 */
public enum TodoPriority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String wireName;
    private final int rank;

    TodoPriority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    public boolean isHighOrAbove() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonCreator
    public static TodoPriority fromWire(String value) {
        for (TodoPriority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown todo priority: " + value);
    }

    /**
     * Map a farm goal priority onto a todo priority ("urgent" becomes CRITICAL).
     */
    public static TodoPriority fromGoalPriority(String goalPriority) {
        if (goalPriority == null || goalPriority.isBlank()) {
            return MEDIUM;
        }
        if ("urgent".equalsIgnoreCase(goalPriority.trim())) {
            return CRITICAL;
        }
        return fromWire(goalPriority.trim());
    }
}
