package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scope a todo was issued at. Fixed for the life of the todo.
 */
public enum HierarchyLevel {
    INDIVIDUAL("individual"),
    GROUP("group"),
    FARM("farm");

    private final String wireName;

    HierarchyLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * GROUP and FARM todos only exist inside a farm.
     */
    public boolean requiresFarm() {
        return this != INDIVIDUAL;
    }

    @JsonCreator
    public static HierarchyLevel fromWire(String value) {
        for (HierarchyLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown hierarchy level: " + value);
    }
}
