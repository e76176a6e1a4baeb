package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TodoCategory {
    TRADING("trading"),
    ANALYSIS("analysis"),
    COORDINATION("coordination"),
    GOAL("goal");

    private final String wireName;

    TodoCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TodoCategory fromWire(String value) {
        for (TodoCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown todo category: " + value);
    }
}
