package in.taskfarm.domain.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BulkOperationType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String wireName;

    BulkOperationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static BulkOperationType fromWire(String value) {
        for (BulkOperationType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown bulk operation: " + value);
    }
}
