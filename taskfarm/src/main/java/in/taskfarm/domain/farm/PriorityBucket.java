package in.taskfarm.domain.farm;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency bucket. Lower rank means more urgent.
 */
public enum PriorityBucket {
    IMMEDIATE("immediate", 0),
    PLANNED("planned", 1),
    LONG_TERM("longTerm", 2);

    private final String wireName;
    private final int rank;

    PriorityBucket(String wireName, int rank) {
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
}
