package in.taskfarm.domain.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Notification event. {@code seq} is assigned by the event repository on append.
 */
public record TodoEvent(
    long seq,
    TodoEventType type,

    // Scoping
    String farmId,           // null for todos outside any farm
    String agentId,          // null for farm-wide events

    // Correlation
    String todoId,           // null unless the event concerns a single todo

    JsonNode payload,
    Instant ts,
    String createdBy         // actor that caused the event
) {
    public TodoEvent withSeq(long newSeq, Instant newTs) {
        return new TodoEvent(newSeq, type, farmId, agentId, todoId, payload, newTs, createdBy);
    }

    /**
     * Check if a subscriber watching {@code targetFarmId} should see this event.
     */
    public boolean isVisibleToFarm(String targetFarmId) {
        return farmId != null && farmId.equals(targetFarmId);
    }

    /**
     * Check if a subscriber watching {@code targetAgentId} should see this event.
     */
    public boolean isVisibleToAgent(String targetAgentId) {
        return agentId != null && agentId.equals(targetAgentId);
    }
}
