package in.taskfarm.domain.farm;

import java.time.Instant;

/**
 * Proposed reassignment of one pending todo.
 *
 * {@code expectedUpdatedAt} is the todo's {@code updatedAt} in the snapshot the
 * move was computed from; the move is only applied if the stored todo still
 * carries it.
 */
public record TaskMove(
    String taskId,
    String fromAgent,
    String toAgent,
    String reason,
    Instant expectedUpdatedAt
) {
    public static final String REASON_OVERLOAD = "overload";
    public static final String REASON_ORPHANED = "orphaned";
    public static final String REASON_PERFORMANCE = "performance";
}
