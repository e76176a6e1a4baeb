package in.taskfarm.domain.common;

/**
 * Notification event types. All events are scoped to a farm, except todos
 * created outside any farm, which are scoped to their agent only.
 */
public enum TodoEventType {
    // ═══════════════════════════════════════════════════════════════
    // TODO LIFECYCLE
    // ═══════════════════════════════════════════════════════════════
    TODO_CREATED,
    TODOS_BULK_ASSIGNED,
    TODO_UPDATED,
    TODO_COMPLETED,
    TODOS_DELETED,

    // ═══════════════════════════════════════════════════════════════
    // FARM COORDINATION
    // ═══════════════════════════════════════════════════════════════
    WORKLOAD_REBALANCED,
    PRIORITIES_UPDATED,
    ASSIGNMENTS_OPTIMIZED,
    AGENT_JOINED_FARM,
    AGENT_LEFT_FARM,

    // ═══════════════════════════════════════════════════════════════
    // WEBSOCKET CONTROL
    // ═══════════════════════════════════════════════════════════════
    ACK,
    ERROR,
    PONG,
    BATCH
}
