package in.taskfarm.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics for farm todo coordination.
 *
 * Operation names are the caller API method names (createTodo, bulkAssign,
 * rebalanceWorkload, ...). Outcomes are "success" or the simple name of the
 * failure's exception class.
 */
public interface CoordinationMetrics {

    void recordOperation(String operation, String outcome, Duration latency);

    /**
     * A failed multi-todo write was rolled back.
     */
    void recordRollback(String operation);

    /**
     * Rolling back a failed write failed. Inconsistent data.
     */
    void recordPartialRollback(String operation);

    /**
     * A rebalance/optimize proposal was discarded because the farm changed.
     */
    void recordConflictRetry(String operation);

    void recordStoreRetry(String operation);

    void recordMoves(String operation, int count);

    void recordEventFailure(String eventType);

    void setCachedFarms(int count);
}
