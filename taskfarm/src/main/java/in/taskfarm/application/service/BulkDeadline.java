package in.taskfarm.application.service;

import in.taskfarm.domain.common.TodoStoreException;

import java.time.Duration;

/**
 * Wall-clock budget for one bulk write, measured on the monotonic clock.
 */
public final class BulkDeadline {

    private final long expiresAtNanos;
    private final Duration budget;

    private BulkDeadline(Duration budget) {
        this.budget = budget;
        this.expiresAtNanos = System.nanoTime() + budget.toNanos();
    }

    public static BulkDeadline after(Duration budget) {
        return new BulkDeadline(budget);
    }

    public boolean isExpired() {
        return System.nanoTime() - expiresAtNanos > 0;
    }

    /**
     * @throws TodoStoreException flagged as timeout once the budget is spent
     */
    public void check(String stage) {
        if (isExpired()) {
            throw TodoStoreException.timeout(
                String.format("Bulk deadline of %dms exceeded %s", budget.toMillis(), stage));
        }
    }
}
