package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.common.TodoStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for store failures.
 *
 * Only {@link TodoStoreException} is retried. Validation errors, conflicts and
 * partial rollbacks pass straight through. Each retry re-runs {@code action},
 * so the action must not repeat writes that already committed.
 *
 * Usage:
 * <pre>
 * StoreRetryPolicy policy = StoreRetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(100))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * FarmTodoCoordination result = policy.execute("bulkAssign", () -> doBulkAssign());
 * </pre>
 */
public final class StoreRetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(StoreRetryPolicy.class);

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Consumer<String> retryListener;

    private StoreRetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                             int maxAttempts, Consumer<String> retryListener) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.retryListener = retryListener;
    }

    /**
     * Run {@code action}, retrying on store failure until it succeeds or the
     * attempt budget is spent. The last failure is rethrown.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        Duration delay = initialDelay;
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TodoStoreException e) {
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                    operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                retryListener.accept(operation);
                sleep(delay, e);
                delay = nextDelay(delay);
                attempt++;
            }
        }
    }

    /**
     * Delay that follows {@code current}.
     */
    Duration nextDelay(Duration current) {
        long next = (long) (current.toMillis() * multiplier);
        return Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
    }

    private static void sleep(Duration delay, TodoStoreException pending) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy matching the current coordination settings.
     */
    public static StoreRetryPolicy fromConfig(CoordinationConfig config, Consumer<String> retryListener) {
        return builder()
            .initialDelay(config.storeRetryInitialDelay())
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxAttempts(config.storeRetryAttempts())
            .retryListener(retryListener)
            .build();
    }

    /**
     * Builder for StoreRetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 3;
        private Consumer<String> retryListener = operation -> { };

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryListener(Consumer<String> retryListener) {
            this.retryListener = retryListener;
            return this;
        }

        public StoreRetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new StoreRetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts, retryListener);
        }
    }
}
