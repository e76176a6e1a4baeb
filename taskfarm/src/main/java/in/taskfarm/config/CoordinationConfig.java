package in.taskfarm.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Tunables for farm todo coordination.
 *
 * Read on every operation through CoordinationConfigService, so changes made via
 * the admin endpoint apply to the next operation without a restart.
 */
public record CoordinationConfig(
    @JsonProperty("dueSoonHorizonMinutes")
    long dueSoonHorizonMinutes,     // todos due within this window are IMMEDIATE

    @JsonProperty("overloadFactor")
    double overloadFactor,          // load > avg * factor means overloaded

    @JsonProperty("underloadFactor")
    double underloadFactor,         // load < avg * factor means underloaded

    @JsonProperty("maxConflictRetries")
    int maxConflictRetries,         // rebalance attempts before giving up

    @JsonProperty("bulkDeadlineMs")
    long bulkDeadlineMs,            // wall-clock budget for one bulk write

    @JsonProperty("storeRetryAttempts")
    int storeRetryAttempts,         // total attempts for an operation failing with a store error

    @JsonProperty("storeRetryInitialDelayMs")
    long storeRetryInitialDelayMs,  // first backoff, doubled per attempt

    @JsonProperty("maxBulkSize")
    int maxBulkSize,                // todos per bulk command

    @JsonProperty("optimizeMinPerformance")
    double optimizeMinPerformance,  // receivers of optimized work need at least this (0-100)

    @JsonProperty("optimizeWeakPerformance")
    double optimizeWeakPerformance  // donors of optimized work are below this (0-100)
) {
    public static CoordinationConfig defaults() {
        return new CoordinationConfig(
            24 * 60,   // 24h due-soon horizon
            1.2,       // 20% above average is overloaded
            0.8,       // 20% below average is underloaded
            3,         // 3 optimistic attempts
            5000,      // 5s bulk deadline
            3,         // 3 store attempts
            100,       // 100ms, 200ms backoff
            500,       // 500 todos per bulk command
            80.0,      // proven agents
            50.0       // struggling agents
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return dueSoonHorizonMinutes > 0
            && overloadFactor > 1.0
            && underloadFactor > 0 && underloadFactor < 1.0
            && maxConflictRetries >= 1
            && bulkDeadlineMs > 0
            && storeRetryAttempts >= 1
            && storeRetryInitialDelayMs > 0
            && maxBulkSize > 0
            && optimizeMinPerformance >= 0 && optimizeMinPerformance <= 100
            && optimizeWeakPerformance >= 0 && optimizeWeakPerformance <= optimizeMinPerformance;
    }

    @JsonIgnore
    public Duration dueSoonHorizon() {
        return Duration.ofMinutes(dueSoonHorizonMinutes);
    }

    @JsonIgnore
    public Duration bulkDeadline() {
        return Duration.ofMillis(bulkDeadlineMs);
    }

    @JsonIgnore
    public Duration storeRetryInitialDelay() {
        return Duration.ofMillis(storeRetryInitialDelayMs);
    }
}
