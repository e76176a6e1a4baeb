package in.taskfarm.domain.common;

/**
 * Rebalance or optimization kept losing the optimistic check against concurrent
 * writes and ran out of attempts. Safe to retry.
 */
public class CoordinationConflictException extends CoordinationException {

    private final String farmId;
    private final int attempts;

    public CoordinationConflictException(String farmId, int attempts) {
        super(String.format("[%s] Farm state changed during %d reassignment attempts", farmId, attempts));
        this.farmId = farmId;
        this.attempts = attempts;
    }

    public String getFarmId() {
        return farmId;
    }

    public int getAttempts() {
        return attempts;
    }
}
