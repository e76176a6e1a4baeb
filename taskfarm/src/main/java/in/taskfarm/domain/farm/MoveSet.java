package in.taskfarm.domain.farm;

import java.util.List;

/**
 * Ordered moves computed against one snapshot version.
 */
public record MoveSet(
    String farmId,
    long basedOnVersion,
    List<TaskMove> moves
) {
    public MoveSet {
        moves = List.copyOf(moves);
    }

    public static MoveSet empty(String farmId, long basedOnVersion) {
        return new MoveSet(farmId, basedOnVersion, List.of());
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }

    public int size() {
        return moves.size();
    }
}
