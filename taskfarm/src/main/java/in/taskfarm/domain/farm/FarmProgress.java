package in.taskfarm.domain.farm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Farm completion figures, all percentages in the range [0, 100].
 */
public record FarmProgress(
    double overallCompletion,
    Map<String, Double> agentPerformance,   // one entry per roster agent
    Map<String, Double> goalProgress        // goalId -> completion of todos derived from it
) {
    public FarmProgress {
        agentPerformance = Collections.unmodifiableMap(new LinkedHashMap<>(agentPerformance));
        goalProgress = Collections.unmodifiableMap(new LinkedHashMap<>(goalProgress));
    }

    public static FarmProgress empty() {
        return new FarmProgress(0.0, Map.of(), Map.of());
    }

    public double performanceOf(String agentId) {
        return agentPerformance.getOrDefault(agentId, 0.0);
    }
}
