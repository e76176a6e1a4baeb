package in.taskfarm.application.service;

import in.taskfarm.domain.farm.FarmProgress;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.TodoStatus;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Recomputes farm completion from scratch on every call.
 *
 * - overallCompletion = 100 * completed / total over all farm todos (0 when empty)
 * - agentPerformance[agent] = 100 * completed / total over that agent's todos,
 *   0 for roster agents with no todos
 * - goalProgress[goal] = same ratio over todos carrying that goalId
 *
 * Cancelled todos count toward totals but never toward completed.
 */
public final class ProgressAggregator {

    public FarmProgress aggregate(Collection<AgentTodo> farmTodos, List<String> rosterAgents) {
        int total = farmTodos.size();
        int completed = 0;

        Map<String, int[]> perAgent = new HashMap<>();
        Map<String, int[]> perGoal = new TreeMap<>();

        for (AgentTodo todo : farmTodos) {
            boolean done = todo.status() == TodoStatus.COMPLETED;
            if (done) {
                completed++;
            }
            tally(perAgent, todo.agentId(), done);
            if (todo.goalId() != null) {
                tally(perGoal, todo.goalId(), done);
            }
        }

        Map<String, Double> agentPerformance = new LinkedHashMap<>();
        for (String agentId : rosterAgents) {
            int[] counts = perAgent.get(agentId);
            agentPerformance.put(agentId, counts == null ? 0.0 : percent(counts[1], counts[0]));
        }

        Map<String, Double> goalProgress = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> entry : perGoal.entrySet()) {
            goalProgress.put(entry.getKey(), percent(entry.getValue()[1], entry.getValue()[0]));
        }

        return new FarmProgress(percent(completed, total), agentPerformance, goalProgress);
    }

    // counts[0] = total, counts[1] = completed
    private static void tally(Map<String, int[]> counters, String key, boolean done) {
        int[] counts = counters.computeIfAbsent(key, k -> new int[2]);
        counts[0]++;
        if (done) {
            counts[1]++;
        }
    }

    static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.min(100.0, Math.max(0.0, 100.0 * part / whole));
    }
}
