package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.farm.FarmProgress;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.farm.MoveSet;
import in.taskfarm.domain.farm.TaskMove;
import in.taskfarm.domain.todo.AgentTodo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Proposes moving pending HIGH and CRITICAL todos from weak agents (performance
 * below optimizeWeakPerformance) to proven agents (performance at or above
 * optimizeMinPerformance). Most urgent work moves first; the best proven agent
 * is filled first and accepts while load + 1 <= max(avg * overloadFactor, 1).
 *
 * Pure, like {@link WorkloadBalancer}.
 */
public final class AssignmentOptimizer {
    private static final Logger log = LoggerFactory.getLogger(AssignmentOptimizer.class);

    private final Supplier<CoordinationConfig> config;

    public AssignmentOptimizer(Supplier<CoordinationConfig> config) {
        this.config = config;
    }

    public MoveSet optimize(FarmTodoCoordination snapshot) {
        List<String> roster = snapshot.rosterAgents();
        MoveSet none = MoveSet.empty(snapshot.farmId(), snapshot.version());
        if (roster.size() < 2) {
            return none;
        }

        CoordinationConfig cfg = config.get();
        FarmProgress progress = snapshot.farmProgress();
        Map<String, Integer> load = new HashMap<>();
        for (String agentId : roster) {
            load.put(agentId, snapshot.activeLoadOf(agentId));
        }

        int totalLoad = load.values().stream().mapToInt(Integer::intValue).sum();
        if (totalLoad == 0) {
            return none;
        }
        double capacity = Math.max((double) totalLoad / roster.size() * cfg.overloadFactor(), 1.0);

        List<String> proven = roster.stream()
            .filter(a -> progress.performanceOf(a) >= cfg.optimizeMinPerformance())
            .sorted(Comparator.comparingDouble((String a) -> progress.performanceOf(a)).reversed()
                .thenComparingInt(load::get)
                .thenComparing(Comparator.naturalOrder()))
            .toList();
        List<String> weak = roster.stream()
            .filter(a -> progress.performanceOf(a) < cfg.optimizeWeakPerformance())
            .sorted(Comparator.comparingDouble((String a) -> progress.performanceOf(a))
                .thenComparing(Comparator.comparingInt((String a) -> load.get(a)).reversed())
                .thenComparing(Comparator.naturalOrder()))
            .toList();

        if (proven.isEmpty() || weak.isEmpty()) {
            return none;
        }

        List<TaskMove> moves = new ArrayList<>();
        outer:
        for (String donor : weak) {
            List<AgentTodo> candidates = WorkloadBalancer.pendingOf(snapshot.agentTodoLists().get(donor));
            candidates.removeIf(t -> !t.isHighPriority());
            candidates.sort(PriorityClassifier.TIE_BREAK);
            for (AgentTodo todo : candidates) {
                String receiver = null;
                for (String candidate : proven) {
                    if (load.get(candidate) + 1 <= capacity) {
                        receiver = candidate;
                        break;
                    }
                }
                if (receiver == null) {
                    break outer;
                }
                moves.add(new TaskMove(todo.id(), donor, receiver, TaskMove.REASON_PERFORMANCE, todo.updatedAt()));
                load.merge(donor, -1, Integer::sum);
                load.merge(receiver, 1, Integer::sum);
            }
        }

        log.info("Farm {} optimization proposal: {} moves ({} proven, {} weak agents)",
            snapshot.farmId(), moves.size(), proven.size(), weak.size());
        return new MoveSet(snapshot.farmId(), snapshot.version(), moves);
    }
}
