package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.farm.FarmProgress;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.farm.MoveSet;
import in.taskfarm.domain.farm.PriorityBucket;
import in.taskfarm.domain.farm.TaskMove;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.AgentTodoList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * WorkloadBalancer - proposes pending-todo moves that even out active load.
 *
 * Pure: reads a committed snapshot and returns a {@link MoveSet}; nothing is
 * written here.
 *
 * LOAD:
 * active load = pending + inProgress todos of a roster agent. avg = mean load
 * over the roster. Overloaded: load > avg * overloadFactor. Underloaded:
 * load < avg * underloadFactor.
 *
 * STEPS:
 * 1. Orphans: pending todos whose owner left the roster go to the least-loaded
 *    roster agent. In-progress orphans stay with their owner.
 * 2. Thresholds: donors (most loaded first) give pending todos, least urgent
 *    bucket first and newest first, while still overloaded. Receivers are the
 *    underloaded agents, best performer first, and accept while
 *    load + 1 <= avg * overloadFactor.
 *
 * In-progress todos never move. No agent out of band, or avg == 0, yields no
 * threshold moves.
 */
public final class WorkloadBalancer {
    private static final Logger log = LoggerFactory.getLogger(WorkloadBalancer.class);

    private final Supplier<CoordinationConfig> config;

    public WorkloadBalancer(Supplier<CoordinationConfig> config) {
        this.config = config;
    }

    public MoveSet rebalance(FarmTodoCoordination snapshot) {
        List<String> roster = snapshot.rosterAgents();
        if (roster.isEmpty()) {
            return MoveSet.empty(snapshot.farmId(), snapshot.version());
        }

        CoordinationConfig cfg = config.get();
        FarmProgress progress = snapshot.farmProgress();
        Map<String, Integer> load = new HashMap<>();
        for (String agentId : roster) {
            load.put(agentId, snapshot.activeLoadOf(agentId));
        }

        List<TaskMove> moves = new ArrayList<>();
        reassignOrphans(snapshot, roster, load, progress, moves);

        int totalLoad = load.values().stream().mapToInt(Integer::intValue).sum();
        double avg = (double) totalLoad / roster.size();
        if (avg == 0) {
            return new MoveSet(snapshot.farmId(), snapshot.version(), moves);
        }

        double upper = avg * cfg.overloadFactor();
        double lower = avg * cfg.underloadFactor();

        List<String> donors = roster.stream()
            .filter(a -> load.get(a) > upper)
            .sorted(Comparator.comparingInt((String a) -> load.get(a)).reversed()
                .thenComparing(Comparator.naturalOrder()))
            .toList();
        List<String> receivers = roster.stream()
            .filter(a -> load.get(a) < lower)
            .sorted(Comparator.comparingDouble((String a) -> progress.performanceOf(a)).reversed()
                .thenComparingInt(load::get)
                .thenComparing(Comparator.naturalOrder()))
            .toList();

        if (donors.isEmpty() || receivers.isEmpty()) {
            log.debug("Farm {} in band: avg={}, donors={}, receivers={}",
                snapshot.farmId(), avg, donors.size(), receivers.size());
            return new MoveSet(snapshot.farmId(), snapshot.version(), moves);
        }

        Map<String, PriorityBucket> buckets = snapshot.priorities().bucketIndex();
        Comparator<AgentTodo> giveOrder =
            Comparator.comparingInt((AgentTodo t) -> bucketOf(buckets, t).rank()).reversed()
                .thenComparing(AgentTodo::createdAt, Comparator.reverseOrder())
                .thenComparing(AgentTodo::id, Comparator.reverseOrder());

        donorLoop:
        for (String donor : donors) {
            List<AgentTodo> candidates = pendingOf(snapshot.agentTodoLists().get(donor));
            candidates.sort(giveOrder);
            for (AgentTodo todo : candidates) {
                if (load.get(donor) <= upper) {
                    break;
                }
                String receiver = firstWithCapacity(receivers, load, upper);
                if (receiver == null) {
                    break donorLoop;
                }
                moves.add(new TaskMove(todo.id(), donor, receiver, TaskMove.REASON_OVERLOAD, todo.updatedAt()));
                load.merge(donor, -1, Integer::sum);
                load.merge(receiver, 1, Integer::sum);
            }
        }

        log.info("Farm {} rebalance proposal: {} moves (avg={}, upper={}, lower={})",
            snapshot.farmId(), moves.size(), avg, upper, lower);
        return new MoveSet(snapshot.farmId(), snapshot.version(), moves);
    }

    private void reassignOrphans(FarmTodoCoordination snapshot, List<String> roster, Map<String, Integer> load,
                                 FarmProgress progress, List<TaskMove> moves) {
        for (AgentTodo orphan : snapshot.orphanedTodos()) {
            if (!orphan.isPending()) {
                log.info("Orphaned todo {} is {} with departed agent {}, leaving in place",
                    orphan.id(), orphan.status().wireName(), orphan.agentId());
                continue;
            }
            String target = roster.stream()
                .min(Comparator.comparingInt((String a) -> load.get(a))
                    .thenComparing(Comparator.comparingDouble((String a) -> progress.performanceOf(a)).reversed())
                    .thenComparing(Comparator.naturalOrder()))
                .orElseThrow();
            moves.add(new TaskMove(orphan.id(), orphan.agentId(), target, TaskMove.REASON_ORPHANED,
                orphan.updatedAt()));
            load.merge(target, 1, Integer::sum);
        }
    }

    private static String firstWithCapacity(List<String> receivers, Map<String, Integer> load, double upper) {
        for (String receiver : receivers) {
            if (load.get(receiver) + 1 <= upper) {
                return receiver;
            }
        }
        return null;
    }

    static List<AgentTodo> pendingOf(AgentTodoList list) {
        List<AgentTodo> pending = new ArrayList<>();
        if (list == null) {
            return pending;
        }
        for (AgentTodo todo : list.todos()) {
            if (todo.isPending()) {
                pending.add(todo);
            }
        }
        return pending;
    }

    private static PriorityBucket bucketOf(Map<String, PriorityBucket> buckets, AgentTodo todo) {
        return buckets.getOrDefault(todo.id(), PriorityBucket.LONG_TERM);
    }
}
