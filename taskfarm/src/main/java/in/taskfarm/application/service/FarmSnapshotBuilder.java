package in.taskfarm.application.service;

import in.taskfarm.application.port.output.FarmRosterRepository;
import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.AgentTodoList;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a full FarmTodoCoordination from committed store state.
 *
 * Reads the farm's todos and roster, groups todos per roster agent, separates
 * open todos owned by agents no longer on the roster, and runs the classifier
 * and aggregator over the result. No incremental patching.
 */
public final class FarmSnapshotBuilder {

    private final TodoRepository todoRepo;
    private final FarmRosterRepository rosterRepo;
    private final PriorityClassifier classifier;
    private final ProgressAggregator aggregator;
    private final Clock clock;

    public FarmSnapshotBuilder(TodoRepository todoRepo, FarmRosterRepository rosterRepo,
                               PriorityClassifier classifier, ProgressAggregator aggregator, Clock clock) {
        this.todoRepo = todoRepo;
        this.rosterRepo = rosterRepo;
        this.classifier = classifier;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    public FarmTodoCoordination build(String farmId, long version) {
        Instant now = clock.instant();
        List<AgentTodo> farmTodos = todoRepo.listByFarm(farmId);
        List<String> roster = rosterRepo.listAgents(farmId);
        Set<String> rosterSet = new HashSet<>(roster);

        Map<String, List<AgentTodo>> byAgent = new LinkedHashMap<>();
        for (String agentId : roster) {
            byAgent.put(agentId, new ArrayList<>());
        }

        List<AgentTodo> shared = new ArrayList<>();
        List<AgentTodo> orphaned = new ArrayList<>();
        for (AgentTodo todo : farmTodos) {
            if (todo.isShared()) {
                shared.add(todo);
            }
            if (rosterSet.contains(todo.agentId())) {
                byAgent.get(todo.agentId()).add(todo);
            } else if (todo.isActive()) {
                orphaned.add(todo);
            }
        }

        Map<String, AgentTodoList> lists = new LinkedHashMap<>();
        for (Map.Entry<String, List<AgentTodo>> entry : byAgent.entrySet()) {
            lists.put(entry.getKey(), AgentTodoList.of(entry.getKey(), entry.getValue(), now));
        }

        shared.sort(PriorityClassifier.TIE_BREAK);
        orphaned.sort(PriorityClassifier.TIE_BREAK);

        return new FarmTodoCoordination(
            farmId,
            version,
            shared,
            lists,
            orphaned,
            classifier.partition(farmTodos, now),
            aggregator.aggregate(farmTodos, roster),
            now
        );
    }
}
