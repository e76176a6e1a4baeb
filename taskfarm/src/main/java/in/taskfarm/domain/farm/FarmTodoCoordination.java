package in.taskfarm.domain.farm;

import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.AgentTodoList;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Committed view of one farm's coordination state.
 *
 * Rebuilt in full after every mutation. {@code version} increases by one per
 * rebuild and is the token rebalance proposals are checked against.
 * {@code agentTodoLists} holds one entry per roster agent (roster order), even
 * for agents with no todos. {@code orphanedTodos} are open farm todos whose
 * owner has left the roster.
 */
public record FarmTodoCoordination(
    String farmId,
    long version,
    List<AgentTodo> sharedTodos,
    Map<String, AgentTodoList> agentTodoLists,
    List<AgentTodo> orphanedTodos,
    PriorityBuckets priorities,
    FarmProgress farmProgress,
    Instant builtAt
) {
    public FarmTodoCoordination {
        sharedTodos = List.copyOf(sharedTodos);
        agentTodoLists = Collections.unmodifiableMap(new LinkedHashMap<>(agentTodoLists));
        orphanedTodos = List.copyOf(orphanedTodos);
    }

    public List<String> rosterAgents() {
        return List.copyOf(agentTodoLists.keySet());
    }

    public boolean hasAgent(String agentId) {
        return agentTodoLists.containsKey(agentId);
    }

    public int activeLoadOf(String agentId) {
        AgentTodoList list = agentTodoLists.get(agentId);
        return list == null ? 0 : list.activeLoad();
    }
}
