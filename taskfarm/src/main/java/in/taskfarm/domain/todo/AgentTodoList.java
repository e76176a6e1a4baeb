package in.taskfarm.domain.todo;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Derived view of one agent's todos, ordered by creation time.
 */
public record AgentTodoList(
    String agentId,
    List<AgentTodo> todos,
    TodoSummary summary
) {
    private static final Comparator<AgentTodo> CREATION_ORDER =
        Comparator.comparing(AgentTodo::createdAt).thenComparing(AgentTodo::id);

    public AgentTodoList {
        todos = List.copyOf(todos);
    }

    public static AgentTodoList of(String agentId, List<AgentTodo> todos, Instant now) {
        List<AgentTodo> ordered = todos.stream().sorted(CREATION_ORDER).toList();
        return new AgentTodoList(agentId, ordered, TodoSummary.of(ordered, now));
    }

    public static AgentTodoList empty(String agentId) {
        return new AgentTodoList(agentId, List.of(), TodoSummary.empty());
    }

    public int activeLoad() {
        return summary.activeLoad();
    }
}
