package in.taskfarm.domain.todo;

/**
 * Optional filters for listing an agent's todos. Null fields match everything.
 */
public record TodoFilter(
    TodoStatus status,
    TodoPriority priority,
    TodoCategory category,
    String farmId
) {
    public static TodoFilter none() {
        return new TodoFilter(null, null, null, null);
    }

    public boolean matches(AgentTodo todo) {
        return (status == null || todo.status() == status)
            && (priority == null || todo.priority() == priority)
            && (category == null || todo.category() == category)
            && (farmId == null || farmId.equals(todo.farmId()));
    }
}
