package in.taskfarm.domain.farm;

import in.taskfarm.domain.todo.AgentTodo;

/**
 * Outcome of a single-todo status change: the updated todo plus the rebuilt farm
 * snapshot ({@code farm} is null for todos outside any farm).
 */
public record TodoUpdateResult(
    AgentTodo todo,
    FarmTodoCoordination farm
) {
}
