package in.taskfarm.application.port.output;

import in.taskfarm.domain.todo.AgentTodo;

import java.util.List;
import java.util.Optional;

/**
 * Todo store. Writes are visible to the next read. Implementations report every
 * failure as {@link in.taskfarm.domain.common.TodoStoreException}.
 */
public interface TodoRepository {
    /**
     * Insert or replace by id.
     */
    void put(AgentTodo todo);

    Optional<AgentTodo> get(String todoId);

    /**
     * @return true if a todo was removed
     */
    boolean delete(String todoId);

    List<AgentTodo> listByAgent(String agentId);

    List<AgentTodo> listByFarm(String farmId);
}
