package in.taskfarm.application.port.input;

import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.command.BulkTodoOperation;
import in.taskfarm.domain.command.FarmGoal;
import in.taskfarm.domain.farm.FarmTodoCoordination;
import in.taskfarm.domain.farm.TodoUpdateResult;
import in.taskfarm.domain.todo.AgentTodoList;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.TodoFilter;
import in.taskfarm.domain.todo.TodoStatus;

import java.util.List;

/**
 * FarmTodoService - caller API for farm-level todo coordination.
 *
 * CONTRACT:
 * - Every mutation for a farm is serialized with every other mutation for that
 *   farm, in submission order.
 * - Every mutation returns a snapshot rebuilt after the write committed.
 * - Bulk writes are all-or-nothing: on failure every record already written is
 *   rolled back before the error surfaces.
 *
 * ERRORS (all unchecked, rooted at CoordinationException):
 * - TodoValidationException: bad input, nothing written
 * - TodoNotFoundException: unknown todo id
 * - CoordinationConflictException: rebalance lost to concurrent writes too often
 * - TodoStoreException: persistence failure or deadline overrun, after rollback
 * - PartialRollbackException: rollback failed, operator escalation raised
 */
public interface FarmTodoService {

    /**
     * Last committed snapshot of a farm. Unknown farms yield an empty snapshot.
     */
    FarmTodoCoordination getFarmTodos(String farmId);

    /**
     * Create one todo inside a farm. An owner not yet on the farm roster is
     * enrolled.
     */
    FarmTodoCoordination createTodo(CreateTodoRequest request);

    /**
     * Create one todo outside any farm. Serialized per agent.
     */
    AgentTodoList createAgentTodo(CreateTodoRequest request);

    FarmTodoCoordination bulkOperation(BulkTodoOperation operation);

    /**
     * Expand one template into a GROUP todo per distinct target agent.
     */
    FarmTodoCoordination bulkAssign(String farmId, BulkAssignRequest request);

    TodoUpdateResult updateTodoStatus(String todoId, TodoStatus status, String actor);

    /**
     * Move pending work from overloaded agents (and agents that left the farm) to
     * underloaded ones.
     */
    FarmTodoCoordination rebalanceWorkload(String farmId);

    /**
     * Move pending high-priority work from weak agents to proven ones.
     */
    FarmTodoCoordination optimizeAssignments(String farmId);

    /**
     * Re-run classification over all open todos and rebuild the buckets.
     */
    FarmTodoCoordination updatePriorities(String farmId);

    FarmTodoCoordination createTodosFromGoal(String farmId, FarmGoal goal, List<String> agentIds);

    AgentTodoList getAgentTodos(String agentId, TodoFilter filter);

    FarmTodoCoordination addAgentToFarm(String farmId, String agentId);

    /**
     * Remove an agent from the roster. Its open todos stay in place as orphans
     * until the next rebalance moves the pending ones.
     */
    FarmTodoCoordination removeAgentFromFarm(String farmId, String agentId);
}
