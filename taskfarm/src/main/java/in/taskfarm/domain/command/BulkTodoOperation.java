package in.taskfarm.domain.command;

import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.TodoStatus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Bulk command against one farm. Shape is checked at construction, so an
 * instance that exists is well-formed; content checks (titles, ownership,
 * transitions) happen when it is executed.
 *
 * Usage:
 * <pre>
 * BulkTodoOperation.create("farm-1", requests);
 * BulkTodoOperation.update("farm-1", ids, TodoStatus.CANCELLED, "farm_coordinator");
 * BulkTodoOperation.delete("farm-1", ids);
 * </pre>
 */
public record BulkTodoOperation(
    String farmId,
    BulkOperationType type,
    List<CreateTodoRequest> creates,   // CREATE only
    List<String> todoIds,              // UPDATE and DELETE, duplicates collapsed
    TodoStatus targetStatus,           // UPDATE only
    String actor
) {
    public BulkTodoOperation {
        if (farmId == null || farmId.isBlank()) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_FARM_ID);
        }
        if (type == null) {
            throw new TodoValidationException(ValidationErrorCode.MALFORMED_REQUEST, "operation type is required");
        }
        creates = creates == null ? List.of() : List.copyOf(creates);
        todoIds = todoIds == null ? List.of() : distinct(todoIds);
        actor = actor == null || actor.isBlank() ? AgentTodo.FARM_COORDINATOR : actor.trim();

        switch (type) {
            case CREATE -> {
                if (creates.isEmpty()) {
                    throw new TodoValidationException(ValidationErrorCode.EMPTY_BULK_OPERATION);
                }
            }
            case UPDATE -> {
                if (todoIds.isEmpty()) {
                    throw new TodoValidationException(ValidationErrorCode.EMPTY_BULK_OPERATION);
                }
                if (targetStatus == null) {
                    throw new TodoValidationException(ValidationErrorCode.MISSING_STATUS);
                }
            }
            case DELETE -> {
                if (todoIds.isEmpty()) {
                    throw new TodoValidationException(ValidationErrorCode.EMPTY_BULK_OPERATION);
                }
            }
        }
    }

    public static BulkTodoOperation create(String farmId, List<CreateTodoRequest> requests) {
        return new BulkTodoOperation(farmId, BulkOperationType.CREATE, requests, null, null, null);
    }

    public static BulkTodoOperation update(String farmId, List<String> todoIds, TodoStatus status, String actor) {
        return new BulkTodoOperation(farmId, BulkOperationType.UPDATE, null, todoIds, status, actor);
    }

    public static BulkTodoOperation delete(String farmId, List<String> todoIds) {
        return new BulkTodoOperation(farmId, BulkOperationType.DELETE, null, todoIds, null, null);
    }

    public int size() {
        return type == BulkOperationType.CREATE ? creates.size() : todoIds.size();
    }

    private static List<String> distinct(List<String> ids) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                unique.add(id.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
