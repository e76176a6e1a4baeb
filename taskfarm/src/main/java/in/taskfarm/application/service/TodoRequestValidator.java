package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.command.FarmGoal;
import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoStatus;

import java.util.List;
import java.util.function.Supplier;

/**
 * Input validator for todo commands.
 *
 * Every check runs before the first store write, so a rejected request leaves
 * nothing behind. All failures throw {@link TodoValidationException} carrying a
 * {@link ValidationErrorCode}.
 *
 * Usage:
 * <pre>
 * TodoRequestValidator validator = new TodoRequestValidator(configService);
 *
 * // Normalize and check a create request (throws if invalid)
 * CreateTodoRequest clean = validator.validateCreate(request);
 *
 * // Check a status change
 * validator.validateTransition(todo, TodoStatus.COMPLETED, "agent-7");
 * </pre>
 *
 * Validation Rules:
 * - Titles: non-empty after trimming, max 200 characters
 * - Category and priority: required
 * - GROUP and FARM todos: farm id required
 * - Bulk commands: at least one item, at most maxBulkSize
 * - Status changes: state machine plus owner-or-coordinator check
 */
public final class TodoRequestValidator {

    public static final int MAX_TITLE_LENGTH = 200;

    private final Supplier<CoordinationConfig> config;

    public TodoRequestValidator(Supplier<CoordinationConfig> config) {
        this.config = config;
    }

    /**
     * Trim, apply defaults and check a single create request.
     *
     * @return the normalized request
     */
    public CreateTodoRequest validateCreate(CreateTodoRequest request) {
        if (request == null) {
            throw new TodoValidationException(ValidationErrorCode.MALFORMED_REQUEST, "request is required");
        }
        CreateTodoRequest clean = request.withDefaults();

        if (clean.agentId() == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_AGENT_ID);
        }
        validateTitle(clean.title());
        if (clean.category() == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_CATEGORY);
        }
        if (clean.priority() == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_PRIORITY);
        }
        if (clean.hierarchyLevel().requiresFarm() && clean.farmId() == null) {
            throw new TodoValidationException(ValidationErrorCode.FARM_REQUIRED_FOR_LEVEL,
                clean.hierarchyLevel().wireName());
        }
        return clean;
    }

    /**
     * Check a create request that must land in {@code farmId}. A request without
     * a farm id is placed in {@code farmId}.
     */
    public CreateTodoRequest validateFarmCreate(String farmId, CreateTodoRequest request) {
        String farm = requireFarmId(farmId);
        if (request == null) {
            throw new TodoValidationException(ValidationErrorCode.MALFORMED_REQUEST, "request is required");
        }
        CreateTodoRequest placed = request.farmId() == null || request.farmId().isBlank()
            ? request.withFarmId(farm)
            : request;
        CreateTodoRequest clean = validateCreate(placed);
        if (!farm.equals(clean.farmId())) {
            throw new TodoValidationException(ValidationErrorCode.FARM_MISMATCH,
                clean.farmId() + " != " + farm);
        }
        return clean;
    }

    /**
     * Check a bulk assign template and its targets.
     *
     * @return the distinct target agents, in request order
     */
    public List<String> validateBulkAssign(BulkAssignRequest request) {
        if (request == null) {
            throw new TodoValidationException(ValidationErrorCode.MALFORMED_REQUEST, "request is required");
        }
        validateTitle(request.title() == null ? null : request.title().trim());
        if (request.category() == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_CATEGORY);
        }
        if (request.priority() == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_PRIORITY);
        }
        List<String> targets = request.distinctAgentIds();
        if (targets.isEmpty()) {
            throw new TodoValidationException(ValidationErrorCode.NO_TARGET_AGENTS);
        }
        validateBulkSize(targets.size());
        return targets;
    }

    public void validateGoal(FarmGoal goal, List<String> agentIds) {
        if (goal == null || goal.name() == null || goal.name().isBlank()) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_GOAL_NAME);
        }
        if (agentIds == null || agentIds.stream().allMatch(id -> id == null || id.isBlank())) {
            throw new TodoValidationException(ValidationErrorCode.NO_TARGET_AGENTS);
        }
        validateBulkSize(agentIds.size());
        try {
            TodoPriority.fromGoalPriority(goal.priority());
        } catch (IllegalArgumentException e) {
            throw new TodoValidationException(ValidationErrorCode.MALFORMED_REQUEST, e.getMessage());
        }
    }

    public void validateBulkSize(int size) {
        if (size <= 0) {
            throw new TodoValidationException(ValidationErrorCode.EMPTY_BULK_OPERATION);
        }
        int max = config.get().maxBulkSize();
        if (size > max) {
            throw new TodoValidationException(ValidationErrorCode.BULK_TOO_LARGE, size + " > " + max);
        }
    }

    /**
     * Check a status change against the lifecycle and the actor's rights. Only
     * the owning agent or the farm coordinator may change a todo's status.
     */
    public void validateTransition(AgentTodo todo, TodoStatus target, String actor) {
        if (target == null) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_STATUS);
        }
        if (actor == null || actor.isBlank()) {
            throw new TodoValidationException(ValidationErrorCode.NOT_TODO_OWNER, "actor is required");
        }
        if (!actor.equals(todo.agentId()) && !AgentTodo.FARM_COORDINATOR.equals(actor)) {
            throw new TodoValidationException(ValidationErrorCode.NOT_TODO_OWNER,
                actor + " cannot change " + todo.id());
        }
        if (!todo.status().canTransitionTo(target)) {
            throw new TodoValidationException(ValidationErrorCode.ILLEGAL_STATUS_TRANSITION,
                todo.status().wireName() + " -> " + target.wireName());
        }
    }

    public String requireFarmId(String farmId) {
        if (farmId == null || farmId.isBlank()) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_FARM_ID);
        }
        return farmId.trim();
    }

    public String requireAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new TodoValidationException(ValidationErrorCode.MISSING_AGENT_ID);
        }
        return agentId.trim();
    }

    private static void validateTitle(String title) {
        if (title == null || title.isEmpty()) {
            throw new TodoValidationException(ValidationErrorCode.EMPTY_TITLE);
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new TodoValidationException(ValidationErrorCode.TITLE_TOO_LONG,
                title.length() + " > " + MAX_TITLE_LENGTH);
        }
    }
}
