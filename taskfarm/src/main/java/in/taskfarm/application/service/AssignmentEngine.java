package in.taskfarm.application.service;

import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.common.PartialRollbackException;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.farm.TaskMove;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.HierarchyLevel;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.infrastructure.metrics.CoordinationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * AssignmentEngine - all-or-nothing multi-todo writes.
 *
 * EXPANSION:
 * A bulk assign template becomes one GROUP todo per distinct target agent, each
 * with its own id, assigned by the farm coordinator.
 *
 * ATOMICITY:
 * Every write goes through a {@link CompensatingTodoWriter} bounded by the bulk
 * deadline. On a store failure or deadline overrun the writes made so far are
 * undone before the {@link TodoStoreException} is rethrown. If the undo fails,
 * {@link PartialRollbackException} is thrown instead, with the original failure
 * attached as suppressed.
 *
 * Callers run these methods on the farm's writer partition.
 */
public final class AssignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(AssignmentEngine.class);

    private final TodoRepository todoRepo;
    private final TodoRequestValidator validator;
    private final Supplier<CoordinationConfig> config;
    private final CoordinationMetrics metrics;
    private final Clock clock;

    public AssignmentEngine(TodoRepository todoRepo, TodoRequestValidator validator,
                            Supplier<CoordinationConfig> config, CoordinationMetrics metrics, Clock clock) {
        this.todoRepo = todoRepo;
        this.validator = validator;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // EXPANSION (pure, no store access)
    // ═══════════════════════════════════════════════════════════════

    /**
     * Validate a bulk assign request and expand it into one todo per distinct
     * target agent.
     */
    public List<AgentTodo> expand(String farmId, BulkAssignRequest request) {
        String farm = validator.requireFarmId(farmId);
        List<String> targets = validator.validateBulkAssign(request);
        Instant now = clock.instant();

        List<AgentTodo> todos = new ArrayList<>(targets.size());
        for (String agentId : targets) {
            CreateTodoRequest perAgent = new CreateTodoRequest(
                agentId,
                farm,
                request.title(),
                request.description(),
                request.category(),
                request.priority(),
                HierarchyLevel.GROUP,
                AgentTodo.FARM_COORDINATOR,
                request.dueDate(),
                null,
                null,
                null
            ).withDefaults();
            todos.add(AgentTodo.create(perAgent, now));
        }
        return todos;
    }

    /**
     * Validate create requests for {@code farmId} and build their todos.
     */
    public List<AgentTodo> prepareCreates(String farmId, List<CreateTodoRequest> requests) {
        validator.validateBulkSize(requests.size());
        Instant now = clock.instant();
        List<AgentTodo> todos = new ArrayList<>(requests.size());
        for (CreateTodoRequest request : requests) {
            todos.add(AgentTodo.create(validator.validateFarmCreate(farmId, request), now));
        }
        return todos;
    }

    // ═══════════════════════════════════════════════════════════════
    // ATOMIC WRITES
    // ═══════════════════════════════════════════════════════════════

    public List<AgentTodo> bulkAssign(String farmId, BulkAssignRequest request) {
        return createAll("bulkAssign", expand(farmId, request));
    }

    /**
     * Persist all {@code todos} or none of them.
     */
    public List<AgentTodo> createAll(String operation, List<AgentTodo> todos) {
        return atomically(operation, writer -> {
            for (AgentTodo todo : todos) {
                writer.create(todo);
            }
            return todos;
        });
    }

    /**
     * Move every todo to {@code target}. All transitions are checked before the
     * first write. When the farm coordinator moves another agent's todo the
     * result records it as {@code assignedBy}.
     */
    public List<AgentTodo> applyStatus(String operation, List<AgentTodo> current, TodoStatus target, String actor) {
        for (AgentTodo todo : current) {
            validator.validateTransition(todo, target, actor);
        }
        Instant now = clock.instant();
        return atomically(operation, writer -> {
            List<AgentTodo> updated = new ArrayList<>(current.size());
            for (AgentTodo todo : current) {
                AgentTodo next = todo.withStatus(target, now);
                if (AgentTodo.FARM_COORDINATOR.equals(actor) && !actor.equals(todo.agentId())) {
                    next = next.overriddenByCoordinator();
                }
                writer.replace(todo, next);
                updated.add(next);
            }
            return updated;
        });
    }

    public List<AgentTodo> deleteAll(String operation, List<AgentTodo> current) {
        return atomically(operation, writer -> {
            for (AgentTodo todo : current) {
                writer.delete(todo);
            }
            return current;
        });
    }

    /**
     * Reassign todos per {@code moves}. {@code current} must hold the stored
     * version of every moved todo.
     */
    public List<AgentTodo> applyMoves(String operation, List<AgentTodo> current, List<TaskMove> moves) {
        Map<String, AgentTodo> byId = current.stream()
            .collect(Collectors.toMap(AgentTodo::id, t -> t, (a, b) -> a));
        Instant now = clock.instant();
        return atomically(operation, writer -> {
            List<AgentTodo> moved = new ArrayList<>(moves.size());
            for (TaskMove move : moves) {
                AgentTodo before = byId.get(move.taskId());
                AgentTodo after = before.withAgent(move.toAgent(), now);
                writer.replace(before, after);
                moved.add(after);
            }
            return moved;
        });
    }

    private <T> T atomically(String operation, Function<CompensatingTodoWriter, T> body) {
        BulkDeadline deadline = BulkDeadline.after(config.get().bulkDeadline());
        CompensatingTodoWriter writer = new CompensatingTodoWriter(todoRepo, deadline);
        try {
            return body.apply(writer);
        } catch (RuntimeException failure) {
            log.warn("{} failed after {} writes, rolling back: {}",
                operation, writer.writeCount(), failure.getMessage());
            metrics.recordRollback(operation);
            try {
                writer.rollback();
            } catch (PartialRollbackException partial) {
                partial.addSuppressed(failure);
                throw partial;
            }
            throw failure;
        }
    }
}
