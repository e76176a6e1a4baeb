package in.taskfarm.domain.todo;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * A unit of work owned by one agent.
 *
 * Immutable: every mutation produces a new instance with a strictly later
 * {@code updatedAt}. {@code updatedAt} is the optimistic-concurrency token used
 * when applying rebalance moves.
 */
public record AgentTodo(
    String id,
    String agentId,
    String farmId,              // null for individual todos outside any farm
    String title,
    String description,
    TodoCategory category,
    TodoPriority priority,
    TodoStatus status,
    HierarchyLevel hierarchyLevel,
    String assignedBy,
    Instant dueDate,            // optional, drives the "due soon" bucket rule
    String goalId,              // optional, set for todos created from a farm goal
    List<String> dependsOn,     // ids of todos this one waits on, never null
    TodoContext context,        // optional
    TodoProgress progress,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt         // set once status becomes COMPLETED
) {
    public static final String ID_PREFIX = "todo_";
    public static final String SYSTEM_ACTOR = "system";
    public static final String FARM_COORDINATOR = "farm_coordinator";

    public AgentTodo {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        progress = progress == null ? TodoProgress.notStarted() : progress;
    }

    public static String newId() {
        return ID_PREFIX + UUID.randomUUID();
    }

    /**
     * Build a fresh PENDING todo from a validated request.
     */
    public static AgentTodo create(CreateTodoRequest request, Instant now) {
        Instant ts = truncate(now);
        return new AgentTodo(
            newId(),
            request.agentId(),
            request.farmId(),
            request.title(),
            request.description(),
            request.category(),
            request.priority(),
            TodoStatus.PENDING,
            request.hierarchyLevel(),
            request.assignedBy(),
            request.dueDate(),
            request.goalId(),
            request.dependencies(),
            request.context(),
            TodoProgress.notStarted(),
            ts,
            ts,
            null
        );
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public boolean isPending() {
        return status == TodoStatus.PENDING;
    }

    @JsonIgnore
    public boolean isHighPriority() {
        return priority.isHighOrAbove();
    }

    @JsonIgnore
    public boolean isFarmTodo() {
        return farmId != null;
    }

    @JsonIgnore
    public boolean isShared() {
        return hierarchyLevel == HierarchyLevel.FARM;
    }

    /**
     * Overdue: due date passed while the todo is still open.
     */
    public boolean isOverdue(Instant now) {
        return dueDate != null && dueDate.isBefore(now) && !isTerminal();
    }

    public AgentTodo withStatus(TodoStatus newStatus, Instant now) {
        Instant next = nextUpdatedAt(now);
        boolean completing = newStatus == TodoStatus.COMPLETED;
        return new AgentTodo(id, agentId, farmId, title, description, category, priority, newStatus,
            hierarchyLevel, assignedBy, dueDate, goalId, dependsOn, context,
            completing ? progress.completed() : progress, createdAt, next, completing ? next : completedAt);
    }

    /**
     * Copy recording that the farm coordinator overrode the owner.
     */
    public AgentTodo overriddenByCoordinator() {
        return new AgentTodo(id, agentId, farmId, title, description, category, priority, status,
            hierarchyLevel, FARM_COORDINATOR, dueDate, goalId, dependsOn, context, progress,
            createdAt, updatedAt, completedAt);
    }

    public AgentTodo withAgent(String newAgentId, Instant now) {
        return new AgentTodo(id, newAgentId, farmId, title, description, category, priority, status,
            hierarchyLevel, assignedBy, dueDate, goalId, dependsOn, context, progress,
            createdAt, nextUpdatedAt(now), completedAt);
    }

    /**
     * Next {@code updatedAt}: {@code now} at storage precision, pushed forward one
     * microsecond when the clock has not advanced past the previous write.
     */
    private Instant nextUpdatedAt(Instant now) {
        Instant candidate = truncate(now);
        return candidate.isAfter(updatedAt) ? candidate : updatedAt.plus(1, ChronoUnit.MICROS);
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }
}
