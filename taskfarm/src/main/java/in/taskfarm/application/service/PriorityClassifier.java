package in.taskfarm.application.service;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.domain.farm.PriorityBucket;
import in.taskfarm.domain.farm.PriorityBuckets;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.TodoPriority;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * PriorityClassifier - maps a todo to its urgency bucket.
 *
 * RULES (first match wins):
 * 1. CRITICAL priority -> IMMEDIATE
 * 2. Due date within the due-soon horizon (overdue included) -> IMMEDIATE
 * 3. HIGH or MEDIUM priority -> PLANNED
 * 4. Everything else -> LONG_TERM
 *
 * ORDER INSIDE A BUCKET:
 * priority rank descending, then createdAt ascending, then id ascending. The id
 * step makes the order total, so the same todo set always yields the same
 * partition.
 *
 * Pure: depends only on its arguments and the configured horizon.
 */
public final class PriorityClassifier {

    public static final Comparator<AgentTodo> TIE_BREAK =
        Comparator.comparingInt((AgentTodo t) -> t.priority().rank()).reversed()
            .thenComparing(AgentTodo::createdAt)
            .thenComparing(AgentTodo::id);

    private final Supplier<CoordinationConfig> config;

    public PriorityClassifier(Supplier<CoordinationConfig> config) {
        this.config = config;
    }

    public PriorityBucket classify(AgentTodo todo, Instant now) {
        if (todo.priority() == TodoPriority.CRITICAL) {
            return PriorityBucket.IMMEDIATE;
        }

        if (todo.dueDate() != null) {
            Instant horizonEnd = now.plus(config.get().dueSoonHorizon());
            if (!todo.dueDate().isAfter(horizonEnd)) {
                return PriorityBucket.IMMEDIATE;
            }
        }

        return switch (todo.priority()) {
            case HIGH, MEDIUM -> PriorityBucket.PLANNED;
            default -> PriorityBucket.LONG_TERM;
        };
    }

    /**
     * Partition the open todos of {@code todos} into buckets. Completed and
     * cancelled todos are skipped.
     */
    public PriorityBuckets partition(Collection<AgentTodo> todos, Instant now) {
        List<AgentTodo> immediate = new ArrayList<>();
        List<AgentTodo> planned = new ArrayList<>();
        List<AgentTodo> longTerm = new ArrayList<>();

        for (AgentTodo todo : todos) {
            if (todo.isTerminal()) {
                continue;
            }
            switch (classify(todo, now)) {
                case IMMEDIATE -> immediate.add(todo);
                case PLANNED -> planned.add(todo);
                case LONG_TERM -> longTerm.add(todo);
            }
        }

        immediate.sort(TIE_BREAK);
        planned.sort(TIE_BREAK);
        longTerm.sort(TIE_BREAK);
        return new PriorityBuckets(immediate, planned, longTerm);
    }
}
