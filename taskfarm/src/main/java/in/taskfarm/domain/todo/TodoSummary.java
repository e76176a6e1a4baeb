package in.taskfarm.domain.todo;

import java.time.Instant;
import java.util.Collection;

/**
 * Per-agent status counts.
 */
public record TodoSummary(
    int total,
    int pending,
    int inProgress,
    int completed,
    int cancelled,
    int highPriority,    // open todos at HIGH or CRITICAL
    int overdue          // open todos past their due date
) {
    public static TodoSummary empty() {
        return new TodoSummary(0, 0, 0, 0, 0, 0, 0);
    }

    public static TodoSummary of(Collection<AgentTodo> todos, Instant now) {
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int cancelled = 0;
        int highPriority = 0;
        int overdue = 0;

        for (AgentTodo todo : todos) {
            switch (todo.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case CANCELLED -> cancelled++;
            }
            if (todo.isActive() && todo.isHighPriority()) {
                highPriority++;
            }
            if (todo.isOverdue(now)) {
                overdue++;
            }
        }
        return new TodoSummary(todos.size(), pending, inProgress, completed, cancelled, highPriority, overdue);
    }

    /**
     * Active load used by the workload balancer.
     */
    public int activeLoad() {
        return pending + inProgress;
    }
}
