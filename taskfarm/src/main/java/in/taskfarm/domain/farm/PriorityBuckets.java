package in.taskfarm.domain.farm;

import in.taskfarm.domain.todo.AgentTodo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partition of all open farm todos into urgency buckets, each list already in
 * tie-break order.
 */
public record PriorityBuckets(
    List<AgentTodo> immediate,
    List<AgentTodo> planned,
    List<AgentTodo> longTerm
) {
    public PriorityBuckets {
        immediate = List.copyOf(immediate);
        planned = List.copyOf(planned);
        longTerm = List.copyOf(longTerm);
    }

    public static PriorityBuckets empty() {
        return new PriorityBuckets(List.of(), List.of(), List.of());
    }

    public int size() {
        return immediate.size() + planned.size() + longTerm.size();
    }

    public List<AgentTodo> get(PriorityBucket bucket) {
        return switch (bucket) {
            case IMMEDIATE -> immediate;
            case PLANNED -> planned;
            case LONG_TERM -> longTerm;
        };
    }

    /**
     * todoId -> bucket lookup.
     */
    public Map<String, PriorityBucket> bucketIndex() {
        Map<String, PriorityBucket> index = new HashMap<>();
        for (PriorityBucket bucket : PriorityBucket.values()) {
            for (AgentTodo todo : get(bucket)) {
                index.put(todo.id(), bucket);
            }
        }
        return index;
    }
}
