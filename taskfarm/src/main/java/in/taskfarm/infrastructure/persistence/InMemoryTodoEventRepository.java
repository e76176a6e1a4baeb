package in.taskfarm.infrastructure.persistence;

import in.taskfarm.application.port.output.TodoEventRepository;
import in.taskfarm.domain.common.TodoEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory event log. Sequence numbers start at 1.
 */
public final class InMemoryTodoEventRepository implements TodoEventRepository {

    private final List<TodoEvent> events = new ArrayList<>();
    private long seq = 0L;

    @Override
    public synchronized TodoEvent append(TodoEvent event) {
        TodoEvent stored = event.withSeq(++seq, event.ts() != null ? event.ts() : Instant.now());
        events.add(stored);
        return stored;
    }

    @Override
    public synchronized List<TodoEvent> listAfterSeqForFarm(String farmId, long afterSeq, int limit) {
        List<TodoEvent> result = new ArrayList<>();
        for (TodoEvent e : events) {
            if (result.size() >= limit) {
                break;
            }
            if (e.seq() > afterSeq && e.isVisibleToFarm(farmId)) {
                result.add(e);
            }
        }
        return result;
    }

    @Override
    public synchronized long latestSeq() {
        return seq;
    }
}
