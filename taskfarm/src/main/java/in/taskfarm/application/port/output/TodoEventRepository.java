package in.taskfarm.application.port.output;

import in.taskfarm.domain.common.TodoEvent;

import java.util.List;

public interface TodoEventRepository {
    /**
     * Append and assign the next sequence number.
     */
    TodoEvent append(TodoEvent event);

    List<TodoEvent> listAfterSeqForFarm(String farmId, long afterSeq, int limit);

    long latestSeq();
}
