package in.taskfarm.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.taskfarm.application.port.output.TodoEventRepository;
import in.taskfarm.domain.common.TodoEvent;
import in.taskfarm.domain.common.TodoEventType;
import in.taskfarm.infrastructure.metrics.CoordinationMetrics;
import in.taskfarm.transport.ws.WsHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Event Service.
 * Reliability rule: persist event first (repository/DB), then push to WS.
 *
 * Notifications are best-effort: a failure is logged and counted, never thrown
 * back into the operation that triggered it, which has already committed.
 */
public final class TodoEventService {
    private static final Logger log = LoggerFactory.getLogger(TodoEventService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final TodoEventRepository repo;
    private final WsHub wsHub;
    private final CoordinationMetrics metrics;
    private final Clock clock;

    public TodoEventService(TodoEventRepository repo, WsHub wsHub, CoordinationMetrics metrics, Clock clock) {
        this.repo = repo;
        this.wsHub = wsHub;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // FARM EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit a farm-wide event.
     */
    public TodoEvent emitFarm(TodoEventType type, String farmId, Object payloadPojo, String createdBy) {
        return emit(type, farmId, null, null, payloadPojo, createdBy);
    }

    /**
     * Emit an event about one todo. {@code farmId} may be null for todos outside
     * any farm.
     */
    public TodoEvent emitTodo(TodoEventType type, String farmId, String agentId, String todoId,
                              Object payloadPojo, String createdBy) {
        return emit(type, farmId, agentId, todoId, payloadPojo, createdBy);
    }

    // ═══════════════════════════════════════════════════════════════
    // REPLAY
    // ═══════════════════════════════════════════════════════════════

    public List<TodoEvent> eventsAfter(String farmId, long afterSeq, int limit) {
        return repo.listAfterSeqForFarm(farmId, afterSeq, limit);
    }

    public long currentSeq() {
        return repo.latestSeq();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private TodoEvent emit(TodoEventType type, String farmId, String agentId, String todoId,
                           Object payloadPojo, String createdBy) {
        try {
            JsonNode payload = MAPPER.valueToTree(payloadPojo);
            TodoEvent e = new TodoEvent(0, type, farmId, agentId, todoId, payload, clock.instant(), createdBy);

            // Persist first (source of truth)
            TodoEvent persisted = repo.append(e);

            // Then broadcast via WebSocket (batched, farm-scoped)
            wsHub.publish(persisted);

            log.debug("Event emitted: seq={}, type={}, farm={}, agent={}",
                persisted.seq(), persisted.type(), persisted.farmId(), persisted.agentId());
            return persisted;
        } catch (Exception ex) {
            log.warn("Failed to emit {} for farm={}: {}", type, farmId, ex.getMessage());
            metrics.recordEventFailure(type.name());
            return null;
        }
    }
}
