package in.taskfarm.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.taskfarm.application.port.output.TodoEventRepository;
import in.taskfarm.domain.common.TodoEvent;
import in.taskfarm.domain.common.TodoEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of TodoEventRepository.
 */
public final class PostgresTodoEventRepository implements TodoEventRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTodoEventRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public PostgresTodoEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public TodoEvent append(TodoEvent e) {
        String sql = """
                INSERT INTO todo_events (
                    event_type, farm_id, agent_id, todo_id, payload, created_at, created_by
                ) VALUES (?, ?, ?, ?, ?::jsonb, COALESCE(?, NOW()), ?)
                RETURNING seq, created_at
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, e.type().name());
            ps.setString(2, e.farmId());
            ps.setString(3, e.agentId());
            ps.setString(4, e.todoId());
            ps.setString(5, MAPPER.writeValueAsString(e.payload()));
            ps.setTimestamp(6, e.ts() == null ? null : Timestamp.from(e.ts()));
            ps.setString(7, e.createdBy());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return e.withSeq(rs.getLong("seq"), rs.getTimestamp("created_at").toInstant());
                }
            }
        } catch (Exception ex) {
            log.error("Failed to append event: {}", ex.getMessage(), ex);
            throw new RuntimeException("Failed to append event", ex);
        }

        return e;
    }

    @Override
    public List<TodoEvent> listAfterSeqForFarm(String farmId, long afterSeq, int limit) {
        String sql = """
                SELECT seq, event_type, farm_id, agent_id, todo_id, payload, created_at, created_by
                FROM todo_events
                WHERE seq > ?
                  AND farm_id = ?
                ORDER BY seq ASC
                LIMIT ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, afterSeq);
            ps.setString(2, farmId);
            ps.setInt(3, limit);

            List<TodoEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
            return events;
        } catch (Exception ex) {
            log.error("Failed to list events for farm {}: {}", farmId, ex.getMessage(), ex);
            throw new RuntimeException("Failed to list events", ex);
        }
    }

    @Override
    public long latestSeq() {
        String sql = "SELECT COALESCE(MAX(seq), 0) FROM todo_events";

        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {

            if (rs.next()) {
                return rs.getLong(1);
            }
            return 0L;
        } catch (Exception ex) {
            log.error("Failed to get latest seq: {}", ex.getMessage(), ex);
            return 0L;
        }
    }

    private TodoEvent mapRow(ResultSet rs) throws Exception {
        long seq = rs.getLong("seq");
        TodoEventType type = TodoEventType.valueOf(rs.getString("event_type"));
        String farmId = rs.getString("farm_id");
        String agentId = rs.getString("agent_id");
        String todoId = rs.getString("todo_id");
        JsonNode payload = MAPPER.readTree(rs.getString("payload"));
        Instant ts = rs.getTimestamp("created_at").toInstant();
        String createdBy = rs.getString("created_by");

        return new TodoEvent(seq, type, farmId, agentId, todoId, payload, ts, createdBy);
    }
}
