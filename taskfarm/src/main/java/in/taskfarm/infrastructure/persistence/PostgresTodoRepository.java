package in.taskfarm.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.todo.AgentTodo;
import in.taskfarm.domain.todo.HierarchyLevel;
import in.taskfarm.domain.todo.TodoCategory;
import in.taskfarm.domain.todo.TodoContext;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoProgress;
import in.taskfarm.domain.todo.TodoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of TodoRepository.
 */
public final class PostgresTodoRepository implements TodoRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTodoRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() { };

    private static final String COLUMNS = """
            id, agent_id, farm_id, title, description, category, priority, status,
            hierarchy_level, assigned_by, due_date, goal_id, depends_on, context, progress,
            created_at, updated_at, completed_at
            """;

    private final DataSource dataSource;

    public PostgresTodoRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void put(AgentTodo t) {
        String sql = """
                INSERT INTO agent_todos (
                    id, agent_id, farm_id, title, description, category, priority, status,
                    hierarchy_level, assigned_by, due_date, goal_id, depends_on, context, progress,
                    created_at, updated_at, completed_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    agent_id = EXCLUDED.agent_id,
                    farm_id = EXCLUDED.farm_id,
                    title = EXCLUDED.title,
                    description = EXCLUDED.description,
                    category = EXCLUDED.category,
                    priority = EXCLUDED.priority,
                    status = EXCLUDED.status,
                    hierarchy_level = EXCLUDED.hierarchy_level,
                    assigned_by = EXCLUDED.assigned_by,
                    due_date = EXCLUDED.due_date,
                    goal_id = EXCLUDED.goal_id,
                    depends_on = EXCLUDED.depends_on,
                    context = EXCLUDED.context,
                    progress = EXCLUDED.progress,
                    updated_at = EXCLUDED.updated_at,
                    completed_at = EXCLUDED.completed_at
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, t.id());
            ps.setString(2, t.agentId());
            ps.setString(3, t.farmId());
            ps.setString(4, t.title());
            ps.setString(5, t.description());
            ps.setString(6, t.category().wireName());
            ps.setString(7, t.priority().wireName());
            ps.setString(8, t.status().wireName());
            ps.setString(9, t.hierarchyLevel().wireName());
            ps.setString(10, t.assignedBy());
            ps.setTimestamp(11, toTimestamp(t.dueDate()));
            ps.setString(12, t.goalId());
            ps.setString(13, MAPPER.writeValueAsString(t.dependsOn()));
            ps.setString(14, t.context() == null ? null : MAPPER.writeValueAsString(t.context()));
            ps.setString(15, MAPPER.writeValueAsString(t.progress()));
            ps.setTimestamp(16, toTimestamp(t.createdAt()));
            ps.setTimestamp(17, toTimestamp(t.updatedAt()));
            ps.setTimestamp(18, toTimestamp(t.completedAt()));

            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to write todo {}: {}", t.id(), ex.getMessage(), ex);
            throw new TodoStoreException("Failed to write todo " + t.id(), ex);
        }
    }

    @Override
    public Optional<AgentTodo> get(String todoId) {
        String sql = "SELECT " + COLUMNS + " FROM agent_todos WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, todoId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to read todo {}: {}", todoId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to read todo " + todoId, ex);
        }
    }

    @Override
    public boolean delete(String todoId) {
        String sql = "DELETE FROM agent_todos WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, todoId);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to delete todo {}: {}", todoId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to delete todo " + todoId, ex);
        }
    }

    @Override
    public List<AgentTodo> listByAgent(String agentId) {
        String sql = "SELECT " + COLUMNS + " FROM agent_todos WHERE agent_id = ? ORDER BY created_at, id";
        return query(sql, agentId);
    }

    @Override
    public List<AgentTodo> listByFarm(String farmId) {
        String sql = "SELECT " + COLUMNS + " FROM agent_todos WHERE farm_id = ? ORDER BY created_at, id";
        return query(sql, farmId);
    }

    private List<AgentTodo> query(String sql, String key) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            List<AgentTodo> todos = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    todos.add(mapRow(rs));
                }
            }
            return todos;
        } catch (SQLException | JsonProcessingException ex) {
            log.error("Failed to list todos for {}: {}", key, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to list todos for " + key, ex);
        }
    }

    private AgentTodo mapRow(ResultSet rs) throws SQLException, JsonProcessingException {
        String context = rs.getString("context");
        return new AgentTodo(
            rs.getString("id"),
            rs.getString("agent_id"),
            rs.getString("farm_id"),
            rs.getString("title"),
            rs.getString("description"),
            TodoCategory.fromWire(rs.getString("category")),
            TodoPriority.fromWire(rs.getString("priority")),
            TodoStatus.fromWire(rs.getString("status")),
            HierarchyLevel.fromWire(rs.getString("hierarchy_level")),
            rs.getString("assigned_by"),
            toInstant(rs.getTimestamp("due_date")),
            rs.getString("goal_id"),
            MAPPER.readValue(rs.getString("depends_on"), ID_LIST),
            context == null ? null : MAPPER.readValue(context, TodoContext.class),
            MAPPER.readValue(rs.getString("progress"), TodoProgress.class),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
