package in.taskfarm.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Todo Schema Migration - creates the coordination tables on startup.
 *
 * - agent_todos: one row per todo
 * - farm_agents: roster memberships (soft-deleted via removed_at)
 * - todo_events: append-only notification log
 */
public final class TodoSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(TodoSchemaMigration.class);

    private final DataSource dataSource;

    public TodoSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables and their indexes.
     */
    public void migrate() {
        log.info("[TODO MIGRATION] Starting coordination schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "agent_todos")) {
                log.info("[TODO MIGRATION] Creating agent_todos table...");
                createTodosTable(conn);
                log.info("[TODO MIGRATION] ✓ agent_todos table created");
            } else {
                log.info("[TODO MIGRATION] agent_todos table already exists");
                addTodoDetailColumns(conn);
            }

            if (!tableExists(conn, "farm_agents")) {
                log.info("[TODO MIGRATION] Creating farm_agents table...");
                createRosterTable(conn);
                log.info("[TODO MIGRATION] ✓ farm_agents table created");
            } else {
                log.info("[TODO MIGRATION] farm_agents table already exists");
            }

            if (!tableExists(conn, "todo_events")) {
                log.info("[TODO MIGRATION] Creating todo_events table...");
                createEventsTable(conn);
                log.info("[TODO MIGRATION] ✓ todo_events table created");
            } else {
                log.info("[TODO MIGRATION] todo_events table already exists");
            }

            log.info("[TODO MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[TODO MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Todo schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createTodosTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE agent_todos (
                id VARCHAR(64) PRIMARY KEY,
                agent_id VARCHAR(128) NOT NULL,
                farm_id VARCHAR(128),

                title VARCHAR(200) NOT NULL,
                description TEXT,
                category VARCHAR(20) NOT NULL,
                priority VARCHAR(20) NOT NULL,
                status VARCHAR(20) NOT NULL DEFAULT 'pending',
                hierarchy_level VARCHAR(20) NOT NULL DEFAULT 'individual',
                assigned_by VARCHAR(128) NOT NULL,

                due_date TIMESTAMPTZ,
                goal_id VARCHAR(128),
                depends_on JSONB NOT NULL DEFAULT '[]',
                context JSONB,
                progress JSONB NOT NULL DEFAULT '{"percentage":0,"steps":[]}',

                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                completed_at TIMESTAMPTZ
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_agent_todos_farm ON agent_todos (farm_id, created_at)");
            stmt.executeUpdate("CREATE INDEX idx_agent_todos_agent ON agent_todos (agent_id, created_at)");
        }
    }

    // Tables created before dependencies, context and progress were stored
    private void addTodoDetailColumns(Connection conn) throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(
                "ALTER TABLE agent_todos ADD COLUMN IF NOT EXISTS depends_on JSONB NOT NULL DEFAULT '[]'");
            stmt.executeUpdate("ALTER TABLE agent_todos ADD COLUMN IF NOT EXISTS context JSONB");
            stmt.executeUpdate("""
                ALTER TABLE agent_todos ADD COLUMN IF NOT EXISTS
                    progress JSONB NOT NULL DEFAULT '{"percentage":0,"steps":[]}'
                """);
        }
    }

    private void createRosterTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE farm_agents (
                id BIGSERIAL PRIMARY KEY,
                farm_id VARCHAR(128) NOT NULL,
                agent_id VARCHAR(128) NOT NULL,
                joined_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                removed_at TIMESTAMPTZ
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("""
                CREATE UNIQUE INDEX uq_farm_agents_active
                    ON farm_agents (farm_id, agent_id)
                    WHERE removed_at IS NULL
                """);
        }
    }

    private void createEventsTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE todo_events (
                seq BIGSERIAL PRIMARY KEY,
                event_type VARCHAR(40) NOT NULL,
                farm_id VARCHAR(128),
                agent_id VARCHAR(128),
                todo_id VARCHAR(64),
                payload JSONB NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                created_by VARCHAR(128)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_todo_events_farm_seq ON todo_events (farm_id, seq)");
        }
    }
}
