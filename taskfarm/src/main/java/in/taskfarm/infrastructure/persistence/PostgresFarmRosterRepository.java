package in.taskfarm.infrastructure.persistence;

import in.taskfarm.application.port.output.FarmRosterRepository;
import in.taskfarm.domain.common.TodoStoreException;
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

/**
 * PostgreSQL implementation of FarmRosterRepository.
 *
 * Memberships are soft-deleted: leaving sets removed_at, rejoining inserts a
 * new row.
 */
public final class PostgresFarmRosterRepository implements FarmRosterRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresFarmRosterRepository.class);

    private final DataSource dataSource;

    public PostgresFarmRosterRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<String> listAgents(String farmId) {
        String sql = """
                SELECT agent_id FROM farm_agents
                WHERE farm_id = ? AND removed_at IS NULL
                ORDER BY joined_at, agent_id
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, farmId);
            List<String> agents = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    agents.add(rs.getString("agent_id"));
                }
            }
            return agents;
        } catch (SQLException ex) {
            log.error("Failed to list roster for farm {}: {}", farmId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to list roster for farm " + farmId, ex);
        }
    }

    @Override
    public boolean isMember(String farmId, String agentId) {
        String sql = """
                SELECT 1 FROM farm_agents
                WHERE farm_id = ? AND agent_id = ? AND removed_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, farmId);
            ps.setString(2, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException ex) {
            log.error("Failed to check membership of {} in farm {}: {}", agentId, farmId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to check roster for farm " + farmId, ex);
        }
    }

    @Override
    public boolean addAgent(String farmId, String agentId, Instant joinedAt) {
        // Partial unique index on (farm_id, agent_id) WHERE removed_at IS NULL makes this idempotent
        String sql = """
                INSERT INTO farm_agents (farm_id, agent_id, joined_at)
                VALUES (?, ?, ?)
                ON CONFLICT DO NOTHING
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, farmId);
            ps.setString(2, agentId);
            ps.setTimestamp(3, Timestamp.from(joinedAt));
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to add {} to farm {}: {}", agentId, farmId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to add agent to farm " + farmId, ex);
        }
    }

    @Override
    public boolean removeAgent(String farmId, String agentId, Instant removedAt) {
        String sql = """
                UPDATE farm_agents SET removed_at = ?
                WHERE farm_id = ? AND agent_id = ? AND removed_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(removedAt));
            ps.setString(2, farmId);
            ps.setString(3, agentId);
            return ps.executeUpdate() > 0;
        } catch (SQLException ex) {
            log.error("Failed to remove {} from farm {}: {}", agentId, farmId, ex.getMessage(), ex);
            throw new TodoStoreException("Failed to remove agent from farm " + farmId, ex);
        }
    }
}
