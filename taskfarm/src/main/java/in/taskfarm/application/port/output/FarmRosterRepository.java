package in.taskfarm.application.port.output;

import java.time.Instant;
import java.util.List;

/**
 * Which agents are currently assigned to a farm.
 */
public interface FarmRosterRepository {
    /**
     * Current members in join order.
     */
    List<String> listAgents(String farmId);

    boolean isMember(String farmId, String agentId);

    /**
     * @return false if the agent was already a member
     */
    boolean addAgent(String farmId, String agentId, Instant joinedAt);

    /**
     * @return false if the agent was not a member
     */
    boolean removeAgent(String farmId, String agentId, Instant removedAt);
}
