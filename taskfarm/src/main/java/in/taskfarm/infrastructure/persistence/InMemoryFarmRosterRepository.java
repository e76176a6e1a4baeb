package in.taskfarm.infrastructure.persistence;

import in.taskfarm.application.port.output.FarmRosterRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory roster. Members are kept in join order.
 */
public final class InMemoryFarmRosterRepository implements FarmRosterRepository {

    private final ConcurrentHashMap<String, Map<String, Instant>> rosters = new ConcurrentHashMap<>();

    @Override
    public List<String> listAgents(String farmId) {
        Map<String, Instant> members = rosters.get(farmId);
        if (members == null) {
            return List.of();
        }
        synchronized (members) {
            return new ArrayList<>(members.keySet());
        }
    }

    @Override
    public boolean isMember(String farmId, String agentId) {
        Map<String, Instant> members = rosters.get(farmId);
        if (members == null) {
            return false;
        }
        synchronized (members) {
            return members.containsKey(agentId);
        }
    }

    @Override
    public boolean addAgent(String farmId, String agentId, Instant joinedAt) {
        Map<String, Instant> members = rosters.computeIfAbsent(farmId, k -> new LinkedHashMap<>());
        synchronized (members) {
            return members.putIfAbsent(agentId, joinedAt) == null;
        }
    }

    @Override
    public boolean removeAgent(String farmId, String agentId, Instant removedAt) {
        Map<String, Instant> members = rosters.get(farmId);
        if (members == null) {
            return false;
        }
        synchronized (members) {
            return members.remove(agentId) != null;
        }
    }
}
