package in.taskfarm.transport.ws;

import in.taskfarm.domain.common.TodoEvent;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket subscriber session, scoped to one farm and/or one agent.
 */
public final class WsSession {
    private final String sessionId;
    private final String farmId;              // null when watching an agent only
    private final String agentId;             // null when watching a farm only
    private final Set<String> topics;         // Subscribed event types, empty = all

    public WsSession(String sessionId, String farmId, String agentId) {
        this.sessionId = sessionId;
        this.farmId = farmId;
        this.agentId = agentId;
        this.topics = ConcurrentHashMap.newKeySet();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFarmId() {
        return farmId;
    }

    public String getAgentId() {
        return agentId;
    }

    public Set<String> getTopics() {
        return topics;
    }

    public void subscribeTopics(Set<String> newTopics) {
        topics.addAll(newTopics);
    }

    public void unsubscribeTopics(Set<String> removeTopics) {
        topics.removeAll(removeTopics);
    }

    /**
     * Check if this session should receive an event.
     */
    public boolean shouldReceive(TodoEvent event) {
        if (!topics.isEmpty() && !topics.contains(event.type().name())) {
            return false;
        }
        if (farmId != null && event.isVisibleToFarm(farmId)) {
            return true;
        }
        return agentId != null && event.isVisibleToAgent(agentId);
    }
}
