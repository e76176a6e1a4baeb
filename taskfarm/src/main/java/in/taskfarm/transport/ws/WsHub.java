package in.taskfarm.transport.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.taskfarm.domain.common.TodoEvent;
import in.taskfarm.domain.common.TodoEventType;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Push channel for todo events.
 *
 * Connect with {@code /ws?farmId=...} to watch a farm, {@code /ws?agentId=...} to
 * watch one agent across farms, or both. {@code topics=A,B} narrows delivery to
 * those event types; clients can change it later with subscribe/unsubscribe.
 *
 * Events are queued by {@link #publish} and fanned out in batches by a single
 * flusher thread. Each event is rendered to JSON once per batch. Delivery is
 * best-effort: when the queue is full the oldest event is dropped, and clients
 * catch up through the event replay endpoint.
 */
public class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int QUEUE_CAPACITY = 100_000;
    private static final int MAX_EVENTS_PER_FLUSH = 2000;

    private final ConcurrentMap<WebSocketChannel, WsSession> sessions = new ConcurrentHashMap<>();
    private final BlockingQueue<TodoEvent> pending = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final ScheduledExecutorService flusher = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-todo-flusher");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong frameSeq = new AtomicLong(0);
    private volatile int flushMs = 100;

    /**
     * Inbound frame: {"action":"subscribe|unsubscribe|ping", "topics":[...], "nonce":"..."}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClientFrame(String action, List<String> topics, String nonce) {}

    /**
     * Outbound frame. {@code seq} orders frames on this hub, not events.
     */
    public record ServerFrame(String type, JsonNode payload, String ts, long seq) {}

    public void setFlushMs(int flushMs) {
        this.flushMs = Math.max(10, flushMs);
    }

    public void start() {
        flusher.scheduleAtFixedRate(this::flush, flushMs, flushMs, TimeUnit.MILLISECONDS);
        log.info("WsHub flushing todo events every {}ms", flushMs);
    }

    public void stop() {
        flusher.shutdownNow();
        for (WebSocketChannel channel : sessions.keySet()) {
            disconnect(channel);
        }
        log.info("WsHub stopped");
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTIONS
    // ═══════════════════════════════════════════════════════════════

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                WsSession session = openSession(parseQuery(exchange.getQueryString()));
                if (session == null) {
                    log.warn("WS rejected from {}: neither farmId nor agentId given", channel.getSourceAddress());
                    send(channel, TodoEventType.ERROR, errorPayload("farmId or agentId is required"));
                    closeQuietly(channel);
                    return;
                }
                sessions.put(channel, session);
                log.info("WS {} watching farm={} agent={} from {}",
                    session.getSessionId(), session.getFarmId(), session.getAgentId(), channel.getSourceAddress());

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        onClientFrame(ch, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        disconnect(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("WS {} error: {}", sessionIdOf(ch), error.toString());
                        disconnect(ch);
                    }
                });
                channel.resumeReceives();
                send(channel, TodoEventType.ACK, ackPayload("connect", session));
            }
        });
    }

    /**
     * Session for the connect query, or null when it names neither a farm nor an agent.
     */
    static WsSession openSession(Map<String, String> params) {
        String farmId = params.get("farmId");
        String agentId = params.get("agentId");
        if (farmId == null && agentId == null) {
            return null;
        }
        WsSession session = new WsSession(UUID.randomUUID().toString(), farmId, agentId);
        String topics = params.get("topics");
        if (topics != null) {
            session.subscribeTopics(splitTopics(topics));
        }
        return session;
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8).trim();
            if (!value.isEmpty()) {
                params.put(pair.substring(0, eq), value);
            }
        }
        return params;
    }

    private static Set<String> splitTopics(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(t -> !t.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void onClientFrame(WebSocketChannel channel, String raw) {
        WsSession session = sessions.get(channel);
        if (session == null) {
            send(channel, TodoEventType.ERROR, errorPayload("Unknown session"));
            return;
        }

        ClientFrame frame;
        try {
            frame = MAPPER.readValue(raw, ClientFrame.class);
        } catch (JsonProcessingException e) {
            send(channel, TodoEventType.ERROR, errorPayload("Invalid JSON: " + e.getOriginalMessage()));
            return;
        }

        String action = frame.action() == null ? "" : frame.action();
        Set<String> topics = frame.topics() == null ? Set.of() : new LinkedHashSet<>(frame.topics());
        switch (action) {
            case "subscribe" -> {
                session.subscribeTopics(topics);
                send(channel, TodoEventType.ACK, ackPayload(action, session));
            }
            case "unsubscribe" -> {
                session.unsubscribeTopics(topics);
                send(channel, TodoEventType.ACK, ackPayload(action, session));
            }
            case "ping" -> {
                ObjectNode pong = MAPPER.createObjectNode();
                pong.put("nonce", frame.nonce() == null ? "" : frame.nonce());
                send(channel, TodoEventType.PONG, pong);
            }
            case "" -> send(channel, TodoEventType.ERROR, errorPayload("Missing 'action'"));
            default -> send(channel, TodoEventType.ERROR, errorPayload("Unknown action: " + action));
        }
    }

    private static ObjectNode ackPayload(String action, WsSession session) {
        ObjectNode ack = MAPPER.createObjectNode();
        ack.put("action", action);
        ack.put("sessionId", session.getSessionId());
        if (session.getFarmId() != null) {
            ack.put("farmId", session.getFarmId());
        }
        if (session.getAgentId() != null) {
            ack.put("agentId", session.getAgentId());
        }
        ArrayNode topics = ack.putArray("topics");
        session.getTopics().forEach(topics::add);
        return ack;
    }

    private static ObjectNode errorPayload(String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        return error;
    }

    private void send(WebSocketChannel channel, TodoEventType type, JsonNode payload) {
        ServerFrame frame = new ServerFrame(type.name(), payload, Instant.now().toString(), frameSeq.incrementAndGet());
        try {
            WebSockets.sendText(MAPPER.writeValueAsString(frame), channel, null);
        } catch (JsonProcessingException e) {
            log.warn("WS {} frame not serializable: {}", sessionIdOf(channel), e.toString());
        }
    }

    private String sessionIdOf(WebSocketChannel channel) {
        WsSession session = sessions.get(channel);
        return session == null ? "?" : session.getSessionId();
    }

    private void disconnect(WebSocketChannel channel) {
        WsSession session = sessions.remove(channel);
        if (session != null) {
            log.info("WS {} closed (farm={}, agent={})",
                session.getSessionId(), session.getFarmId(), session.getAgentId());
        }
        closeQuietly(channel);
    }

    private static void closeQuietly(WebSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close failed: {}", e.toString());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // DELIVERY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Queue an event for the next flush. Never blocks.
     */
    public void publish(TodoEvent event) {
        while (!pending.offer(event)) {
            TodoEvent dropped = pending.poll();
            if (dropped != null) {
                log.debug("WS queue full, dropped event seq {}", dropped.seq());
            }
        }
    }

    void flush() {
        try {
            List<TodoEvent> batch = new ArrayList<>();
            pending.drainTo(batch, MAX_EVENTS_PER_FLUSH);
            if (batch.isEmpty()) {
                return;
            }
            Map<WsSession, WebSocketChannel> channels = new LinkedHashMap<>();
            sessions.forEach((channel, session) -> channels.put(session, channel));

            fanOut(batch, channels.keySet()).forEach((session, events) -> {
                ObjectNode payload = MAPPER.createObjectNode();
                payload.set("events", events);
                send(channels.get(session), TodoEventType.BATCH, payload);
            });
        } catch (RuntimeException e) {
            // keep the scheduled flusher alive
            log.warn("WS flush failed: {}", e.toString());
        }
    }

    /**
     * Per-session event arrays for one batch; sessions receiving nothing are absent.
     */
    static Map<WsSession, ArrayNode> fanOut(List<TodoEvent> batch, Iterable<WsSession> sessions) {
        List<ObjectNode> rendered = new ArrayList<>(batch.size());
        for (TodoEvent event : batch) {
            rendered.add(eventToJson(event));
        }

        Map<WsSession, ArrayNode> out = new LinkedHashMap<>();
        for (WsSession session : sessions) {
            for (int i = 0; i < batch.size(); i++) {
                if (session.shouldReceive(batch.get(i))) {
                    out.computeIfAbsent(session, s -> MAPPER.createArrayNode()).add(rendered.get(i));
                }
            }
        }
        return out;
    }

    public static ObjectNode eventToJson(TodoEvent e) {
        ObjectNode obj = MAPPER.createObjectNode();
        obj.put("type", e.type().name());
        obj.put("seq", e.seq());
        obj.set("payload", e.payload());
        obj.put("ts", e.ts().toString());
        if (e.farmId() != null) {
            obj.put("farmId", e.farmId());
        }
        if (e.agentId() != null) {
            obj.put("agentId", e.agentId());
        }
        if (e.todoId() != null) {
            obj.put("todoId", e.todoId());
        }
        if (e.createdBy() != null) {
            obj.put("createdBy", e.createdBy());
        }
        return obj;
    }

    public int pendingCount() {
        return pending.size();
    }

    public int getConnectionCount() {
        return sessions.size();
    }
}
