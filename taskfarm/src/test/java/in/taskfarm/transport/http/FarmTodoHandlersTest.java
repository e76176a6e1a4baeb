package in.taskfarm.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.taskfarm.application.monitoring.AlertService;
import in.taskfarm.application.service.FarmTodoCoordinator;
import in.taskfarm.application.service.FarmWriteCoordinator;
import in.taskfarm.application.service.TodoEventService;
import in.taskfarm.bootstrap.App;
import in.taskfarm.config.CoordinationConfigService;
import in.taskfarm.infrastructure.metrics.PrometheusCoordinationMetrics;
import in.taskfarm.infrastructure.metrics.PrometheusMetricsHandler;
import in.taskfarm.infrastructure.persistence.InMemoryFarmRosterRepository;
import in.taskfarm.infrastructure.persistence.InMemoryTodoEventRepository;
import in.taskfarm.infrastructure.persistence.InMemoryTodoRepository;
import in.taskfarm.support.TodoFixtures;
import in.taskfarm.transport.ws.WsHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the HTTP API over the in-memory stores.
 *
 * Tests:
 * - Farm and agent routes
 * - Error mapping to status codes
 * - Event replay
 */
class FarmTodoHandlersTest {

    @TempDir
    Path configDir;

    private Undertow server;
    private FarmWriteCoordinator writer;
    private InMemoryTodoRepository todos;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        todos = new InMemoryTodoRepository();
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusCoordinationMetrics metrics = new PrometheusCoordinationMetrics(registry);
        WsHub wsHub = new WsHub();
        TodoEventService events = new TodoEventService(new InMemoryTodoEventRepository(), wsHub, metrics,
            TodoFixtures.CLOCK);
        writer = new FarmWriteCoordinator(2);
        FarmTodoCoordinator coordinator = App.createCoordinator(todos, new InMemoryFarmRosterRepository(), writer,
            events, new AlertService(), metrics, TodoFixtures::fastConfig, TodoFixtures.CLOCK);

        CoordinationConfigService configService = new CoordinationConfigService(configDir.toString());
        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(App.routes(
                new FarmTodoHandlers(coordinator, events, wsHub),
                new CoordinationConfigHandler(configService),
                new PrometheusMetricsHandler(registry),
                wsHub))
            .build();
        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        baseUrl = "http://localhost:" + address.getPort();
        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        writer.shutdown();
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/health", null);

        assertEquals(200, response.statusCode());
        assertEquals("ok", json(response).get("status").asText());
    }

    @Test
    void testCreateAndReadFarmTodos() throws Exception {
        HttpResponse<String> created = send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"agent-1\",\"title\":\"Check margin\",\"category\":\"trading\",\"priority\":\"high\"}");

        assertEquals(201, created.statusCode(), created.body());
        assertTrue(created.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode snapshot = json(created);
        assertEquals("farm-1", snapshot.get("farmId").asText());
        assertEquals(1, snapshot.get("version").asLong());
        JsonNode todo = snapshot.get("agentTodoLists").get("agent-1").get("todos").get(0);
        assertEquals("pending", todo.get("status").asText());
        assertEquals("high", todo.get("priority").asText());
        assertEquals(1, snapshot.get("priorities").get("planned").size());

        HttpResponse<String> read = send("GET", "/api/farms/farm-1/todos", null);
        assertEquals(200, read.statusCode());
        assertEquals(1, json(read).get("version").asLong());
    }

    @Test
    void testValidationAndMalformedBodiesAreBadRequests() throws Exception {
        HttpResponse<String> emptyTitle = send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"agent-1\",\"title\":\"  \",\"category\":\"trading\",\"priority\":\"high\"}");
        assertEquals(400, emptyTitle.statusCode());
        assertEquals("EMPTY_TITLE", json(emptyTitle).get("code").asText());

        HttpResponse<String> malformed = send("POST", "/api/farms/farm-1/todos", "{not json");
        assertEquals(400, malformed.statusCode());
        assertEquals("MALFORMED_REQUEST", json(malformed).get("code").asText());

        HttpResponse<String> mismatch = send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"a\",\"farmId\":\"farm-2\",\"title\":\"t\",\"category\":\"trading\",\"priority\":\"low\"}");
        assertEquals(400, mismatch.statusCode());
        assertEquals("FARM_MISMATCH", json(mismatch).get("code").asText());

        assertEquals(0, todos.size());
    }

    @Test
    void testStatusUpdateRoute() throws Exception {
        send("POST", "/api/farms/farm-1/bulk-assign",
            "{\"title\":\"Square off\",\"category\":\"trading\",\"priority\":\"critical\",\"agentIds\":[\"a\"]}");
        String todoId = todos.listByAgent("a").get(0).id();

        HttpResponse<String> forbidden = send("PATCH", "/api/todos/" + todoId + "/status",
            "{\"status\":\"completed\",\"actor\":\"b\"}");
        assertEquals(400, forbidden.statusCode());
        assertEquals("NOT_TODO_OWNER", json(forbidden).get("code").asText());

        HttpResponse<String> done = send("PATCH", "/api/todos/" + todoId + "/status",
            "{\"status\":\"completed\",\"actor\":\"a\"}");
        assertEquals(200, done.statusCode(), done.body());
        assertEquals("completed", json(done).get("todo").get("status").asText());
        assertEquals(100.0, json(done).get("farm").get("farmProgress").get("overallCompletion").asDouble(), 1e-9);

        HttpResponse<String> missing = send("PATCH", "/api/todos/todo_missing/status",
            "{\"status\":\"completed\",\"actor\":\"a\"}");
        assertEquals(404, missing.statusCode());

        HttpResponse<String> noStatus = send("PATCH", "/api/todos/" + todoId + "/status", "{\"actor\":\"a\"}");
        assertEquals("MISSING_STATUS", json(noStatus).get("code").asText());
    }

    @Test
    void testStoreFailureIsServiceUnavailable() throws Exception {
        todos.failPuts(true);

        HttpResponse<String> response = send("POST", "/api/farms/farm-1/bulk-assign",
            "{\"title\":\"Square off\",\"category\":\"trading\",\"priority\":\"high\",\"agentIds\":[\"a\",\"b\"]}");

        assertEquals(503, response.statusCode());
        assertEquals("STORE_ERROR", json(response).get("code").asText());
        assertEquals(0, todos.size());
    }

    @Test
    void testBulkOperationRoute() throws Exception {
        HttpResponse<String> created = send("POST", "/api/farms/farm-1/todos/bulk",
            "{\"type\":\"create\",\"creates\":["
                + "{\"agentId\":\"a\",\"title\":\"One\",\"category\":\"analysis\",\"priority\":\"low\"},"
                + "{\"agentId\":\"b\",\"title\":\"Two\",\"category\":\"analysis\",\"priority\":\"low\"}]}");
        assertEquals(200, created.statusCode(), created.body());
        assertEquals(2, todos.size());

        HttpResponse<String> unknownType = send("POST", "/api/farms/farm-1/todos/bulk", "{\"type\":\"upsert\"}");
        assertEquals(400, unknownType.statusCode());

        HttpResponse<String> empty = send("POST", "/api/farms/farm-1/todos/bulk", "{\"type\":\"delete\",\"todoIds\":[]}");
        assertEquals("EMPTY_BULK_OPERATION", json(empty).get("code").asText());
    }

    @Test
    void testRosterGoalsAndReassignmentRoutes() throws Exception {
        assertEquals(200, send("POST", "/api/farms/farm-1/agents", "{\"agentId\":\"a\"}").statusCode());
        assertEquals(200, send("POST", "/api/farms/farm-1/agents", "{\"agentId\":\"b\"}").statusCode());

        HttpResponse<String> goal = send("POST", "/api/farms/farm-1/goals/goal-1/todos",
            "{\"name\":\"Cut drawdown\",\"priority\":\"urgent\",\"strategy\":\"protective puts\","
                + "\"targetValue\":5.0,\"agentIds\":[\"a\",\"b\"]}");
        assertEquals(201, goal.statusCode(), goal.body());
        assertEquals(2, json(goal).get("sharedTodos").size());
        JsonNode shared = json(goal).get("sharedTodos").get(0);
        assertEquals("protective puts", shared.get("context").get("strategy").asText());
        assertEquals(5.0, shared.get("context").get("targetValue").asDouble());
        assertEquals(0, shared.get("progress").get("percentage").asInt());
        assertEquals(0, shared.get("dependsOn").size());
        assertEquals(0.0, json(goal).get("farmProgress").get("goalProgress").get("goal-1").asDouble());

        assertEquals(200, send("POST", "/api/farms/farm-1/rebalance", "").statusCode());
        assertEquals(200, send("POST", "/api/farms/farm-1/optimize", "").statusCode());
        assertEquals(200, send("POST", "/api/farms/farm-1/prioritize", "").statusCode());

        HttpResponse<String> left = send("DELETE", "/api/farms/farm-1/agents/b", null);
        assertEquals(200, left.statusCode());
        assertEquals(1, json(left).get("orphanedTodos").size());

        HttpResponse<String> again = send("DELETE", "/api/farms/farm-1/agents/b", null);
        assertEquals("AGENT_NOT_IN_FARM", json(again).get("code").asText());
    }

    @Test
    void testAgentRoutes() throws Exception {
        HttpResponse<String> own = send("POST", "/api/agents/agent-9/todos",
            "{\"title\":\"Read notes\",\"category\":\"analysis\",\"priority\":\"medium\"}");
        assertEquals(201, own.statusCode(), own.body());
        assertEquals("agent-9", json(own).get("agentId").asText());

        send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"agent-9\",\"title\":\"Farm work\",\"category\":\"trading\",\"priority\":\"high\"}");

        HttpResponse<String> all = send("GET", "/api/agents/agent-9/todos", null);
        assertEquals(2, json(all).get("todos").size());

        HttpResponse<String> filtered = send("GET", "/api/agents/agent-9/todos?priority=high&farmId=farm-1", null);
        assertEquals(1, json(filtered).get("todos").size());

        HttpResponse<String> bad = send("GET", "/api/agents/agent-9/todos?status=done", null);
        assertEquals(400, bad.statusCode());
    }

    @Test
    void testEventReplay() throws Exception {
        send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"a\",\"title\":\"First\",\"category\":\"trading\",\"priority\":\"low\"}");
        send("POST", "/api/farms/farm-1/todos",
            "{\"agentId\":\"a\",\"title\":\"Second\",\"category\":\"trading\",\"priority\":\"low\"}");

        JsonNode all = json(send("GET", "/api/farms/farm-1/events", null));
        // joined, created, created
        assertEquals(3, all.get("events").size());
        assertEquals(3, all.get("latestSeq").asLong());

        JsonNode tail = json(send("GET", "/api/farms/farm-1/events?afterSeq=2&limit=10", null));
        assertEquals(1, tail.get("events").size());
        assertEquals("TODO_CREATED", tail.get("events").get(0).get("type").asText());
        assertEquals("Second", tail.get("events").get(0).get("payload").get("title").asText());

        assertEquals(400, send("GET", "/api/farms/farm-1/events?afterSeq=x", null).statusCode());
    }

    @Test
    void testConfigRoundTripAndUnknownRoute() throws Exception {
        HttpResponse<String> config = send("GET", "/api/admin/coordination/config", null);
        assertEquals(200, config.statusCode());
        assertEquals(3, json(config).get("maxConflictRetries").asInt());
        assertFalse(json(config).has("valid"));

        HttpResponse<String> invalid = send("POST", "/api/admin/coordination/config",
            config.body().replace("\"overloadFactor\":1.2", "\"overloadFactor\":0.5"));
        assertEquals(400, invalid.statusCode());

        assertEquals(404, send("GET", "/nowhere", null).statusCode());
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .method(method, publisher)
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return FarmTodoHandlers.MAPPER.readTree(response.body());
    }
}
