package in.taskfarm.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.taskfarm.application.monitoring.AlertService;
import in.taskfarm.application.port.output.FarmRosterRepository;
import in.taskfarm.application.port.output.TodoEventRepository;
import in.taskfarm.application.port.output.TodoRepository;
import in.taskfarm.application.service.AssignmentEngine;
import in.taskfarm.application.service.AssignmentOptimizer;
import in.taskfarm.application.service.FarmSnapshotBuilder;
import in.taskfarm.application.service.FarmSnapshotCache;
import in.taskfarm.application.service.FarmTodoCoordinator;
import in.taskfarm.application.service.FarmWriteCoordinator;
import in.taskfarm.application.service.PriorityClassifier;
import in.taskfarm.application.service.ProgressAggregator;
import in.taskfarm.application.service.TodoEventService;
import in.taskfarm.application.service.TodoRequestValidator;
import in.taskfarm.application.service.WorkloadBalancer;
import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.config.CoordinationConfigService;
import in.taskfarm.infrastructure.metrics.CoordinationMetrics;
import in.taskfarm.infrastructure.metrics.PrometheusCoordinationMetrics;
import in.taskfarm.infrastructure.metrics.PrometheusMetricsHandler;
import in.taskfarm.infrastructure.persistence.InMemoryFarmRosterRepository;
import in.taskfarm.infrastructure.persistence.InMemoryTodoEventRepository;
import in.taskfarm.infrastructure.persistence.InMemoryTodoRepository;
import in.taskfarm.infrastructure.persistence.PostgresFarmRosterRepository;
import in.taskfarm.infrastructure.persistence.PostgresTodoEventRepository;
import in.taskfarm.infrastructure.persistence.PostgresTodoRepository;
import in.taskfarm.migration.TodoSchemaMigration;
import in.taskfarm.transport.http.CoordinationConfigHandler;
import in.taskfarm.transport.http.FarmTodoHandlers;
import in.taskfarm.transport.ws.WsHub;
import in.taskfarm.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Core Java entry point (NO Spring).
 *
 * Farm todo coordination service:
 * - PostgreSQL or in-memory todo store (STORE_MODE)
 * - Per-farm serialized writes with snapshot reads
 * - Event log with WebSocket fan-out
 * - Prometheus metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TaskFarm Coordinator Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        int wsBatchFlushMs = Env.getInt("WS_BATCH_FLUSH_MS", 100);
        String storeMode = Env.get("STORE_MODE", "memory");
        String configDir = Env.get("CONFIG_DIR", "./config");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        CoordinationConfigService configService = new CoordinationConfigService(configDir);
        StartupConfigValidator.validate(storeMode, port, configService.getConfig());
        log.info("✓ Coordination config service initialized: {}", configDir);

        // ═══════════════════════════════════════════════════════════════
        // Store
        // ═══════════════════════════════════════════════════════════════
        TodoRepository todoRepo;
        FarmRosterRepository rosterRepo;
        TodoEventRepository eventRepo;
        if (StartupConfigValidator.STORE_POSTGRES.equalsIgnoreCase(storeMode)) {
            DataSource dataSource = createDataSource();
            new TodoSchemaMigration(dataSource).migrate();
            todoRepo = new PostgresTodoRepository(dataSource);
            rosterRepo = new PostgresFarmRosterRepository(dataSource);
            eventRepo = new PostgresTodoEventRepository(dataSource);
            log.info("✓ PostgreSQL store ready");
        } else {
            todoRepo = new InMemoryTodoRepository();
            rosterRepo = new InMemoryFarmRosterRepository();
            eventRepo = new InMemoryTodoEventRepository();
            log.info("✓ In-memory store ready (data is lost on restart)");
        }

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusCoordinationMetrics metrics = new PrometheusCoordinationMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // WebSocket hub and events
        // ═══════════════════════════════════════════════════════════════
        WsHub wsHub = new WsHub();
        wsHub.setFlushMs(wsBatchFlushMs);
        wsHub.start();
        Clock clock = Clock.systemUTC();
        TodoEventService eventService = new TodoEventService(eventRepo, wsHub, metrics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Coordination
        // ═══════════════════════════════════════════════════════════════
        FarmWriteCoordinator writeCoordinator = new FarmWriteCoordinator();
        FarmTodoCoordinator coordinator = createCoordinator(todoRepo, rosterRepo, writeCoordinator,
            eventService, new AlertService(), metrics, configService, clock);
        log.info("✓ Farm todo coordinator ready ({} writer partitions)", writeCoordinator.getPartitionCount());

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        FarmTodoHandlers api = new FarmTodoHandlers(coordinator, eventService, wsHub);
        CoordinationConfigHandler configHandler = new CoordinationConfigHandler(configService);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = routes(api, configHandler, metricsHandler, wsHub);

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("TaskFarm coordinator started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            wsHub.stop();
            writeCoordinator.shutdown();
            log.info("Shutdown complete");
        }, "shutdown-hook"));
    }

    /**
     * Wire the coordination services around the given store and event channel.
     */
    public static FarmTodoCoordinator createCoordinator(
            TodoRepository todoRepo,
            FarmRosterRepository rosterRepo,
            FarmWriteCoordinator writeCoordinator,
            TodoEventService eventService,
            AlertService alertService,
            CoordinationMetrics metrics,
            Supplier<CoordinationConfig> config,
            Clock clock) {
        TodoRequestValidator validator = new TodoRequestValidator(config);
        PriorityClassifier classifier = new PriorityClassifier(config);
        FarmSnapshotBuilder snapshotBuilder = new FarmSnapshotBuilder(
            todoRepo, rosterRepo, classifier, new ProgressAggregator(), clock);
        AssignmentEngine engine = new AssignmentEngine(todoRepo, validator, config, metrics, clock);

        return new FarmTodoCoordinator(
            todoRepo,
            rosterRepo,
            writeCoordinator,
            new FarmSnapshotCache(),
            snapshotBuilder,
            engine,
            new WorkloadBalancer(config),
            new AssignmentOptimizer(config),
            validator,
            eventService,
            alertService,
            metrics,
            config,
            clock);
    }

    /**
     * HTTP routes. API handlers run on worker threads since they wait on the
     * farm writer partitions.
     */
    public static RoutingHandler routes(FarmTodoHandlers api, CoordinationConfigHandler configHandler,
                                        HttpHandler metricsHandler, WsHub wsHub) {
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", api::health)
            // Farm
            .get("/api/farms/{farmId}/todos", blocking(api::getFarmTodos))
            .post("/api/farms/{farmId}/todos", blocking(api::createFarmTodo))
            .post("/api/farms/{farmId}/todos/bulk", blocking(api::bulkOperation))
            .post("/api/farms/{farmId}/bulk-assign", blocking(api::bulkAssign))
            .post("/api/farms/{farmId}/rebalance", blocking(api::rebalance))
            .post("/api/farms/{farmId}/prioritize", blocking(api::prioritize))
            .post("/api/farms/{farmId}/optimize", blocking(api::optimize))
            .post("/api/farms/{farmId}/goals/{goalId}/todos", blocking(api::createGoalTodos))
            .post("/api/farms/{farmId}/agents", blocking(api::addAgent))
            .delete("/api/farms/{farmId}/agents/{agentId}", blocking(api::removeAgent))
            .get("/api/farms/{farmId}/events", blocking(api::events))
            // Agent and todo
            .get("/api/agents/{agentId}/todos", blocking(api::getAgentTodos))
            .post("/api/agents/{agentId}/todos", blocking(api::createAgentTodo))
            .add("PATCH", "/api/todos/{todoId}/status", blocking(api::updateTodoStatus))
            // Admin
            .get("/api/admin/coordination/config", configHandler::getConfig)
            .post("/api/admin/coordination/config", blocking(configHandler::updateConfig))
            .get("/ws", wsHub.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "TaskFarm Coordinator\n\n" +
                    "API: /api/farms/{farmId}/todos, /api/agents/{agentId}/todos, /api/todos/{todoId}/status\n" +
                    "WS:  /ws?farmId=<farm> or /ws?agentId=<agent>\n"
                );
            });
    }

    private static HttpHandler blocking(HttpHandler handler) {
        return new BlockingHandler(handler);
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/taskfarm");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("taskfarm-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
