package in.taskfarm.transport.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.taskfarm.application.port.input.FarmTodoService;
import in.taskfarm.application.service.TodoEventService;
import in.taskfarm.domain.command.BulkAssignRequest;
import in.taskfarm.domain.command.BulkOperationType;
import in.taskfarm.domain.command.BulkTodoOperation;
import in.taskfarm.domain.command.FarmGoal;
import in.taskfarm.domain.common.CoordinationConflictException;
import in.taskfarm.domain.common.PartialRollbackException;
import in.taskfarm.domain.common.TodoEvent;
import in.taskfarm.domain.common.TodoNotFoundException;
import in.taskfarm.domain.common.TodoStoreException;
import in.taskfarm.domain.common.TodoValidationException;
import in.taskfarm.domain.common.ValidationErrorCode;
import in.taskfarm.domain.todo.CreateTodoRequest;
import in.taskfarm.domain.todo.TodoCategory;
import in.taskfarm.domain.todo.TodoFilter;
import in.taskfarm.domain.todo.TodoPriority;
import in.taskfarm.domain.todo.TodoStatus;
import in.taskfarm.transport.ws.WsHub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.List;

/**
 * HTTP API handlers for farm todo coordination.
 *
 * Error mapping:
 * - validation and malformed JSON: 400
 * - unknown todo: 404
 * - reassignment conflict: 409
 * - store failure after retries: 503
 * - failed rollback: 500
 */
public final class FarmTodoHandlers {
    private static final Logger log = LoggerFactory.getLogger(FarmTodoHandlers.class);
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final int DEFAULT_EVENT_LIMIT = 200;
    private static final int MAX_EVENT_LIMIT = 2000;

    private final FarmTodoService service;
    private final TodoEventService eventService;
    private final WsHub wsHub;

    public FarmTodoHandlers(FarmTodoService service, TodoEventService eventService, WsHub wsHub) {
        this.service = service;
        this.eventService = eventService;
        this.wsHub = wsHub;
    }

    // ═══════════════════════════════════════════════════════════════
    // REQUEST BODIES
    // ═══════════════════════════════════════════════════════════════

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BulkOperationBody(
        @JsonProperty("type") BulkOperationType type,
        @JsonProperty("creates") List<CreateTodoRequest> creates,
        @JsonProperty("todoIds") List<String> todoIds,
        @JsonProperty("status") TodoStatus status,
        @JsonProperty("actor") String actor
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusBody(
        @JsonProperty("status") TodoStatus status,
        @JsonProperty("actor") String actor
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentBody(
        @JsonProperty("agentId") String agentId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GoalTodosBody(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("priority") String priority,
        @JsonProperty("targetDate") Instant targetDate,
        @JsonProperty("targetValue") Double targetValue,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("customInstructions") String customInstructions,
        @JsonProperty("agentIds") List<String> agentIds
    ) {}

    // ═══════════════════════════════════════════════════════════════
    // HEALTH
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        try {
            ObjectNode response = MAPPER.createObjectNode();
            response.put("status", "ok");
            response.put("ts", Instant.now().toString());
            response.put("wsConnections", wsHub.getConnectionCount());
            sendJson(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            serverError(exchange, e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FARM
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/farms/{farmId}/todos
     */
    public void getFarmTodos(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        try {
            sendJson(exchange, StatusCodes.OK, service.getFarmTodos(farmId));
        } catch (Exception e) {
            handleFailure(exchange, "getFarmTodos", e);
        }
    }

    /**
     * POST /api/farms/{farmId}/todos
     */
    public void createFarmTodo(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                CreateTodoRequest request = MAPPER.readValue(body, CreateTodoRequest.class);
                if (request.farmId() != null && !request.farmId().equals(farmId)) {
                    throw new TodoValidationException(ValidationErrorCode.FARM_MISMATCH, request.farmId());
                }
                sendJson(ex, StatusCodes.CREATED, service.createTodo(request.withFarmId(farmId)));
            } catch (Exception e) {
                handleFailure(ex, "createTodo", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/farms/{farmId}/todos/bulk
     *
     * Body: {"type":"create|update|delete", "creates":[...], "todoIds":[...], "status":"...", "actor":"..."}
     */
    public void bulkOperation(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                BulkOperationBody b = MAPPER.readValue(body, BulkOperationBody.class);
                BulkTodoOperation op = new BulkTodoOperation(farmId, b.type(), b.creates(), b.todoIds(),
                    b.status(), b.actor());
                sendJson(ex, StatusCodes.OK, service.bulkOperation(op));
            } catch (Exception e) {
                handleFailure(ex, "bulkOperation", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/farms/{farmId}/bulk-assign
     */
    public void bulkAssign(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                BulkAssignRequest request = MAPPER.readValue(body, BulkAssignRequest.class);
                sendJson(ex, StatusCodes.CREATED, service.bulkAssign(farmId, request));
            } catch (Exception e) {
                handleFailure(ex, "bulkAssign", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/farms/{farmId}/rebalance
     */
    public void rebalance(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        try {
            sendJson(exchange, StatusCodes.OK, service.rebalanceWorkload(farmId));
        } catch (Exception e) {
            handleFailure(exchange, "rebalanceWorkload", e);
        }
    }

    /**
     * POST /api/farms/{farmId}/prioritize
     */
    public void prioritize(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        try {
            sendJson(exchange, StatusCodes.OK, service.updatePriorities(farmId));
        } catch (Exception e) {
            handleFailure(exchange, "updatePriorities", e);
        }
    }

    /**
     * POST /api/farms/{farmId}/optimize
     */
    public void optimize(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        try {
            sendJson(exchange, StatusCodes.OK, service.optimizeAssignments(farmId));
        } catch (Exception e) {
            handleFailure(exchange, "optimizeAssignments", e);
        }
    }

    /**
     * POST /api/farms/{farmId}/goals/{goalId}/todos
     *
     * Body: {"name":"...", "description":"...", "priority":"high", "targetDate":"...",
     *        "targetValue":0.0, "strategy":"...", "customInstructions":"...", "agentIds":[...]}
     */
    public void createGoalTodos(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        String goalId = pathParam(exchange, "goalId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                GoalTodosBody b = MAPPER.readValue(body, GoalTodosBody.class);
                FarmGoal goal = new FarmGoal(goalId, b.name(), b.description(), b.priority(), b.targetDate(),
                    b.targetValue(), b.strategy(), b.customInstructions());
                sendJson(ex, StatusCodes.CREATED, service.createTodosFromGoal(farmId, goal, b.agentIds()));
            } catch (Exception e) {
                handleFailure(ex, "createTodosFromGoal", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/farms/{farmId}/agents
     *
     * Body: {"agentId":"..."}
     */
    public void addAgent(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                AgentBody b = MAPPER.readValue(body, AgentBody.class);
                sendJson(ex, StatusCodes.OK, service.addAgentToFarm(farmId, b.agentId()));
            } catch (Exception e) {
                handleFailure(ex, "addAgentToFarm", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * DELETE /api/farms/{farmId}/agents/{agentId}
     */
    public void removeAgent(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        String agentId = pathParam(exchange, "agentId");
        try {
            sendJson(exchange, StatusCodes.OK, service.removeAgentFromFarm(farmId, agentId));
        } catch (Exception e) {
            handleFailure(exchange, "removeAgentFromFarm", e);
        }
    }

    /**
     * GET /api/farms/{farmId}/events?afterSeq=0&limit=200
     *
     * Replay of persisted events for clients that missed WebSocket pushes.
     */
    public void events(HttpServerExchange exchange) {
        String farmId = pathParam(exchange, "farmId");
        try {
            Deque<String> afterSeqQ = exchange.getQueryParameters().get("afterSeq");
            Deque<String> limitQ = exchange.getQueryParameters().get("limit");

            long afterSeq = afterSeqQ == null ? 0L : Long.parseLong(afterSeqQ.peekFirst());
            int limit = limitQ == null ? DEFAULT_EVENT_LIMIT : Integer.parseInt(limitQ.peekFirst());
            limit = Math.max(1, Math.min(limit, MAX_EVENT_LIMIT));

            List<TodoEvent> events = eventService.eventsAfter(farmId, afterSeq, limit);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("farmId", farmId);
            response.put("afterSeq", afterSeq);
            response.put("latestSeq", eventService.currentSeq());

            ArrayNode eventsArray = MAPPER.createArrayNode();
            for (TodoEvent e : events) {
                eventsArray.add(WsHub.eventToJson(e));
            }
            response.set("events", eventsArray);

            sendJson(exchange, StatusCodes.OK, response);
        } catch (NumberFormatException e) {
            badRequest(exchange, ValidationErrorCode.MALFORMED_REQUEST.name(), "afterSeq and limit must be numbers");
        } catch (Exception e) {
            handleFailure(exchange, "events", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // AGENT AND TODO
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/agents/{agentId}/todos?status=&priority=&category=&farmId=
     */
    public void getAgentTodos(HttpServerExchange exchange) {
        String agentId = pathParam(exchange, "agentId");
        try {
            String status = queryParam(exchange, "status");
            String priority = queryParam(exchange, "priority");
            String category = queryParam(exchange, "category");

            TodoFilter filter = new TodoFilter(
                status == null ? null : TodoStatus.fromWire(status),
                priority == null ? null : TodoPriority.fromWire(priority),
                category == null ? null : TodoCategory.fromWire(category),
                queryParam(exchange, "farmId"));

            sendJson(exchange, StatusCodes.OK, service.getAgentTodos(agentId, filter));
        } catch (IllegalArgumentException e) {
            badRequest(exchange, ValidationErrorCode.MALFORMED_REQUEST.name(), e.getMessage());
        } catch (Exception e) {
            handleFailure(exchange, "getAgentTodos", e);
        }
    }

    /**
     * POST /api/agents/{agentId}/todos
     *
     * Creates an individual todo; a body carrying farmId creates a farm todo instead.
     */
    public void createAgentTodo(HttpServerExchange exchange) {
        String agentId = pathParam(exchange, "agentId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                CreateTodoRequest request = MAPPER.readValue(body, CreateTodoRequest.class);
                sendJson(ex, StatusCodes.CREATED, service.createAgentTodo(request.withAgentId(agentId)));
            } catch (Exception e) {
                handleFailure(ex, "createAgentTodo", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * PATCH /api/todos/{todoId}/status
     *
     * Body: {"status":"inProgress", "actor":"agent-1"}
     */
    public void updateTodoStatus(HttpServerExchange exchange) {
        String todoId = pathParam(exchange, "todoId");
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                StatusBody b = MAPPER.readValue(body, StatusBody.class);
                if (b.status() == null) {
                    throw new TodoValidationException(ValidationErrorCode.MISSING_STATUS);
                }
                sendJson(ex, StatusCodes.OK, service.updateTodoStatus(todoId, b.status(), b.actor()));
            } catch (Exception e) {
                handleFailure(ex, "updateTodoStatus", e);
            }
        }, StandardCharsets.UTF_8);
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private void handleFailure(HttpServerExchange exchange, String operation, Exception e) {
        if (e instanceof TodoValidationException ve) {
            log.debug("{} rejected: {}", operation, ve.getMessage());
            badRequest(exchange, ve.getCode().name(), ve.getMessage());
        } else if (e instanceof JsonProcessingException) {
            log.debug("{} malformed body: {}", operation, e.getMessage());
            badRequest(exchange, ValidationErrorCode.MALFORMED_REQUEST.name(), "Malformed JSON body");
        } else if (e instanceof TodoNotFoundException) {
            sendError(exchange, StatusCodes.NOT_FOUND, "NOT_FOUND", e.getMessage());
        } else if (e instanceof CoordinationConflictException) {
            log.warn("{} conflict: {}", operation, e.getMessage());
            sendError(exchange, StatusCodes.CONFLICT, "CONFLICT", e.getMessage());
        } else if (e instanceof TodoStoreException se) {
            log.error("{} store failure: {}", operation, se.getMessage());
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, se.isTimeout() ? "STORE_TIMEOUT" : "STORE_ERROR",
                se.getMessage());
        } else if (e instanceof PartialRollbackException pe) {
            log.error("{} left inconsistent todos: {}", operation, pe.getInconsistentTodoIds());
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "PARTIAL_ROLLBACK", pe.getMessage());
        } else {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            serverError(exchange, "Internal error");
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return null;
        }
        return values.peekFirst();
    }

    private static void sendJson(HttpServerExchange exchange, int status, Object body) throws Exception {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
    }

    private void badRequest(HttpServerExchange exchange, String code, String message) {
        sendError(exchange, StatusCodes.BAD_REQUEST, code, message);
    }

    private void serverError(HttpServerExchange exchange, String message) {
        sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "INTERNAL", message);
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        error.put("code", code);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }
}
