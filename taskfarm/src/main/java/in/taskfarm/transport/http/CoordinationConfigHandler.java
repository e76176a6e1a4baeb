package in.taskfarm.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.config.CoordinationConfigService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * HTTP handler for coordination tuning.
 *
 * Provides REST API for:
 * - GET /api/admin/coordination/config - Get current configuration
 * - POST /api/admin/coordination/config - Update configuration
 */
public final class CoordinationConfigHandler {
    private static final Logger log = LoggerFactory.getLogger(CoordinationConfigHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CoordinationConfigService configService;

    public CoordinationConfigHandler(CoordinationConfigService configService) {
        this.configService = configService;
    }

    /**
     * GET /api/admin/coordination/config
     */
    public void getConfig(HttpServerExchange exchange) {
        try {
            String json = MAPPER.writeValueAsString(configService.getConfig());

            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);

            log.debug("GET /api/admin/coordination/config → 200 OK");

        } catch (Exception e) {
            log.error("Failed to get coordination config: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get configuration: " + e.getMessage());
        }
    }

    /**
     * POST /api/admin/coordination/config
     *
     * Takes effect on the next coordination operation.
     */
    public void updateConfig(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, requestBody) -> {
            try {
                CoordinationConfig newConfig = MAPPER.readValue(requestBody, CoordinationConfig.class);

                configService.updateConfig(newConfig);

                exch.setStatusCode(StatusCodes.OK);
                exch.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exch.getResponseSender().send("{\"success\":true,\"message\":\"Configuration updated successfully\"}",
                        StandardCharsets.UTF_8);

                log.info("POST /api/admin/coordination/config → 200 OK (horizon={}min, retries={})",
                        newConfig.dueSoonHorizonMinutes(), newConfig.maxConflictRetries());

            } catch (IllegalArgumentException e) {
                log.warn("Invalid configuration: {}", e.getMessage());
                sendError(exch, StatusCodes.BAD_REQUEST, "Invalid configuration: " + e.getMessage());

            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                log.warn("Malformed configuration body: {}", e.getOriginalMessage());
                sendError(exch, StatusCodes.BAD_REQUEST, "Malformed configuration JSON");

            } catch (IOException e) {
                log.error("Failed to save configuration: {}", e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to save configuration: " + e.getMessage());

            } catch (Exception e) {
                log.error("Unexpected error updating configuration: {}", e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
