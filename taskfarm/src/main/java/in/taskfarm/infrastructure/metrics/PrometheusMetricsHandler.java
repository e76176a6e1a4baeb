package in.taskfarm.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for Prometheus /metrics endpoint.
 *
 * Honors the scraper's Accept header (text 0.0.4 or OpenMetrics) and the
 * {@code name[]} query parameter for scraping selected metrics only.
 *
 * Sample output:
 * <pre>
 * # HELP taskfarm_operations_total Total number of coordination operations
 * # TYPE taskfarm_operations_total counter
 * taskfarm_operations_total{operation="bulkAssign",outcome="success",} 42.0
 * taskfarm_operations_total{operation="bulkAssign",outcome="TodoStoreException",} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, registry.filteredMetricFamilySamples(requestedNames(exchange)));
        } catch (IOException e) {
            log.error("Metrics export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
        log.debug("Served {} bytes of metrics", body.getBuffer().length());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        return names == null ? Set.of() : new HashSet<>(names);
    }
}
