package in.taskfarm.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility
 * - Prometheus text format
 * - Coordination metrics recording and export
 */
public class MetricsEndpointTest {

    private Undertow server;
    private PrometheusCoordinationMetrics metrics;
    private HttpClient httpClient;
    private String metricsUrl;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test so counters start at zero
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusCoordinationMetrics(registry);

        PrometheusMetricsHandler metricsHandler =
            new PrometheusMetricsHandler(metrics.getRegistry());

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", metricsHandler)
            )
            .build();

        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        metricsUrl = "http://localhost:" + address.getPort() + "/metrics";

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");

        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsContainExpectedMetrics() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("taskfarm_operations_total"),
            "Metrics should contain taskfarm_operations_total");
        assertTrue(body.contains("taskfarm_operation_latency_seconds"),
            "Metrics should contain taskfarm_operation_latency_seconds");
        assertTrue(body.contains("taskfarm_rollbacks_total"),
            "Metrics should contain taskfarm_rollbacks_total");
        assertTrue(body.contains("taskfarm_conflict_retries_total"),
            "Metrics should contain taskfarm_conflict_retries_total");
        assertTrue(body.contains("taskfarm_cached_farms"),
            "Metrics should contain taskfarm_cached_farms");

        assertTrue(body.contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(body.contains("# TYPE"), "Metrics should contain TYPE declarations");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordOperation("bulkAssign", "success", Duration.ofMillis(40));
        metrics.recordOperation("bulkAssign", "store_error", Duration.ofMillis(900));
        metrics.recordRollback("bulkAssign");
        metrics.recordMoves("rebalanceWorkload", 4);
        metrics.recordMoves("optimizeAssignments", 0);
        metrics.setCachedFarms(2);

        String body = scrape().body();

        assertTrue(body.contains("taskfarm_operations_total{operation=\"bulkAssign\",outcome=\"success\",} 1.0"),
            "Should show successful operation");
        assertTrue(body.contains("outcome=\"store_error\""), "Should show failed operation");
        assertTrue(body.contains("taskfarm_operation_latency_seconds_count{operation=\"bulkAssign\",} 2.0"),
            "Should show latency observations");
        assertTrue(body.contains("taskfarm_rollbacks_total{operation=\"bulkAssign\",} 1.0"),
            "Should show rollback");
        assertTrue(body.contains("taskfarm_task_moves_total{operation=\"rebalanceWorkload\",} 4.0"),
            "Should show moves");
        assertFalse(body.contains("operation=\"optimizeAssignments\""),
            "Zero moves should not create a series");
        assertTrue(body.contains("taskfarm_cached_farms 2.0"), "Should show cached farms");
    }

    @Test
    public void testNameFilter() throws Exception {
        metrics.recordOperation("bulkAssign", "success", Duration.ofMillis(40));
        metrics.setCachedFarms(3);

        String body = scrape("?name%5B%5D=taskfarm_cached_farms").body();

        assertTrue(body.contains("taskfarm_cached_farms 3.0"), "Should show requested metric");
        assertFalse(body.contains("outcome=\"success\""), "Should omit other metrics");
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(metricsUrl + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
