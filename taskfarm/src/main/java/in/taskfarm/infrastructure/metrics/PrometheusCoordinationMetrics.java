package in.taskfarm.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of CoordinationMetrics interface.
 *
 * Exposes coordination metrics in Prometheus format for scraping.
 * Metrics are exposed at /metrics endpoint.
 *
 * Key Metrics:
 * - taskfarm_operations_total{operation, outcome} - Caller API outcomes
 * - taskfarm_operation_latency_seconds{operation} - Caller API latency
 * - taskfarm_rollbacks_total{operation} - Failed writes rolled back
 * - taskfarm_partial_rollbacks_total{operation} - Rollbacks that failed (page someone)
 * - taskfarm_conflict_retries_total{operation} - Stale rebalance proposals
 * - taskfarm_store_retries_total{operation} - Store failures retried
 * - taskfarm_task_moves_total{operation} - Todos reassigned
 * - taskfarm_event_failures_total{event_type} - Notifications not delivered
 * - taskfarm_cached_farms - Farms with a committed snapshot in memory
 *
 * Usage:
 * <pre>
 * PrometheusCoordinationMetrics metrics = new PrometheusCoordinationMetrics();
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusCoordinationMetrics implements CoordinationMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusCoordinationMetrics.class);

    private final CollectorRegistry registry;

    // Operation metrics
    private final Counter operationCounter;
    private final Histogram operationLatency;

    // Consistency metrics
    private final Counter rollbackCounter;
    private final Counter partialRollbackCounter;
    private final Counter conflictRetryCounter;
    private final Counter storeRetryCounter;

    // Reassignment metrics
    private final Counter moveCounter;

    // Notification metrics
    private final Counter eventFailureCounter;

    // Cache metrics
    private final Gauge cachedFarms;

    public PrometheusCoordinationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusCoordinationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.operationCounter = Counter.build()
            .name("taskfarm_operations_total")
            .help("Total number of coordination operations")
            .labelNames("operation", "outcome")
            .register(registry);

        this.operationLatency = Histogram.build()
            .name("taskfarm_operation_latency_seconds")
            .help("Coordination operation latency in seconds")
            .labelNames("operation")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.rollbackCounter = Counter.build()
            .name("taskfarm_rollbacks_total")
            .help("Total number of failed writes rolled back")
            .labelNames("operation")
            .register(registry);

        this.partialRollbackCounter = Counter.build()
            .name("taskfarm_partial_rollbacks_total")
            .help("Total number of rollbacks that failed and left inconsistent todos")
            .labelNames("operation")
            .register(registry);

        this.conflictRetryCounter = Counter.build()
            .name("taskfarm_conflict_retries_total")
            .help("Total number of reassignment proposals discarded because the farm changed")
            .labelNames("operation")
            .register(registry);

        this.storeRetryCounter = Counter.build()
            .name("taskfarm_store_retries_total")
            .help("Total number of operations retried after a store failure")
            .labelNames("operation")
            .register(registry);

        this.moveCounter = Counter.build()
            .name("taskfarm_task_moves_total")
            .help("Total number of todos reassigned between agents")
            .labelNames("operation")
            .register(registry);

        this.eventFailureCounter = Counter.build()
            .name("taskfarm_event_failures_total")
            .help("Total number of notifications that could not be persisted or pushed")
            .labelNames("event_type")
            .register(registry);

        this.cachedFarms = Gauge.build()
            .name("taskfarm_cached_farms")
            .help("Number of farms with a committed snapshot in memory")
            .register(registry);

        log.info("Prometheus coordination metrics initialized");
    }

    @Override
    public void recordOperation(String operation, String outcome, Duration latency) {
        operationCounter.labels(operation, outcome).inc();
        operationLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordRollback(String operation) {
        rollbackCounter.labels(operation).inc();
    }

    @Override
    public void recordPartialRollback(String operation) {
        partialRollbackCounter.labels(operation).inc();
    }

    @Override
    public void recordConflictRetry(String operation) {
        conflictRetryCounter.labels(operation).inc();
    }

    @Override
    public void recordStoreRetry(String operation) {
        storeRetryCounter.labels(operation).inc();
    }

    @Override
    public void recordMoves(String operation, int count) {
        if (count > 0) {
            moveCounter.labels(operation).inc(count);
        }
    }

    @Override
    public void recordEventFailure(String eventType) {
        eventFailureCounter.labels(eventType).inc();
    }

    @Override
    public void setCachedFarms(int count) {
        cachedFarms.set(count);
    }

    /**
     * Get the Prometheus registry for HTTP endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
