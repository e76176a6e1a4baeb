package in.taskfarm.application.monitoring;

import in.taskfarm.domain.common.CoordinationConflictException;
import in.taskfarm.domain.common.PartialRollbackException;
import in.taskfarm.domain.monitoring.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator alerts for coordination failures.
 *
 * Logs at a level matching the alert's severity and keeps the most recent
 * alerts in memory for inspection.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final String PARTIAL_ROLLBACK = "PARTIAL_ROLLBACK";
    public static final String CONFLICT_BUDGET_EXHAUSTED = "CONFLICT_BUDGET_EXHAUSTED";
    private static final int RECENT_CAPACITY = 100;

    private final Deque<Alert> recent = new ArrayDeque<>();

    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} [{}] - {} {}",
                alert.alertType(), alert.scope(), alert.message(), alert.details());
            case WARNING -> log.warn("[ALERT-WARNING] {} [{}] - {}",
                alert.alertType(), alert.scope(), alert.message());
        }

        synchronized (recent) {
            if (recent.size() == RECENT_CAPACITY) {
                recent.removeFirst();
            }
            recent.addLast(alert);
        }
    }

    /**
     * Escalate a failed rollback. The listed todos need manual repair.
     */
    public void sendPartialRollbackAlert(String operation, String scopeKey, PartialRollbackException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("inconsistentTodoIds", e.getInconsistentTodoIds());
        details.put("cause", e.getCause() == null ? "unknown" : e.getCause().getMessage());
        sendAlert(Alert.critical(PARTIAL_ROLLBACK, scopeKey,
            "Rollback of " + operation + " failed, todos left inconsistent", details));
    }

    /**
     * A reassignment kept losing to concurrent writes and gave up.
     */
    public void sendConflictAlert(String operation, String scopeKey, CoordinationConflictException e) {
        sendAlert(Alert.warning(CONFLICT_BUDGET_EXHAUSTED, scopeKey, operation + ": " + e.getMessage()));
    }

    /**
     * Most recent alerts, oldest first.
     */
    public List<Alert> recentAlerts() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
