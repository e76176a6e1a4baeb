package in.taskfarm.domain.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator alert raised by a coordination failure. {@code details} keeps insertion order.
 */
public record Alert(
    String alertType,
    AlertLevel level,
    String message,
    String scope,
    Instant raisedAt,
    Map<String, Object> details
) {
    public Alert {
        if (alertType == null || message == null) {
            throw new IllegalArgumentException("Alert requires alertType and message");
        }
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Alert critical(String alertType, String scope, String message, Map<String, Object> details) {
        return new Alert(alertType, AlertLevel.CRITICAL, message, scope, Instant.now(), details);
    }

    public static Alert warning(String alertType, String scope, String message) {
        return new Alert(alertType, AlertLevel.WARNING, message, scope, Instant.now(), Map.of());
    }
}
