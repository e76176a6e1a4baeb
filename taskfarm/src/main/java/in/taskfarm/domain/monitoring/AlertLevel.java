package in.taskfarm.domain.monitoring;

public enum AlertLevel {
    CRITICAL,  // todos left inconsistent, manual repair needed
    WARNING    // operation gave up, state still consistent
}
