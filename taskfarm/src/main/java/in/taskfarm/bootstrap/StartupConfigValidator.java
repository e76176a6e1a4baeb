package in.taskfarm.bootstrap;

import in.taskfarm.config.CoordinationConfig;
import in.taskfarm.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration at startup before the system initializes.
 * Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_POSTGRES = "postgres";

    private StartupConfigValidator() {
    }

    /**
     * Validate configuration at startup.
     *
     * @param storeMode STORE_MODE value
     * @param port HTTP port
     * @param config coordination tunables in effect
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(String storeMode, int port, CoordinationConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (!STORE_MEMORY.equalsIgnoreCase(storeMode) && !STORE_POSTGRES.equalsIgnoreCase(storeMode)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: STORE_MODE must be '" + STORE_MEMORY + "' or '" + STORE_POSTGRES
                    + "', got '" + storeMode + "'");
        }
        log.info("✓ Store mode: {}", storeMode);

        if (port < 1 || port > 65535) {
            throw new IllegalStateException("❌ INVALID CONFIG: PORT out of range: " + port);
        }

        if (config == null || !config.isValid()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: coordination settings are invalid: " + config);
        }
        log.info("✓ Coordination config: horizon={}min, retries={}, deadline={}ms, maxBulk={}",
            config.dueSoonHorizonMinutes(), config.maxConflictRetries(),
            config.bulkDeadlineMs(), config.maxBulkSize());

        boolean productionMode = Env.getBool("PRODUCTION_MODE", false);
        log.info("Production mode: {}", productionMode);
        if (productionMode && STORE_MEMORY.equalsIgnoreCase(storeMode)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires STORE_MODE=" + STORE_POSTGRES + "\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Use the database store: set STORE_MODE=" + STORE_POSTGRES + "\n" +
                "  2. Set PRODUCTION_MODE=false for local development");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}
