package in.taskfarm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.taskfarm.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Service for managing coordination configuration.
 *
 * Stores configuration in a JSON file for persistence. Starting values come from
 * the file when present, otherwise from environment overrides on top of the
 * defaults. Thread-safe for concurrent access.
 */
public final class CoordinationConfigService implements Supplier<CoordinationConfig> {
    private static final Logger log = LoggerFactory.getLogger(CoordinationConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String CONFIG_FILE_NAME = "coordination-config.json";

    private final Path configFilePath;
    private volatile CoordinationConfig currentConfig;

    public CoordinationConfigService(String configDir) {
        this.configFilePath = Paths.get(configDir, CONFIG_FILE_NAME);
        this.currentConfig = loadConfig();
    }

    /**
     * Get current configuration.
     * Never returns null - returns defaults if no config file exists.
     */
    public CoordinationConfig getConfig() {
        return currentConfig;
    }

    @Override
    public CoordinationConfig get() {
        return currentConfig;
    }

    /**
     * Update configuration and persist to disk.
     *
     * @param newConfig New configuration to save
     * @throws IllegalArgumentException if config is invalid
     * @throws IOException if save fails
     */
    public void updateConfig(CoordinationConfig newConfig) throws IOException {
        if (newConfig == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }

        if (!newConfig.isValid()) {
            throw new IllegalArgumentException("Invalid configuration values");
        }

        saveConfig(newConfig);
        this.currentConfig = newConfig;

        log.info("✅ Coordination configuration updated: horizon={}min, overload={}, underload={}, deadline={}ms",
            newConfig.dueSoonHorizonMinutes(), newConfig.overloadFactor(),
            newConfig.underloadFactor(), newConfig.bulkDeadlineMs());
    }

    /**
     * Load configuration from file, or build it from the environment if the file
     * doesn't exist.
     */
    private CoordinationConfig loadConfig() {
        try {
            if (Files.exists(configFilePath)) {
                String json = Files.readString(configFilePath);
                CoordinationConfig config = MAPPER.readValue(json, CoordinationConfig.class);
                if (!config.isValid()) {
                    log.warn("Config file {} has invalid values, using defaults", configFilePath);
                    return fromEnvironment();
                }
                log.info("✅ Loaded coordination config from: {}", configFilePath);
                return config;
            } else {
                log.info("No config file found, using environment/defaults: {}", configFilePath);
                return fromEnvironment();
            }
        } catch (IOException e) {
            log.error("Failed to load config file, using defaults: {}", e.getMessage());
            return fromEnvironment();
        }
    }

    private static CoordinationConfig fromEnvironment() {
        CoordinationConfig d = CoordinationConfig.defaults();
        CoordinationConfig config = new CoordinationConfig(
            Env.getLong("DUE_SOON_HORIZON_MINUTES", d.dueSoonHorizonMinutes()),
            d.overloadFactor(),
            d.underloadFactor(),
            Env.getInt("MAX_CONFLICT_RETRIES", d.maxConflictRetries()),
            Env.getLong("BULK_DEADLINE_MS", d.bulkDeadlineMs()),
            Env.getInt("STORE_RETRY_ATTEMPTS", d.storeRetryAttempts()),
            d.storeRetryInitialDelayMs(),
            Env.getInt("MAX_BULK_SIZE", d.maxBulkSize()),
            d.optimizeMinPerformance(),
            d.optimizeWeakPerformance()
        );
        if (!config.isValid()) {
            log.warn("Environment overrides produce an invalid config, using defaults");
            return d;
        }
        return config;
    }

    /**
     * Save configuration to file.
     */
    private void saveConfig(CoordinationConfig config) throws IOException {
        File configDir = configFilePath.getParent().toFile();
        if (!configDir.exists()) {
            configDir.mkdirs();
        }

        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configFilePath, json);

        log.info("✅ Configuration saved to: {}", configFilePath);
    }
}
