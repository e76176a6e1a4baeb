package in.taskfarm.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationConfigServiceTest {

    @TempDir
    Path configDir;

    @Test
    void testStartsFromDefaultsWithoutFile() {
        CoordinationConfigService service = new CoordinationConfigService(configDir.toString());

        CoordinationConfig config = service.getConfig();
        assertTrue(config.isValid());
        assertEquals(1.2, config.overloadFactor());
        assertEquals(0.8, config.underloadFactor());
        assertSame(config, service.get());
        assertFalse(Files.exists(configDir.resolve(CoordinationConfigService.CONFIG_FILE_NAME)));
    }

    @Test
    void testUpdatePersistsAndReloads() throws Exception {
        CoordinationConfigService service = new CoordinationConfigService(configDir.toString());
        CoordinationConfig updated = new CoordinationConfig(60, 1.5, 0.5, 5, 2000, 4, 50, 100, 90.0, 40.0);

        service.updateConfig(updated);

        assertEquals(updated, service.get());
        String json = Files.readString(configDir.resolve(CoordinationConfigService.CONFIG_FILE_NAME));
        assertTrue(json.contains("\"maxConflictRetries\" : 5"));
        assertFalse(json.contains("valid"));

        CoordinationConfigService reloaded = new CoordinationConfigService(configDir.toString());
        assertEquals(updated, reloaded.getConfig());
    }

    @Test
    void testInvalidUpdateIsRejectedAndNotSaved() {
        CoordinationConfigService service = new CoordinationConfigService(configDir.toString());
        CoordinationConfig before = service.getConfig();
        CoordinationConfig weakAboveMin = new CoordinationConfig(60, 1.5, 0.5, 5, 2000, 4, 50, 100, 40.0, 90.0);

        assertThrows(IllegalArgumentException.class, () -> service.updateConfig(weakAboveMin));
        assertThrows(IllegalArgumentException.class, () -> service.updateConfig(null));

        assertSame(before, service.getConfig());
        assertFalse(Files.exists(configDir.resolve(CoordinationConfigService.CONFIG_FILE_NAME)));
    }

    @Test
    void testInvalidFileFallsBackToDefaults() throws Exception {
        Files.writeString(configDir.resolve(CoordinationConfigService.CONFIG_FILE_NAME),
            "{\"dueSoonHorizonMinutes\":0,\"overloadFactor\":0.9,\"underloadFactor\":0.8,"
                + "\"maxConflictRetries\":0,\"bulkDeadlineMs\":0,\"storeRetryAttempts\":0,"
                + "\"storeRetryInitialDelayMs\":0,\"maxBulkSize\":0,"
                + "\"optimizeMinPerformance\":80,\"optimizeWeakPerformance\":50}");

        CoordinationConfigService service = new CoordinationConfigService(configDir.toString());

        assertTrue(service.getConfig().isValid());
        assertEquals(1.2, service.getConfig().overloadFactor());
    }

    @Test
    void testUnreadableFileFallsBackToDefaults() throws Exception {
        Files.writeString(configDir.resolve(CoordinationConfigService.CONFIG_FILE_NAME), "{broken");

        CoordinationConfigService service = new CoordinationConfigService(configDir.toString());

        assertTrue(service.getConfig().isValid());
    }
}
