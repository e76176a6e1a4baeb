package in.taskfarm.bootstrap;

import in.taskfarm.config.CoordinationConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    @AfterEach
    void clearProductionMode() {
        System.clearProperty("PRODUCTION_MODE");
    }

    @Test
    void testValidConfigurationPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate("memory", 9090, CoordinationConfig.defaults()));
        assertDoesNotThrow(() -> StartupConfigValidator.validate("POSTGRES", 1, CoordinationConfig.defaults()));
    }

    @Test
    void testUnknownStoreModeFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("redis", 9090, CoordinationConfig.defaults()));
        assertTrue(e.getMessage().contains("STORE_MODE"));
    }

    @Test
    void testPortOutOfRangeFails() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("memory", 0, CoordinationConfig.defaults()));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("memory", 70000, CoordinationConfig.defaults()));
    }

    @Test
    void testInvalidCoordinationConfigFails() {
        CoordinationConfig noRetries = new CoordinationConfig(60, 1.2, 0.8, 0, 5000, 3, 100, 500, 80.0, 50.0);

        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("memory", 9090, noRetries));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("memory", 9090, null));
    }

    @Test
    void testProductionModeRequiresDatabaseStore() {
        System.setProperty("PRODUCTION_MODE", "true");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate("memory", 9090, CoordinationConfig.defaults()));
        assertTrue(e.getMessage().contains("PRODUCTION MODE"));
        assertDoesNotThrow(() -> StartupConfigValidator.validate("postgres", 9090, CoordinationConfig.defaults()));
    }
}
