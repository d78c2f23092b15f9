package dev.traininglog.core.model;

import dev.traininglog.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackendConfigTest {

    @Test
    void parsesKnownSelectors() {
        assertEquals(BackendType.MEMORY, BackendType.parse("memory"));
        assertEquals(BackendType.MEMORY, BackendType.parse("default"));
        assertEquals(BackendType.MONGO, BackendType.parse("Mongo"));
        assertEquals(BackendType.SQLITE, BackendType.parse(" sqlite "));
    }

    @Test
    void unknownSelectorIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> BackendType.parse("redis"));
        assertThrows(ConfigurationException.class, () -> BackendType.parse(null));
    }

    @Test
    void mongoRequiresConnectionSettings() {
        assertThrows(ConfigurationException.class, () -> BackendConfig.mongo("", 27017, "db"));
        assertThrows(ConfigurationException.class, () -> BackendConfig.mongo("localhost", 0, "db"));
        assertThrows(ConfigurationException.class, () -> BackendConfig.mongo("localhost", 27017, " "));

        final BackendConfig config = BackendConfig.mongo("localhost", 27017, "blocks_log");
        assertEquals(BackendConfig.DEFAULT_TIMEOUT_MILLIS, config.timeoutMillis());
    }

    @Test
    void sqliteRequiresPath() {
        assertThrows(ConfigurationException.class, () -> BackendConfig.sqlite(null));
        assertEquals("log.sqlite", BackendConfig.sqlite("log.sqlite").path());
    }
}
