package dev.traininglog.core.backend;

import dev.traininglog.core.BackendUnavailableException;
import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.BackendType;
import dev.traininglog.core.model.ExperimentId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackendsTest {

    @Test
    void allDriversAreOnTheClasspath() {
        for (BackendType type : BackendType.values()) {
            assertTrue(Backends.isAvailable(type), type.label());
        }
    }

    @Test
    void memoryConfigOpensInMemoryBackend() {
        try (LogBackend backend = Backends.open(BackendConfig.memory(), ExperimentId.random())) {
            assertInstanceOf(InMemoryBackend.class, backend);
            assertEquals(BackendType.MEMORY, backend.config().type());
        }
    }

    @Test
    void missingDriverIsReportedWithItsBackend() {
        final BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                () -> Backends.requireDriver(BackendType.MONGO, "com.example.missing.Driver"));

        assertEquals(BackendType.MONGO, e.backend());
        assertTrue(e.getMessage().contains("com.example.missing.Driver"), e.getMessage());
        assertInstanceOf(ClassNotFoundException.class, e.getCause());
    }

    @Test
    void backendWithoutDriverNeedsNothing() {
        assertDoesNotThrow(() -> Backends.requireDriver(BackendType.MEMORY, null));
    }
}
