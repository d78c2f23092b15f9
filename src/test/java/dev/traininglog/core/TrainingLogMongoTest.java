package dev.traininglog.core;

import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.LogSnapshot;
import dev.traininglog.core.model.StatusRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class TrainingLogMongoTest {
    private static final String EXPERIMENT = "5f1b2c3d4e5f60718293a4b5";

    private MongoServer server;

    private BackendConfig config;

    @BeforeEach
    void setUp() {
        server = new MongoServer(new MemoryBackend());
        final InetSocketAddress address = server.bind();
        config = BackendConfig.mongo(address.getHostString(), address.getPort(), "blocks_log");
    }

    @AfterEach
    void tearDown() {
        server.shutdownNow();
    }

    @Test
    void basicWritingThroughLazyEntries() {
        try (TrainingLog log = new TrainingLog(config)) {
            log.get(0).put("field", 45);
            assertEquals(45, log.get(0).get("field"));

            log.status().increment(StatusRecord.ITERATIONS_DONE);
            assertEquals(45, log.previousEntry().get("field"));
            log.currentEntry().put("field2", List.of("foo"));

            assertEquals(2, log.size());
            assertTrue(log.get(2).isEmpty());
            assertEquals(2, log.size());
            assertThrows(MissingFieldException.class, () -> log.get(2).get("foo"));
        }
    }

    @Test
    void secondLogWithSameIdentitySeesFirstLogsData() {
        try (TrainingLog first = new TrainingLog(config, EXPERIMENT, null)) {
            first.get(0).put("field", 45);
            first.status().increment(StatusRecord.ITERATIONS_DONE);
            first.status().increment(StatusRecord.ITERATIONS_DONE);

            try (TrainingLog second = new TrainingLog(config, EXPERIMENT, null)) {
                assertEquals(45, second.get(0).get("field"));
                assertEquals(2L, second.status().iterationsDone());
                assertEquals(first.info().get(TrainingLog.INFO_CREATED), second.info().get(TrainingLog.INFO_CREATED));
                assertEquals(1, second.size());
            }
        }
    }

    @Test
    void differentIdentitiesShareOneDatabaseWithoutMixing() {
        try (TrainingLog first = new TrainingLog(config);
             TrainingLog second = new TrainingLog(config)) {
            first.get(0).put("field", 1);
            second.get(0).put("field", 2);

            assertEquals(1, first.get(0).get("field"));
            assertEquals(2, second.get(0).get("field"));
            assertNotEquals(first.experimentId(), second.experimentId());
        }
    }

    @Test
    void snapshotReconnectsTransparently(@TempDir Path dir) throws IOException {
        final TrainingLog log = new TrainingLog(config, EXPERIMENT, List.of("_secret"));
        log.get(0).put("field", 45);
        log.status().increment(StatusRecord.ITERATIONS_DONE);
        log.currentEntry().put("field2", List.of("foo", "bar"));
        log.status().set("_secret", "hidden");

        final Path file = dir.resolve("log.json");
        LogSnapshots.write(log.snapshot(), file);
        log.close();

        final LogSnapshot snapshot = LogSnapshots.read(file);
        assertNull(snapshot.entries());

        try (TrainingLog restored = TrainingLog.restore(snapshot)) {
            assertEquals(EXPERIMENT, restored.experimentId().hex());
            assertEquals(config, restored.backendConfig());
            assertEquals(1L, restored.status().iterationsDone());
            assertEquals("hidden", restored.status().get("_secret"));
            assertEquals(2, restored.status().size());
            assertEquals(List.of("foo", "bar"), restored.currentEntry().get("field2"));
            assertEquals(45, restored.get(0).get("field"));
            assertEquals(2, restored.size());
        }
    }

    @Test
    void malformedIdentityLeavesNothingBehind() {
        assertThrows(InvalidExperimentIdException.class, () -> new TrainingLog(config, "1234", null));

        try (TrainingLog log = new TrainingLog(config)) {
            assertEquals(0, log.size());
        }
    }
}
