package dev.traininglog.core;

import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.LogSnapshot;
import dev.traininglog.core.model.StatusRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingLogSqliteTest {

    @TempDir
    Path dir;

    @Test
    void basicWritingAndDefaults() {
        try (TrainingLog log = new TrainingLog(BackendConfig.sqlite(dir.resolve("log.sqlite").toString()))) {
            log.get(0).put("field", 45);
            assertEquals(45, log.get(0).get("field"));

            log.status().increment(StatusRecord.ITERATIONS_DONE);
            assertEquals(45, log.previousEntry().get("field"));
            log.currentEntry().put("field2", List.of("foo"));
            log.currentEntry().put("field2", List.of("foo", "bar"));

            assertEquals(List.of("foo", "bar"), log.get(1).get("field2"));
            assertTrue(log.get(2).isEmpty());
            assertEquals(2, log.size());

            final List<Long> timestamps = new ArrayList<>();
            log.timestamps().forEach(timestamps::add);
            assertEquals(List.of(0L, 1L), timestamps);
        }
    }

    @Test
    void snapshotCarriesStatusAndInfoAcrossReopen() throws IOException {
        final BackendConfig config = BackendConfig.sqlite(dir.resolve("log.sqlite").toString());
        final TrainingLog log = new TrainingLog(config);
        log.get(0).put("field", 45);
        log.status().increment(StatusRecord.ITERATIONS_DONE);
        log.status().append(StatusRecord.EPOCH_ENDS, 0L);
        final Object created = log.info().get(TrainingLog.INFO_CREATED);

        final byte[] bytes = LogSnapshots.toBytes(log.snapshot());
        log.close();

        final LogSnapshot snapshot = LogSnapshots.fromBytes(bytes);
        try (TrainingLog restored = TrainingLog.restore(snapshot)) {
            assertEquals(1L, restored.status().iterationsDone());
            assertEquals(List.of(0L), restored.status().get(StatusRecord.EPOCH_ENDS));
            assertEquals(created, restored.info().get(TrainingLog.INFO_CREATED));
            assertEquals(45, restored.previousEntry().get("field"));
            assertEquals(1, restored.size());
        }
    }
}
