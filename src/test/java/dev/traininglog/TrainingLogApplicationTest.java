package dev.traininglog;

import dev.traininglog.config.TrainingLogProperties;
import dev.traininglog.core.TrainingLog;
import dev.traininglog.core.model.BackendType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = {
        "traininglog.backend=memory",
        "traininglog.experiment-id=5f1b2c3d4e5f60718293a4b5",
        "traininglog.status-exclude=_private"
})
class TrainingLogApplicationTest {

    @Autowired
    TrainingLog trainingLog;

    @Autowired
    TrainingLogProperties properties;

    @Test
    void contextBuildsLogFromProperties() {
        assertEquals("5f1b2c3d4e5f60718293a4b5", trainingLog.experimentId().hex());
        assertEquals(BackendType.MEMORY, trainingLog.backendConfig().type());
        assertEquals(27017, properties.mongo().port());
        assertEquals("training-log.sqlite", properties.sqlite().path());

        trainingLog.status().set("_private", 1);
        final List<String> names = new ArrayList<>();
        trainingLog.status().names().forEach(names::add);
        assertEquals(List.of("iterations_done", "epochs_done"), names);
    }
}
