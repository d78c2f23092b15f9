package dev.traininglog.core;

import dev.traininglog.core.backend.Backends;
import dev.traininglog.core.backend.InMemoryBackend;
import dev.traininglog.core.backend.LogBackend;
import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.BackendType;
import dev.traininglog.core.model.ExperimentId;
import dev.traininglog.core.model.LogSnapshot;
import dev.traininglog.core.model.StatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Log of training progress: one {@link Entry} per timestamp plus a mutable {@link StatusRecord}.
 * <p>
 * The storage is chosen by {@link BackendConfig} and can be switched without touching call sites.
 * Entries are expected to be appended in non-decreasing timestamp order by a single writer.
 */
public class TrainingLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrainingLog.class);

    public static final String INFO_CREATED = "created";
    public static final String INFO_EXPERIMENT = "experiment";

    private final ExperimentId experiment;

    private final StatusRecord status;

    private final LogBackend backend;

    public TrainingLog() {
        this(BackendConfig.memory());
    }

    public TrainingLog(final BackendConfig config) {
        this(config, null, null);
    }

    /**
     * @param experimentId 24 hex characters, or {@code null} to generate a random one
     * @param statusExclude status names hidden from iteration
     */
    public TrainingLog(final BackendConfig config, final String experimentId, final Collection<String> statusExclude) {
        this(resolve(experimentId), config, statusExclude);
    }

    private TrainingLog(final ExperimentId experiment, final BackendConfig config, final Collection<String> statusExclude) {
        this(experiment, Backends.open(config, experiment), statusExclude, null, null);
    }

    TrainingLog(final ExperimentId experiment,
                final LogBackend backend,
                final Collection<String> statusExclude,
                final Map<String, Object> restoredStatus,
                final Map<String, Object> restoredInfo) {
        this.experiment = experiment;
        this.backend = backend;
        this.status = new StatusRecord(statusExclude);
        try {
            initialize(restoredStatus, restoredInfo);
        } catch (RuntimeException e) {
            backend.close();
            throw e;
        }
        log.debug("Training log {} ready on {} backend", experiment, backend.config().type().label());
    }

    private void initialize(final Map<String, Object> restoredStatus, final Map<String, Object> restoredInfo) {
        final Map<String, Object> stored = backend.loadStatus();
        status.load(stored);
        status.bind(backend::writeStatus);
        if (restoredStatus != null) {
            restoredStatus.forEach(status::set);
        }
        for (Map.Entry<String, Object> e : status.toMap().entrySet()) {
            if (!stored.containsKey(e.getKey())) {
                backend.writeStatus(e.getKey(), e.getValue());
            }
        }

        // info is read once, so decide everything that is missing up front
        final Entry info = backend.info();
        final Map<String, Object> defaults = new LinkedHashMap<>();
        if (restoredInfo != null) {
            defaults.putAll(restoredInfo);
        }
        defaults.putIfAbsent(INFO_CREATED, Instant.now().toString());
        defaults.putIfAbsent(INFO_EXPERIMENT, experiment.hex());
        defaults.forEach((k, v) -> {
            if (!info.containsKey(k)) {
                info.put(k, v);
            }
        });
    }

    private static ExperimentId resolve(final String experimentId) {
        return experimentId == null ? ExperimentId.random() : ExperimentId.parse(experimentId);
    }

    /**
     * Rebuilds a log from a snapshot, opening a fresh connection from the stored configuration.
     */
    public static TrainingLog restore(final LogSnapshot snapshot) {
        if (snapshot == null || snapshot.experiment() == null || snapshot.backend() == null) {
            throw new ValidationException("snapshot must carry an experiment id and backend configuration");
        }
        final LogBackend backend = snapshot.backend().type() == BackendType.MEMORY
                ? new InMemoryBackend(snapshot.entries())
                : Backends.open(snapshot.backend(), snapshot.experiment());
        log.info("Restoring training log {} on {} backend", snapshot.experiment(), snapshot.backend().type().label());
        return new TrainingLog(snapshot.experiment(), backend, snapshot.statusExclude(), snapshot.status(), snapshot.info());
    }

    public LogSnapshot snapshot() {
        return new LogSnapshot(
                experiment,
                backend.config(),
                status.toMap(),
                new ArrayList<>(status.exclude()),
                new LinkedHashMap<>(info().asMap()),
                backend.exportEntries());
    }

    public Entry get(final long timestamp) {
        if (timestamp < 0) {
            throw new InvalidTimestampException(timestamp);
        }
        return backend.entry(timestamp);
    }

    public Entry currentEntry() {
        return get(status.iterationsDone());
    }

    /**
     * @throws InvalidTimestampException when no iteration has been done yet
     */
    public Entry previousEntry() {
        return get(status.iterationsDone() - 1);
    }

    public Iterable<Long> timestamps() {
        return backend.timestamps();
    }

    public Iterable<Map.Entry<Long, Entry>> entries() {
        return backend.entries();
    }

    public long size() {
        return backend.count();
    }

    public StatusRecord status() {
        return status;
    }

    public Entry info() {
        return backend.info();
    }

    public ExperimentId experimentId() {
        return experiment;
    }

    public BackendConfig backendConfig() {
        return backend.config();
    }

    @Override
    public void close() {
        backend.close();
    }
}
