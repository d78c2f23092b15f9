package dev.traininglog.core.backend;

import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.BackendConfig;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Physical storage of entries, experiment info and status for one experiment.
 * Owns exactly one connection, released by {@link #close()}.
 */
public interface LogBackend extends AutoCloseable {

    /**
     * Entry for {@code timestamp}. Database backends return it without doing any I/O.
     */
    Entry entry(long timestamp);

    /**
     * Stored timestamps in ascending (or insertion) order. Every iteration starts over.
     */
    Iterable<Long> timestamps();

    long count();

    /**
     * Experiment metadata such as creation time and identity.
     */
    Entry info();

    /**
     * Status values already persisted for this experiment, empty when the backend does not persist status.
     */
    Map<String, Object> loadStatus();

    void writeStatus(String name, Object value);

    default Iterable<Map.Entry<Long, Entry>> entries() {
        final List<Map.Entry<Long, Entry>> result = new ArrayList<>();
        for (Long timestamp : timestamps()) {
            result.add(new AbstractMap.SimpleImmutableEntry<>(timestamp, entry(timestamp)));
        }
        return result;
    }

    BackendConfig config();

    /**
     * Entries that exist only in this process and must travel inside a snapshot, {@code null} for durable backends.
     */
    default Map<Long, Map<String, Object>> exportEntries() {
        return null;
    }

    @Override
    void close();
}
