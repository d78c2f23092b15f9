package dev.traininglog.core.backend;

import dev.traininglog.core.entry.EagerEntry;
import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.BackendConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Nested maps in the heap. Touching a timestamp creates and keeps an empty entry for it.
 * <p>
 * Timestamps are guarded by a read/write lock, each entry's fields by its own synchronized map,
 * so request threads may read while the training loop writes.
 */
public class InMemoryBackend implements LogBackend {
    private final Map<Long, Map<String, Object>> log = new LinkedHashMap<>();

    private final ReadWriteLock logLock = new ReentrantReadWriteLock();

    private final Map<String, Object> info = newFields();

    public InMemoryBackend() {
    }

    public InMemoryBackend(final Map<Long, Map<String, Object>> restored) {
        if (restored != null) {
            restored.forEach((timestamp, fields) -> {
                final Map<String, Object> copy = newFields();
                copy.putAll(fields);
                log.put(timestamp, copy);
            });
        }
    }

    private static Map<String, Object> newFields() {
        return Collections.synchronizedMap(new LinkedHashMap<>());
    }

    @Override
    public Entry entry(final long timestamp) {
        logLock.readLock().lock();
        try {
            final Map<String, Object> fields = log.get(timestamp);
            if (fields != null) {
                return new EagerEntry(fields);
            }
        } finally {
            logLock.readLock().unlock();
        }
        logLock.writeLock().lock();
        try {
            return new EagerEntry(log.computeIfAbsent(timestamp, t -> newFields()));
        } finally {
            logLock.writeLock().unlock();
        }
    }

    @Override
    public Iterable<Long> timestamps() {
        return () -> {
            logLock.readLock().lock();
            try {
                return new ArrayList<>(log.keySet()).iterator();
            } finally {
                logLock.readLock().unlock();
            }
        };
    }

    @Override
    public long count() {
        logLock.readLock().lock();
        try {
            return log.size();
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public Entry info() {
        return new EagerEntry(info);
    }

    @Override
    public Map<String, Object> loadStatus() {
        return Collections.emptyMap();
    }

    @Override
    public void writeStatus(final String name, final Object value) {
        // status lives in the StatusRecord itself
    }

    @Override
    public BackendConfig config() {
        return BackendConfig.memory();
    }

    @Override
    public Map<Long, Map<String, Object>> exportEntries() {
        final Map<Long, Map<String, Object>> copy = new LinkedHashMap<>();
        logLock.readLock().lock();
        try {
            log.forEach((timestamp, fields) -> {
                synchronized (fields) {
                    copy.put(timestamp, new LinkedHashMap<>(fields));
                }
            });
        } finally {
            logLock.readLock().unlock();
        }
        return copy;
    }

    @Override
    public void close() {
    }
}
