package dev.traininglog.core.entry;

import dev.traininglog.core.MissingFieldException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Entry that reads from durable storage only when its contents are first needed.
 * <p>
 * {@link #materialize()} runs at most once per object; the snapshot it returns is cached and every later read,
 * iteration or size call is answered from it. Writes and removals go straight to storage and do NOT touch the
 * cached snapshot, so an entry that was already read keeps showing the old values. Take a fresh entry from the
 * log to observe your own writes.
 */
public abstract class LazyEntry implements Entry {
    private Map<String, Object> cached;

    /**
     * Full current snapshot of this entry's fields. Empty map when nothing was stored, never {@code null}.
     */
    protected abstract Map<String, Object> materialize();

    /**
     * Upserts one field in storage.
     */
    protected abstract void write(String field, Object value);

    /**
     * Removes one field from storage.
     */
    protected abstract void unset(String field);

    private Map<String, Object> fields() {
        if (cached == null) {
            final Map<String, Object> loaded = materialize();
            cached = loaded == null ? new LinkedHashMap<>() : new LinkedHashMap<>(loaded);
        }
        return cached;
    }

    public boolean isMaterialized() {
        return cached != null;
    }

    @Override
    public Object get(final String field) {
        final Map<String, Object> f = fields();
        if (!f.containsKey(field)) {
            throw new MissingFieldException(field);
        }
        return f.get(field);
    }

    @Override
    public boolean containsKey(final String field) {
        return fields().containsKey(field);
    }

    @Override
    public void put(final String field, final Object value) {
        write(field, value);
    }

    @Override
    public void remove(final String field) {
        unset(field);
    }

    @Override
    public Set<String> keySet() {
        return Collections.unmodifiableSet(fields().keySet());
    }

    @Override
    public int size() {
        return fields().size();
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry other)) return false;
        return asMap().equals(other.asMap());
    }

    @Override
    public int hashCode() {
        return fields().hashCode();
    }

    @Override
    public String toString() {
        return cached == null ? getClass().getSimpleName() + "(unread)" : cached.toString();
    }
}
