package dev.traininglog.core.entry;

import dev.traininglog.core.MissingFieldException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Entry backed directly by a live map. Reads always see the latest writes.
 * <p>
 * Bulk reads copy the map while holding its monitor, which makes them safe over a
 * {@link Collections#synchronizedMap} shared with other threads.
 */
public class EagerEntry implements Entry {
    private final Map<String, Object> fields;

    public EagerEntry(final Map<String, Object> fields) {
        this.fields = fields;
    }

    @Override
    public Object get(final String field) {
        synchronized (fields) {
            if (!fields.containsKey(field)) {
                throw new MissingFieldException(field);
            }
            return fields.get(field);
        }
    }

    @Override
    public boolean containsKey(final String field) {
        return fields.containsKey(field);
    }

    @Override
    public void put(final String field, final Object value) {
        fields.put(field, value);
    }

    @Override
    public void remove(final String field) {
        fields.remove(field);
    }

    @Override
    public Set<String> keySet() {
        synchronized (fields) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(fields.keySet()));
        }
    }

    @Override
    public int size() {
        return fields.size();
    }

    /**
     * Read-only copy of the fields at the time of the call.
     */
    @Override
    public Map<String, Object> asMap() {
        synchronized (fields) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry other)) return false;
        return asMap().equals(other.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
