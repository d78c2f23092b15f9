package dev.traininglog.core.entry;

import dev.traininglog.core.MissingFieldException;

import java.util.Map;
import java.util.Set;

/**
 * Everything recorded at one timestamp: field name to value.
 */
public interface Entry {

    /**
     * @throws MissingFieldException if the field was never written
     */
    Object get(String field);

    default Object getOrDefault(String field, Object defaultValue) {
        return containsKey(field) ? get(field) : defaultValue;
    }

    boolean containsKey(String field);

    void put(String field, Object value);

    void remove(String field);

    Set<String> keySet();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Read-only view of the fields as a plain map.
     */
    Map<String, Object> asMap();
}
