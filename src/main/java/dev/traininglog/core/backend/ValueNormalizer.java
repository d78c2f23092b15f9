package dev.traininglog.core.backend;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns arrays (including primitive and multidimensional ones) into nested lists, which document stores can encode.
 */
public final class ValueNormalizer {

    private ValueNormalizer() {
    }

    public static Object normalize(final Object value) {
        if (value == null) {
            return null;
        }
        if (value.getClass().isArray()) {
            final int length = Array.getLength(value);
            final List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(normalize(Array.get(value, i)));
            }
            return list;
        }
        if (value instanceof Collection<?> c) {
            final List<Object> list = new ArrayList<>(c.size());
            for (Object item : c) {
                list.add(normalize(item));
            }
            return list;
        }
        if (value instanceof Map<?, ?> m) {
            final Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                map.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return map;
        }
        return value;
    }
}
