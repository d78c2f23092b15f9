package dev.traininglog.core;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import dev.traininglog.core.model.LogSnapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON persistence of {@link LogSnapshot}s.
 * <p>
 * Status, info and entry values are written with their Java type, so a {@code Long} or a {@code Float}
 * comes back as the same type. Collections and maps are copied into {@code ArrayList}, {@code LinkedHashSet}
 * and {@code LinkedHashMap} first, the types the reader can rebuild.
 */
public final class LogSnapshots {
    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .activateDefaultTyping(
                    BasicPolymorphicTypeValidator.builder()
                            .allowIfSubType("java.lang.")
                            .allowIfSubType("java.util.")
                            .allowIfSubTypeIsArray()
                            .build(),
                    ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT)
            .build();

    private LogSnapshots() {
    }

    public static void write(final LogSnapshot snapshot, final OutputStream out) throws IOException {
        JSON.writeValue(out, portable(snapshot));
    }

    public static void write(final LogSnapshot snapshot, final Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(snapshot, out);
        }
    }

    public static LogSnapshot read(final InputStream in) throws IOException {
        return JSON.readValue(in, LogSnapshot.class);
    }

    public static LogSnapshot read(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static byte[] toBytes(final LogSnapshot snapshot) throws IOException {
        return JSON.writeValueAsBytes(portable(snapshot));
    }

    public static LogSnapshot fromBytes(final byte[] bytes) throws IOException {
        return JSON.readValue(bytes, LogSnapshot.class);
    }

    private static LogSnapshot portable(final LogSnapshot s) {
        Map<Long, Map<String, Object>> entries = null;
        if (s.entries() != null) {
            entries = new LinkedHashMap<>();
            for (Map.Entry<Long, Map<String, Object>> e : s.entries().entrySet()) {
                entries.put(e.getKey(), portableMap(e.getValue()));
            }
        }
        return new LogSnapshot(s.experiment(), s.backend(), portableMap(s.status()), s.statusExclude(),
                portableMap(s.info()), entries);
    }

    private static Map<String, Object> portableMap(final Map<?, ?> map) {
        if (map == null) {
            return null;
        }
        final Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), portableValue(v)));
        return copy;
    }

    private static Object portableValue(final Object value) {
        if (value instanceof Map<?, ?> m) {
            return portableMap(m);
        }
        if (value instanceof Set<?> set) {
            final Set<Object> copy = new LinkedHashSet<>();
            set.forEach(item -> copy.add(portableValue(item)));
            return copy;
        }
        if (value instanceof Collection<?> c) {
            final List<Object> copy = new ArrayList<>(c.size());
            c.forEach(item -> copy.add(portableValue(item)));
            return copy;
        }
        return value;
    }
}
