package dev.traininglog.core.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.traininglog.core.TrainingLogException;
import dev.traininglog.core.ValidationException;
import dev.traininglog.core.entry.CallbackEntry;
import dev.traininglog.core.entry.EagerEntry;
import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.BackendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite file with one append-only table {@code log(iteration, key, value)}. Values are stored as JSON text.
 * <p>
 * Writing a key twice leaves two rows; reads fold rows in insertion order, so the last write wins.
 */
public class SqliteBackend implements LogBackend {
    private static final Logger log = LoggerFactory.getLogger(SqliteBackend.class);

    // NaN and infinities stay numbers, a diverged loss must not come back as a string
    private static final ObjectMapper JSON = JsonMapper.builder()
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS log (iteration INTEGER, key TEXT, value)";
    static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS log_iteration ON log (iteration)";

    private final BackendConfig config;

    private final SingleConnectionDataSource dataSource;

    private final JdbcTemplate jdbc;

    // the table has no room for metadata, so info stays in the process and travels with snapshots
    private final Map<String, Object> info = new LinkedHashMap<>();

    public SqliteBackend(final BackendConfig config) {
        this.config = config;
        this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + config.path(), true);
        this.jdbc = new JdbcTemplate(dataSource);
        try {
            jdbc.execute(CREATE_TABLE);
            jdbc.execute(CREATE_INDEX);
        } catch (RuntimeException e) {
            dataSource.destroy();
            throw e;
        }
        log.info("Opened sqlite log at {}", config.path());
    }

    @Override
    public Entry entry(final long timestamp) {
        return new CallbackEntry(() -> readEntry(timestamp), (k, v) -> append(timestamp, k, v), k -> delete(timestamp, k));
    }

    private Map<String, Object> readEntry(final long timestamp) {
        log.debug("Reading entry {} from {}", timestamp, config.path());
        final Map<String, Object> fields = new LinkedHashMap<>();
        jdbc.query("SELECT key, value FROM log WHERE iteration = ? ORDER BY rowid",
                rs -> {
                    fields.put(rs.getString(1), decode(rs.getString(2)));
                },
                timestamp);
        return fields;
    }

    private void append(final long timestamp, final String key, final Object value) {
        if (key == null) {
            throw new ValidationException("field name must not be null");
        }
        jdbc.update("INSERT INTO log (iteration, key, value) VALUES (?, ?, ?)", timestamp, key, encode(value));
    }

    private void delete(final long timestamp, final String key) {
        jdbc.update("DELETE FROM log WHERE iteration = ? AND key = ?", timestamp, key);
    }

    @Override
    public Iterable<Long> timestamps() {
        return () -> jdbc.queryForList("SELECT DISTINCT iteration FROM log ORDER BY iteration", Long.class).iterator();
    }

    @Override
    public long count() {
        final Long n = jdbc.queryForObject("SELECT COUNT(DISTINCT iteration) FROM log", Long.class);
        return n == null ? 0L : n;
    }

    /**
     * One pass over the table, grouped by iteration in ascending order.
     */
    @Override
    public Iterable<Map.Entry<Long, Entry>> entries() {
        final Map<Long, Map<String, Object>> grouped = new LinkedHashMap<>();
        jdbc.query("SELECT iteration, key, value FROM log ORDER BY iteration, rowid",
                rs -> {
                    grouped.computeIfAbsent(rs.getLong(1), t -> new LinkedHashMap<>())
                            .put(rs.getString(2), decode(rs.getString(3)));
                });
        final List<Map.Entry<Long, Entry>> result = new ArrayList<>(grouped.size());
        grouped.forEach((timestamp, fields) -> result.add(new AbstractMap.SimpleImmutableEntry<>(
                timestamp,
                new CallbackEntry(() -> fields, (k, v) -> append(timestamp, k, v), k -> delete(timestamp, k)))));
        return result;
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
        // not persisted, see info
    }

    @Override
    public BackendConfig config() {
        return config;
    }

    @Override
    public void close() {
        log.info("Closing sqlite log at {}", config.path());
        dataSource.destroy();
    }

    private static String encode(final Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("value cannot be stored as JSON: " + value, e);
        }
    }

    private static Object decode(final String json) {
        if (json == null) {
            return null;
        }
        try {
            return JSON.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new TrainingLogException("corrupt value in sqlite log: " + json, e);
        }
    }
}
