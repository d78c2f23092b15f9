package dev.traininglog.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.traininglog.core.ConfigurationException;

import java.util.Locale;

public enum BackendType {
    MEMORY("memory", null),
    MONGO("mongo", "com.mongodb.client.MongoClients"),
    SQLITE("sqlite", "org.sqlite.JDBC");

    private final String label;

    private final String driverClass;

    BackendType(String label, String driverClass) {
        this.label = label;
        this.driverClass = driverClass;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Class that must be loadable for this backend to work, {@code null} when nothing external is needed.
     */
    public String driverClass() {
        return driverClass;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BackendType parse(final String value) {
        if (value == null) {
            throw new ConfigurationException("backend must not be null");
        }
        final String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("default")) {
            return MEMORY;
        }
        for (BackendType type : values()) {
            if (type.label.equals(v)) {
                return type;
            }
        }
        throw new ConfigurationException("unknown backend: " + value);
    }
}
