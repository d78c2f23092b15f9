package dev.traininglog.core.model;

import dev.traininglog.core.ConfigurationException;

/**
 * Everything needed to (re)open a backend. Holds no live handles, so it is what goes into a snapshot.
 */
public record BackendConfig(
        BackendType type,
        String host,
        int port,
        String database,
        long timeoutMillis,
        String path
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 27017;
    public static final String DEFAULT_DATABASE = "blocks_log";
    public static final long DEFAULT_TIMEOUT_MILLIS = 5000L;

    public BackendConfig {
        if (type == null) {
            throw new ConfigurationException("backend type is required");
        }
        if (type == BackendType.MONGO) {
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("mongo backend requires a host");
            }
            if (port <= 0 || port > 65535) {
                throw new ConfigurationException("mongo port out of range: " + port);
            }
            if (database == null || database.isBlank()) {
                throw new ConfigurationException("mongo backend requires a database name");
            }
            if (timeoutMillis <= 0) {
                throw new ConfigurationException("mongo timeout must be positive: " + timeoutMillis);
            }
        }
        if (type == BackendType.SQLITE && (path == null || path.isBlank())) {
            throw new ConfigurationException("sqlite backend requires a file path");
        }
    }

    public static BackendConfig memory() {
        return new BackendConfig(BackendType.MEMORY, null, 0, null, 0L, null);
    }

    public static BackendConfig mongo(String host, int port, String database) {
        return mongo(host, port, database, DEFAULT_TIMEOUT_MILLIS);
    }

    public static BackendConfig mongo(String host, int port, String database, long timeoutMillis) {
        return new BackendConfig(BackendType.MONGO, host, port, database, timeoutMillis, null);
    }

    public static BackendConfig sqlite(String path) {
        return new BackendConfig(BackendType.SQLITE, null, 0, null, 0L, path);
    }
}
