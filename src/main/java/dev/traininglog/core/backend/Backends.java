package dev.traininglog.core.backend;

import dev.traininglog.core.BackendUnavailableException;
import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.BackendType;
import dev.traininglog.core.model.ExperimentId;

/**
 * Opens the backend a {@link BackendConfig} names, after checking its driver is on the classpath.
 */
public final class Backends {

    private Backends() {
    }

    public static LogBackend open(final BackendConfig config, final ExperimentId experiment) {
        requireDriver(config.type(), config.type().driverClass());
        return switch (config.type()) {
            case MEMORY -> new InMemoryBackend();
            case MONGO -> new MongoBackend(config, experiment);
            case SQLITE -> new SqliteBackend(config);
        };
    }

    public static boolean isAvailable(final BackendType type) {
        try {
            requireDriver(type, type.driverClass());
            return true;
        } catch (BackendUnavailableException e) {
            return false;
        }
    }

    /**
     * @param driverClass class the backend needs, {@code null} when it needs none
     * @throws BackendUnavailableException if the class cannot be loaded
     */
    static void requireDriver(final BackendType type, final String driverClass) {
        if (driverClass == null) {
            return;
        }
        try {
            Class.forName(driverClass, false, Backends.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new BackendUnavailableException(type, driverClass, e);
        }
    }
}
