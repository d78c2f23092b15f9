package dev.traininglog.core;

import dev.traininglog.core.model.BackendType;

/**
 * The driver a backend needs is not on the classpath.
 */
public class BackendUnavailableException extends TrainingLogException {
    private final BackendType backend;

    public BackendUnavailableException(BackendType backend, String driverClass, Throwable cause) {
        super("backend " + backend.label() + " unavailable: missing driver " + driverClass, cause);
        this.backend = backend;
    }

    public BackendType backend() {
        return backend;
    }
}
