package dev.traininglog.core;

public class InvalidExperimentIdException extends ValidationException {
    public InvalidExperimentIdException(String message) {
        super(message);
    }

    public InvalidExperimentIdException(String message, Throwable cause) {
        super(message, cause);
    }
}
