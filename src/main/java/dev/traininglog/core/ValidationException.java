package dev.traininglog.core;

/**
 * Caller passed something the log refuses to work with. Never retried.
 */
public class ValidationException extends TrainingLogException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
