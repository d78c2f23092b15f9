package dev.traininglog.core;

public class InvalidTimestampException extends ValidationException {
    public InvalidTimestampException(Object timestamp) {
        super("invalid timestamp: " + timestamp);
    }
}
