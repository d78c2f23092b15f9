package dev.traininglog.core;

public class TrainingLogException extends RuntimeException {
    public TrainingLogException(String message) {
        super(message);
    }

    public TrainingLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
