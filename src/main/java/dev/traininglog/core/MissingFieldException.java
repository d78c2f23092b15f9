package dev.traininglog.core;

public class MissingFieldException extends TrainingLogException {
    private final String field;

    public MissingFieldException(String field) {
        super("no such field: " + field);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
