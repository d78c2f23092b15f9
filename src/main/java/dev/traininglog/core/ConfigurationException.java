package dev.traininglog.core;

public class ConfigurationException extends TrainingLogException {
    public ConfigurationException(String message) {
        super(message);
    }
}
