package dev.traininglog.controller.request;

public record FieldDeleteRequest(String field) {
}
