package dev.traininglog.controller.request;

public record StatusUpdateRequest(String name, Object value) {
}
