package dev.traininglog.core.model;

import java.util.List;
import java.util.Map;

/**
 * Serializable state of a training log. {@code entries} is only filled for the in-memory backend,
 * database backends re-read their entries after reconnecting.
 */
public record LogSnapshot(
        ExperimentId experiment,
        BackendConfig backend,
        Map<String, Object> status,
        List<String> statusExclude,
        Map<String, Object> info,
        Map<Long, Map<String, Object>> entries
) {
}
