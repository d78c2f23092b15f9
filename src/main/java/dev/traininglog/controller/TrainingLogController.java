package dev.traininglog.controller;

import dev.traininglog.controller.request.FieldDeleteRequest;
import dev.traininglog.controller.request.StatusUpdateRequest;
import dev.traininglog.core.InvalidTimestampException;
import dev.traininglog.core.MissingFieldException;
import dev.traininglog.core.TrainingLog;
import dev.traininglog.core.ValidationException;
import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.LogSnapshot;
import dev.traininglog.core.model.StatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


@RestController
@RequestMapping("/log")
public class TrainingLogController {
    private static final Logger log = LoggerFactory.getLogger(TrainingLogController.class);

    @Autowired
    private TrainingLog trainingLog;

    @GetMapping
    public ResponseEntity<Map<String, Object>> summary() {
        try {
            final List<Long> timestamps = new ArrayList<>();
            trainingLog.timestamps().forEach(timestamps::add);
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("experiment", trainingLog.experimentId().hex());
            body.put("backend", trainingLog.backendConfig().type().label());
            body.put("size", trainingLog.size());
            body.put("timestamps", timestamps);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return failure(e);
        }
    }

    @GetMapping("/entries/{timestamp}")
    public ResponseEntity<Map<String, Object>> entry(@PathVariable("timestamp") String timestamp) {
        try {
            final Entry entry = trainingLog.get(parseTimestamp(timestamp));
            return ResponseEntity.ok(new LinkedHashMap<>(entry.asMap()));
        } catch (Exception e) {
            return failure(e);
        }
    }

    @GetMapping("/entries/{timestamp}/{field}")
    public ResponseEntity<Map<String, Object>> field(@PathVariable("timestamp") String timestamp,
                                                     @PathVariable("field") String field) {
        try {
            final Object value = trainingLog.get(parseTimestamp(timestamp)).get(field);
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("field", field);
            body.put("value", value);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return failure(e);
        }
    }

    @PostMapping("/entries/{timestamp}")
    public ResponseEntity<Map<String, Object>> write(@PathVariable("timestamp") String timestamp,
                                                     @RequestBody final Map<String, Object> fields) {
        try {
            if (fields == null || fields.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "fields are required"));
            }
            final Entry entry = trainingLog.get(parseTimestamp(timestamp));
            fields.forEach(entry::put);
            return ResponseEntity.ok(Map.of("success", true, "written", fields.size()));
        } catch (Exception e) {
            return failure(e);
        }
    }

    @PostMapping("/entries/{timestamp}/delete")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable("timestamp") String timestamp,
                                                      @RequestBody final FieldDeleteRequest request) {
        try {
            if (request == null || request.field() == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "field is required"));
            }
            trainingLog.get(parseTimestamp(timestamp)).remove(request.field());
            return ResponseEntity.ok(Map.of("success", true));
        } catch (Exception e) {
            return failure(e);
        }
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        try {
            final StatusRecord status = trainingLog.status();
            final Map<String, Object> body = new LinkedHashMap<>();
            for (String name : status.names()) {
                body.put(name, status.get(name));
            }
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return failure(e);
        }
    }

    @PostMapping("/status")
    public ResponseEntity<Map<String, Object>> updateStatus(@RequestBody final StatusUpdateRequest request) {
        try {
            if (request == null || request.name() == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
            }
            trainingLog.status().set(request.name(), request.value());
            return ResponseEntity.ok(Map.of("success", true));
        } catch (Exception e) {
            return failure(e);
        }
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        try {
            return ResponseEntity.ok(new LinkedHashMap<>(trainingLog.info().asMap()));
        } catch (Exception e) {
            return failure(e);
        }
    }

    @GetMapping("/snapshot")
    public ResponseEntity<?> snapshot() {
        try {
            final LogSnapshot snapshot = trainingLog.snapshot();
            return ResponseEntity.ok(snapshot);
        } catch (Exception e) {
            return failure(e);
        }
    }

    private static long parseTimestamp(final String timestamp) {
        try {
            return Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            throw new InvalidTimestampException(timestamp);
        }
    }

    private static ResponseEntity<Map<String, Object>> failure(final Exception e) {
        final String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e instanceof ValidationException) {
            return ResponseEntity.badRequest().body(Map.of("error", message));
        }
        if (e instanceof MissingFieldException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", message));
        }
        log.error("Training log request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", message));
    }
}
