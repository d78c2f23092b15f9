package dev.traininglog.core.backend;

import com.mongodb.MongoClientSettings;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import dev.traininglog.core.ValidationException;
import dev.traininglog.core.entry.CallbackEntry;
import dev.traininglog.core.entry.Entry;
import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.ExperimentId;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB storage. One {@code experiments} document per experiment ({@code info} and {@code status} live there)
 * and one {@code entries} document per (experiment, iteration).
 */
public class MongoBackend implements LogBackend {
    private static final Logger log = LoggerFactory.getLogger(MongoBackend.class);

    public static final String EXPERIMENTS = "experiments";
    public static final String ENTRIES = "entries";
    public static final String EXPERIMENT_FIELD = "experiment";
    public static final String ITERATION_FIELD = "iteration";

    private static final Set<String> RESERVED = Set.of("_id", EXPERIMENT_FIELD, ITERATION_FIELD);

    private final BackendConfig config;

    private final ObjectId experiment;

    private final MongoClient client;

    private final MongoCollection<Document> experiments;

    private final MongoCollection<Document> entries;

    public MongoBackend(final BackendConfig config, final ExperimentId experimentId) {
        this.config = config;
        this.experiment = new ObjectId(experimentId.bytes());
        this.client = MongoClients.create(settings(config));
        final MongoDatabase db = client.getDatabase(config.database());
        this.experiments = db.getCollection(EXPERIMENTS);
        this.entries = db.getCollection(ENTRIES);
        log.info("Opening mongodb://{}:{}/{} for experiment {}",
                config.host(), config.port(), config.database(), experimentId);

        try {
            entries.createIndex(Indexes.ascending(EXPERIMENT_FIELD, ITERATION_FIELD));
            // never overwrites an existing experiment, so reopening the same id resumes it
            experiments.updateOne(
                    Filters.eq("_id", experiment),
                    Updates.combine(
                            Updates.setOnInsert("created", new Date()),
                            Updates.setOnInsert("info", new Document(EXPERIMENT_FIELD, experimentId.hex())),
                            Updates.setOnInsert("status", new Document())
                    ),
                    new UpdateOptions().upsert(true));
        } catch (RuntimeException e) {
            log.warn("Could not initialise experiment {} on {}:{}, closing client", experimentId, config.host(), config.port());
            client.close();
            throw e;
        }
    }

    private static MongoClientSettings settings(final BackendConfig config) {
        final long timeout = config.timeoutMillis();
        return MongoClientSettings.builder()
                .applyToClusterSettings(b -> b
                        .hosts(List.of(new ServerAddress(config.host(), config.port())))
                        .serverSelectionTimeout(timeout, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(b -> b.connectTimeout((int) timeout, TimeUnit.MILLISECONDS))
                .build();
    }

    private Bson entryFilter(final long timestamp) {
        return Filters.and(Filters.eq(EXPERIMENT_FIELD, experiment), Filters.eq(ITERATION_FIELD, timestamp));
    }

    private Bson experimentFilter() {
        return Filters.eq("_id", experiment);
    }

    private static String checkField(final String field) {
        if (field == null || field.isEmpty() || RESERVED.contains(field) || field.startsWith("$") || field.contains(".")) {
            throw new ValidationException("field name not storable in mongo: " + field);
        }
        return field;
    }

    @Override
    public Entry entry(final long timestamp) {
        return new CallbackEntry(
                () -> readEntry(timestamp),
                (field, value) -> entries.updateOne(
                        entryFilter(timestamp),
                        Updates.set(checkField(field), ValueNormalizer.normalize(value)),
                        new UpdateOptions().upsert(true)),
                field -> entries.updateOne(entryFilter(timestamp), Updates.unset(checkField(field)))
        );
    }

    private Map<String, Object> readEntry(final long timestamp) {
        log.debug("Reading entry {} of experiment {}", timestamp, experiment);
        final Document doc = entries.find(entryFilter(timestamp))
                .projection(Projections.exclude("_id", EXPERIMENT_FIELD, ITERATION_FIELD))
                .first();
        return doc == null ? new LinkedHashMap<>() : new LinkedHashMap<>(doc);
    }

    @Override
    public Iterable<Long> timestamps() {
        return () -> {
            final List<Long> result = new ArrayList<>();
            entries.distinct(ITERATION_FIELD, Filters.eq(EXPERIMENT_FIELD, experiment), Long.class).into(result);
            result.sort(null);
            return result.iterator();
        };
    }

    @Override
    public long count() {
        return entries.countDocuments(Filters.eq(EXPERIMENT_FIELD, experiment));
    }

    @Override
    public Entry info() {
        return new CallbackEntry(
                () -> readSubDocument("info"),
                (field, value) -> experiments.updateOne(
                        experimentFilter(), Updates.set("info." + checkField(field), ValueNormalizer.normalize(value))),
                field -> experiments.updateOne(experimentFilter(), Updates.unset("info." + checkField(field)))
        );
    }

    @Override
    public Map<String, Object> loadStatus() {
        return readSubDocument("status");
    }

    @Override
    public void writeStatus(final String name, final Object value) {
        experiments.updateOne(experimentFilter(), Updates.set("status." + checkField(name), ValueNormalizer.normalize(value)));
    }

    private Map<String, Object> readSubDocument(final String name) {
        final Document doc = experiments.find(experimentFilter()).projection(Projections.include(name)).first();
        if (doc == null) {
            return new LinkedHashMap<>();
        }
        final Document sub = doc.get(name, Document.class);
        return sub == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sub);
    }

    @Override
    public BackendConfig config() {
        return config;
    }

    @Override
    public void close() {
        log.info("Closing mongodb connection for experiment {}", experiment);
        client.close();
    }
}
