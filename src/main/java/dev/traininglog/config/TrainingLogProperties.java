package dev.traininglog.config;

import dev.traininglog.core.model.BackendConfig;
import dev.traininglog.core.model.BackendType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "traininglog")
public record TrainingLogProperties(
        @DefaultValue("memory") String backend,
        String experimentId,
        @DefaultValue List<String> statusExclude,
        @DefaultValue Mongo mongo,
        @DefaultValue Sqlite sqlite
) {

    public record Mongo(
            @DefaultValue(BackendConfig.DEFAULT_HOST) String host,
            @DefaultValue("27017") int port,
            @DefaultValue(BackendConfig.DEFAULT_DATABASE) String database,
            @DefaultValue("5000") long timeoutMs
    ) {
    }

    public record Sqlite(@DefaultValue("training-log.sqlite") String path) {
    }

    public BackendConfig toBackendConfig() {
        return switch (BackendType.parse(backend)) {
            case MEMORY -> BackendConfig.memory();
            case MONGO -> BackendConfig.mongo(mongo.host(), mongo.port(), mongo.database(), mongo.timeoutMs());
            case SQLITE -> BackendConfig.sqlite(sqlite.path());
        };
    }
}
