package dev.traininglog.config;

import dev.traininglog.core.TrainingLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrainingLogProperties.class)
public class TrainingLogConfig {
    private static final Logger log = LoggerFactory.getLogger(TrainingLogConfig.class);

    @Bean(destroyMethod = "close")
    public TrainingLog trainingLog(TrainingLogProperties props) {
        final TrainingLog trainingLog = new TrainingLog(
                props.toBackendConfig(),
                props.experimentId() == null || props.experimentId().isBlank() ? null : props.experimentId(),
                props.statusExclude());
        log.info("Training log {} started with {} backend",
                trainingLog.experimentId(), trainingLog.backendConfig().type().label());
        return trainingLog;
    }
}
