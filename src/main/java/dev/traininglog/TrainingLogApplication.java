package dev.traininglog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

// backends open their own connections from traininglog.* properties
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, DataSourceAutoConfiguration.class})
public class TrainingLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainingLogApplication.class, args);
    }
}
