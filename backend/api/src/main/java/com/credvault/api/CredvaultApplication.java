package com.credvault.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Entry point. Mongo auto-configuration is off: the client is built by
 * {@link com.credvault.api.config.MongoConfig} only when a database is configured.
 */
@SpringBootApplication(
    exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class,
    }
)
public class CredvaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredvaultApplication.class, args);
    }
}
