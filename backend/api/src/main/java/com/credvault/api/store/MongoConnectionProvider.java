package com.credvault.api.store;

import com.credvault.api.config.CredvaultConfiguration.DatabaseConfig;
import com.credvault.api.exception.StoreException;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Process-wide holder of the store handle. Built once at startup; empty when the
 * connection string or database name is missing.
 */
@Slf4j
public class MongoConnectionProvider implements AutoCloseable {

    static final String NOT_CONFIGURED_MESSAGE =
            "Database not available. Check DATABASE_URL and DATABASE_NAME environment variables.";

    private final MongoClient client;
    private final MongoTemplate template;

    MongoConnectionProvider(MongoClient client, MongoTemplate template) {
        this.client = client;
        this.template = template;
    }

    public static MongoConnectionProvider unconfigured() {
        return new MongoConnectionProvider(null, null);
    }

    public static MongoConnectionProvider connect(DatabaseConfig config) {
        if (config == null || !config.isValid()) {
            log.warn("Database not configured (DATABASE_URL / DATABASE_NAME missing); store calls will fail");
            return unconfigured();
        }

        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.getUrl()))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                        config.getServerSelectionTimeoutSeconds(), TimeUnit.SECONDS))
                .build();
        MongoClient client = MongoClients.create(settings);
        log.info("Document store initialised for database '{}'", config.getName());
        return new MongoConnectionProvider(client, new MongoTemplate(client, config.getName()));
    }

    public Optional<MongoTemplate> template() {
        return Optional.ofNullable(template);
    }

    public MongoTemplate requireTemplate() {
        if (template == null) {
            throw new StoreException(NOT_CONFIGURED_MESSAGE, null, StoreException.ErrorType.DATABASE_NOT_CONFIGURED);
        }
        return template;
    }

    @Override
    public void close() {
        if (client != null) {
            log.info("Closing document store client");
            client.close();
        }
    }
}
