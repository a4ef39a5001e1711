package com.credvault.api.config;

import com.credvault.api.store.MongoConnectionProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB configuration. Connection details come from application.properties:
 * - credvault.database.url (DATABASE_URL)
 * - credvault.database.name (DATABASE_NAME)
 */
@Configuration
public class MongoConfig {

    @Bean(destroyMethod = "close")
    public MongoConnectionProvider mongoConnectionProvider(CredvaultConfiguration configuration) {
        return MongoConnectionProvider.connect(configuration.getDatabase());
    }
}
