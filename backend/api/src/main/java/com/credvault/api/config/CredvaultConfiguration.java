package com.credvault.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for credvault application settings
 */
@Configuration
@ConfigurationProperties(prefix = "credvault")
@Data
public class CredvaultConfiguration {

    /**
     * Document store connection settings
     */
    private DatabaseConfig database = new DatabaseConfig();

    @Data
    public static class DatabaseConfig {
        /**
         * MongoDB connection string, bound from DATABASE_URL
         */
        private String url;

        /**
         * Logical database name, bound from DATABASE_NAME
         */
        private String name;

        /**
         * How long the driver waits for a reachable server before failing an operation
         */
        private int serverSelectionTimeoutSeconds = 5;

        /**
         * Check if both the connection string and the database name are set
         */
        public boolean isValid() {
            return url != null && !url.trim().isEmpty()
                    && name != null && !name.trim().isEmpty();
        }
    }
}
