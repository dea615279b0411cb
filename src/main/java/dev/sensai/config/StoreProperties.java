package dev.sensai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Document store settings as supplied by the environment ({@code DATABASE_URL}, {@code DATABASE_NAME}).
 * <p>
 * The Mongo client itself is built by Spring Boot from {@code spring.data.mongodb.*}, which falls
 * back to a local default. These raw values decide whether the store was actually configured for
 * this process, so that an unconfigured deployment is reported instead of silently talking to localhost.
 */
@Data
@ConfigurationProperties(prefix = "sensai.store")
public class StoreProperties {

    private String url;

    private String database;

    public boolean isConfigured() {
        return url != null && !url.isBlank() && database != null && !database.isBlank();
    }
}
