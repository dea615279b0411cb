package dev.sensai.health;

import dev.sensai.config.ResilienceConfig;
import dev.sensai.config.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reactive health indicator for the MongoDB document store.
 * Sends a {@code ping} command; an unconfigured store is reported as UNKNOWN rather than DOWN.
 */
@Component("documentStore")
@RequiredArgsConstructor
@Slf4j
public class DocumentStoreHealthIndicator implements ReactiveHealthIndicator {

    private final ReactiveMongoTemplate mongoTemplate;
    private final StoreProperties storeProperties;
    private final ResilienceConfig resilience;

    @Override
    public Mono<Health> health() {
        if (!storeProperties.isConfigured()) {
            return Mono.just(Health.unknown()
                    .withDetail("database", "MongoDB")
                    .withDetail("status", "Not configured")
                    .build());
        }
        return mongoTemplate.executeCommand(new Document("ping", 1))
                .map(result -> Health.up()
                        .withDetail("database", "MongoDB")
                        .withDetail("name", storeProperties.getDatabase())
                        .build())
                .timeout(resilience.getDatabaseTimeout())
                .onErrorResume(this::buildDownHealth);
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Document store health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("database", "MongoDB")
                .withDetail("error", ex.getClass().getSimpleName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build());
    }
}
