package dev.sensai.service;

import dev.sensai.config.ResilienceConfig;
import dev.sensai.config.StoreProperties;
import dev.sensai.dto.StoreDiagnosticsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Builds the {@code /test} report. Never fails: any store error ends up in the
 * {@code database} field, cut to {@value #MAX_ERROR_LENGTH} characters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreDiagnosticsService {

    static final int MAX_ERROR_LENGTH = 50;
    static final int MAX_COLLECTIONS = 10;

    static final String BACKEND_RUNNING = "✅ Running";
    static final String DB_NOT_AVAILABLE = "❌ Not Available";
    static final String DB_WORKING = "✅ Connected & Working";
    static final String NOT_CONNECTED = "Not Connected";
    static final String CONNECTED = "Connected";
    static final String SET = "✅ Set";
    static final String NOT_SET = "❌ Not Set";

    private final ReactiveMongoTemplate mongoTemplate;
    private final StoreProperties storeProperties;
    private final ResilienceConfig resilience;

    public Mono<StoreDiagnosticsResponse> diagnose() {
        StoreDiagnosticsResponse.StoreDiagnosticsResponseBuilder report = StoreDiagnosticsResponse.builder()
                .backend(BACKEND_RUNNING)
                .databaseUrl(isSet(storeProperties.getUrl()) ? SET : NOT_SET)
                .databaseName(isSet(storeProperties.getDatabase()) ? SET : NOT_SET);

        if (!storeProperties.isConfigured()) {
            return Mono.just(report
                    .database(DB_NOT_AVAILABLE)
                    .connectionStatus(NOT_CONNECTED)
                    .build());
        }

        return Mono.defer(() -> mongoTemplate.getCollectionNames()
                        .take(MAX_COLLECTIONS)
                        .collectList())
                .timeout(resilience.getDatabaseTimeout())
                .map(collections -> report
                        .database(DB_WORKING)
                        .connectionStatus(CONNECTED)
                        .collections(collections)
                        .build())
                .onErrorResume(ex -> {
                    log.warn("Store diagnostics failed: {}", ex.getMessage());
                    return Mono.just(report
                            .database("⚠️ Connected but Error: " + truncate(describe(ex)))
                            .connectionStatus(NOT_CONNECTED)
                            .build());
                });
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    static String truncate(String value) {
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
