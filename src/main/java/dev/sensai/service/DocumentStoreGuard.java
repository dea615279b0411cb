package dev.sensai.service;

import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import dev.sensai.config.ResilienceConfig;
import dev.sensai.config.StoreProperties;
import dev.sensai.exception.NotConfiguredException;
import dev.sensai.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Wraps document store calls so that callers see exactly two store failure kinds:
 * {@link NotConfiguredException} when the process has no store configured, and
 * {@link StorageUnavailableException} when the configured store cannot be reached in time.
 * Nothing is retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentStoreGuard {

    static final String NOT_CONFIGURED_MESSAGE = "Database not configured";

    private final StoreProperties storeProperties;
    private final ResilienceConfig resilience;

    public boolean isConfigured() {
        return storeProperties.isConfigured();
    }

    public <T> Mono<T> guard(String operation, Supplier<Mono<T>> call) {
        if (!isConfigured()) {
            return Mono.error(notConfigured());
        }
        return Mono.defer(call)
                .timeout(resilience.getDatabaseTimeout())
                .onErrorMap(DocumentStoreGuard::isConnectivityFailure, ex -> unavailable(operation, ex));
    }

    public <T> Flux<T> guardMany(String operation, Supplier<Flux<T>> call) {
        if (!isConfigured()) {
            return Flux.error(notConfigured());
        }
        return Flux.defer(call)
                .timeout(resilience.getDatabaseTimeout())
                .onErrorMap(DocumentStoreGuard::isConnectivityFailure, ex -> unavailable(operation, ex));
    }

    static boolean isConnectivityFailure(Throwable ex) {
        return ex instanceof TimeoutException
                || ex instanceof DataAccessResourceFailureException
                || ex instanceof MongoSocketException
                || ex instanceof MongoTimeoutException;
    }

    private static NotConfiguredException notConfigured() {
        return new NotConfiguredException(NotConfiguredException.Component.DOCUMENT_STORE, NOT_CONFIGURED_MESSAGE);
    }

    private static StorageUnavailableException unavailable(String operation, Throwable ex) {
        log.warn("Document store unreachable during {}: {}", operation, ex.getMessage());
        return new StorageUnavailableException("Document store unreachable during " + operation, ex);
    }
}
