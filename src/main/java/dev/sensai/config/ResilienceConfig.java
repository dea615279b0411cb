package dev.sensai.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralised timeout settings for store and upstream calls.
 * Failures are surfaced to the caller immediately, so no retry strategy is configured here.
 *
 * <pre>
 * return quizResultRepository.findByUserId(userId)
 *         .timeout(resilience.getDatabaseTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration externalTimeout;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.external.timeout-seconds:30}") int externalTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        log.info("Resilience configuration initialized (database={}s, external={}s)",
                databaseTimeoutSeconds, externalTimeoutSeconds);
    }
}
