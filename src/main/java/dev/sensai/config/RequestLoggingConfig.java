package dev.sensai.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * One access-log line per exchange: {@code [requestId] METHOD path from ip - status in Nms}.
 * <p>
 * The IDs come from the Reactor context written by {@link RequestIdFilter}, which runs first.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    static final String NO_ID = "-";

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> Mono.deferContextual(context -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();
            String clientIp = getClientIp(exchange.getRequest());
            String requestId = context.getOrDefault(RequestIdFilter.REQUEST_ID_CONTEXT_KEY, NO_ID);
            String correlationId = context.getOrDefault(RequestIdFilter.CORRELATION_ID_CONTEXT_KEY, NO_ID);

            return chain.filter(exchange)
                    .doOnSuccess(done -> {
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        logRequest(requestId, correlationId, method, path, clientIp,
                                status != null ? status.value() : 200, Duration.between(start, Instant.now()));
                    })
                    .doOnError(error -> log.error("[{}] {} {} from {} - ERROR {} in {}ms (correlationId={})",
                            requestId, method, path, clientIp, error.getMessage(),
                            Duration.between(start, Instant.now()).toMillis(), correlationId));
        });
    }

    private void logRequest(String requestId, String correlationId, String method, String path,
                            String clientIp, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.startsWith("/swagger") || path.startsWith("/v3/api-docs")) {
            log.trace("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} from {} - {} in {}ms (correlationId={})",
                    requestId, method, path, clientIp, status, duration.toMillis(), correlationId);
        } else {
            log.info("[{}] {} {} from {} - {} in {}ms (correlationId={})",
                    requestId, method, path, clientIp, status, duration.toMillis(), correlationId);
        }
    }

    static String getClientIp(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return sanitizeHeaderValue(forwardedFor.split(",")[0].trim());
        }
        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return sanitizeHeaderValue(realIp);
        }
        if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
            return request.getRemoteAddress().getAddress().getHostAddress();
        }
        return "unknown";
    }

    // Header values end up in log lines; drop line breaks and non-printables.
    private static String sanitizeHeaderValue(String value) {
        return value.replaceAll("[^\\x20-\\x7E]", "");
    }
}
