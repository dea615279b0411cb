package dev.sensai.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every exchange with a request ID and a correlation ID.
 * <p>
 * IDs supplied by an upstream proxy are reused when they are well-formed, otherwise a fresh
 * 16-character ID is generated. Both are echoed on the response and written to the Reactor
 * context under {@link #REQUEST_ID_CONTEXT_KEY} and {@link #CORRELATION_ID_CONTEXT_KEY}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";
    public static final String CORRELATION_ID_CONTEXT_KEY = "correlationId";

    private static final int MAX_ID_LENGTH = 64;
    private static final int GENERATED_ID_LENGTH = 16;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        HttpHeaders requestHeaders = exchange.getRequest().getHeaders();
        String supplied = requestHeaders.getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(supplied);
        if (requestId == null) {
            if (supplied != null && !supplied.isBlank()) {
                log.warn("Rejected malformed {} header", REQUEST_ID_HEADER);
            }
            requestId = generateId();
        }
        String correlationId = sanitizeId(requestHeaders.getFirst(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = requestId;
        }

        ServerWebExchange tagged = exchange.mutate()
                .request(exchange.getRequest().mutate()
                        .header(REQUEST_ID_HEADER, requestId)
                        .header(CORRELATION_ID_HEADER, correlationId)
                        .build())
                .build();
        tagged.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        tagged.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        log.debug("{} {} [requestId={}]", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath().value(), requestId);

        return chain.filter(tagged)
                .contextWrite(Context.of(
                        REQUEST_ID_CONTEXT_KEY, requestId,
                        CORRELATION_ID_CONTEXT_KEY, correlationId));
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_ID_LENGTH);
    }

    /**
     * Returns the value if it is a usable ID, or null when blank, too long or containing
     * characters outside {@code [a-zA-Z0-9_-]}.
     */
    static String sanitizeId(String value) {
        if (value == null || value.isBlank() || value.length() > MAX_ID_LENGTH) {
            return null;
        }
        return VALID_ID_PATTERN.matcher(value).matches() ? value : null;
    }
}
