package dev.sensai.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RequestIdFilter Tests")
class RequestIdFilterTest {

    private RequestIdFilter filter;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new RequestIdFilter();
        chain = mock(WebFilterChain.class);
        when(chain.filter(any(ServerWebExchange.class))).thenReturn(Mono.empty());
    }

    private static MockServerWebExchange exchange(MockServerHttpRequest request) {
        return MockServerWebExchange.from(request);
    }

    @Test
    @DisplayName("Should generate a 16 character request ID when none provided")
    void shouldGenerateRequestId() {
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/quiz/stats").build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        String requestId = exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(requestId).isNotNull().hasSize(16);
        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo(requestId);
    }

    @Test
    @DisplayName("Should pass through a well-formed X-Request-ID")
    void shouldPassExistingRequestId() {
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/resume")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "client-req_42")
                .header(RequestIdFilter.CORRELATION_ID_HEADER, "trace-7")
                .build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER))
                .isEqualTo("client-req_42");
        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo("trace-7");
    }

    @Test
    @DisplayName("Should replace a malformed X-Request-ID")
    void shouldReplaceMalformedId() {
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "<script>alert(1)</script>")
                .build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER))
                .isNotEqualTo("<script>alert(1)</script>")
                .hasSize(16);
    }

    @Test
    @DisplayName("Should forward the IDs on the mutated request")
    void shouldForwardIdsDownstream() {
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/").build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        ArgumentCaptor<ServerWebExchange> forwarded = ArgumentCaptor.forClass(ServerWebExchange.class);
        verify(chain).filter(forwarded.capture());
        String responseId = exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(forwarded.getValue().getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER))
                .isEqualTo(responseId);
    }

    @Test
    @DisplayName("Should expose the request ID in the Reactor context")
    void shouldWriteReactorContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        WebFilterChain contextChain = ex -> Mono.deferContextual(ctx -> {
            seen.set(ctx.get(RequestIdFilter.REQUEST_ID_CONTEXT_KEY));
            return Mono.empty();
        });
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "abc123")
                .build());

        StepVerifier.create(filter.filter(exchange, contextChain)).verifyComplete();

        assertThat(seen.get()).isEqualTo("abc123");
    }

    @Test
    @DisplayName("sanitizeId rejects blank, oversized and unsafe values")
    void sanitizeId() {
        assertThat(RequestIdFilter.sanitizeId(null)).isNull();
        assertThat(RequestIdFilter.sanitizeId("  ")).isNull();
        assertThat(RequestIdFilter.sanitizeId("a".repeat(65))).isNull();
        assertThat(RequestIdFilter.sanitizeId("a b")).isNull();
        assertThat(RequestIdFilter.sanitizeId("a".repeat(64))).hasSize(64);
    }
}
