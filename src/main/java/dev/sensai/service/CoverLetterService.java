package dev.sensai.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.sensai.config.OpenAiProperties;
import dev.sensai.config.ResilienceConfig;
import dev.sensai.dto.CoverLetterRequest;
import dev.sensai.exception.NotConfiguredException;
import dev.sensai.exception.UpstreamException;
import dev.sensai.metrics.SensaiMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Cover letter generation through the OpenAI chat completions API.
 * <p>
 * One request per call: a fixed system instruction plus a user instruction built from the
 * job posting. Only the generated text of the first choice is returned. Failures are not
 * retried; upstream error bodies and transport messages are cut to {@value #MAX_DIAGNOSTIC_LENGTH}
 * characters before they reach the caller.
 */
@Service
@Slf4j
public class CoverLetterService {

    static final int MAX_DIAGNOSTIC_LENGTH = 200;
    static final String DEFAULT_CANDIDATE = "The candidate";

    static final String SYSTEM_PROMPT =
            "You are SENSAI, a professional career assistant. Craft tailored, concise, compelling "
            + "cover letters with a confident, friendly tone. Keep to ~250-350 words.";

    private static final String USER_PROMPT_TEMPLATE = """
            Candidate: %s
            Target Role: %s at %s.
            Job Description:
            %s

            Write a cover letter that highlights relevant skills and impact. Use a clean structure: \
            intro, two short body paragraphs (skills + achievements), closing with a call to action.""";

    private final WebClient webClient;
    private final OpenAiProperties properties;
    private final Duration timeout;
    private final SensaiMetrics metrics;
    private final CircuitBreaker circuitBreaker;

    public CoverLetterService(
            WebClient.Builder webClientBuilder,
            OpenAiProperties properties,
            ResilienceConfig resilience,
            SensaiMetrics metrics) {
        this.properties = properties;
        this.timeout = resilience.getExternalTimeout();
        this.metrics = metrics;
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("openai-cover-letter", cbConfig);
        log.info("OpenAI circuit breaker initialised (model={}, failureRate=50%, window=10, waitOpen=30s)",
                properties.getModel());
    }

    public boolean isAvailable() {
        return properties.hasApiKey();
    }

    /**
     * Generates a cover letter for the given posting.
     *
     * @return the generated text, empty when the upstream response carried none
     */
    public Mono<String> generate(CoverLetterRequest request) {
        if (!isAvailable()) {
            return Mono.error(new NotConfiguredException(
                    NotConfiguredException.Component.GENERATION_API, "OPENAI_API_KEY not set"));
        }
        ChatCompletionRequest body = new ChatCompletionRequest(
                properties.getModel(),
                List.of(new ChatMessage("system", SYSTEM_PROMPT),
                        new ChatMessage("user", buildUserPrompt(request))),
                properties.getTemperature());

        log.debug("Requesting cover letter for '{}' at '{}'", request.getJobTitle(), request.getCompanyName());
        return webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(errorBody -> new UpstreamException("OpenAI error: " + truncate(errorBody))))
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .map(CoverLetterService::extractText)
                .defaultIfEmpty("")
                .onErrorMap(ex -> !(ex instanceof UpstreamException),
                        ex -> new UpstreamException(truncate(describe(ex)), ex))
                .doOnSuccess(text -> {
                    metrics.incrementCoverLetter(true);
                    log.info("Generated cover letter ({} chars) for '{}' at '{}'",
                            text.length(), request.getJobTitle(), request.getCompanyName());
                })
                .doOnError(ex -> {
                    metrics.incrementCoverLetter(false);
                    log.error("Cover letter generation failed: {}", ex.getMessage());
                });
    }

    static String buildUserPrompt(CoverLetterRequest request) {
        String candidate = request.getUserName() != null && !request.getUserName().isBlank()
                ? request.getUserName()
                : DEFAULT_CANDIDATE;
        return USER_PROMPT_TEMPLATE.formatted(
                candidate, request.getJobTitle(), request.getCompanyName(), request.getJobDescription());
    }

    static String extractText(ChatCompletionResponse response) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            return "";
        }
        ChatMessage message = response.getChoices().get(0).getMessage();
        return message != null && message.getContent() != null ? message.getContent() : "";
    }

    static String truncate(String value) {
        return value.length() > MAX_DIAGNOSTIC_LENGTH ? value.substring(0, MAX_DIAGNOSTIC_LENGTH) : value;
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    // OpenAI chat completions DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ChatCompletionRequest {
        private String model;
        private List<ChatMessage> messages;
        private double temperature;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatMessage {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatCompletionResponse {
        private List<Choice> choices;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Choice {
        private ChatMessage message;
    }
}
