package dev.sensai.controller;

import dev.sensai.dto.CoverLetterRequest;
import dev.sensai.exception.GlobalExceptionHandler;
import dev.sensai.exception.NotConfiguredException;
import dev.sensai.exception.UpstreamException;
import dev.sensai.service.CoverLetterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CoverLetterControllerTest {

    private static final String VALID_BODY =
            "{\"company_name\":\"Acme\",\"job_title\":\"Data Engineer\",\"job_description\":\"Build pipelines\"}";

    private WebTestClient webTestClient;

    @Mock
    private CoverLetterService coverLetterService;

    @InjectMocks
    private CoverLetterController coverLetterController;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        webTestClient = WebTestClient.bindToController(coverLetterController)
                .controllerAdvice(new GlobalExceptionHandler(messageSource))
                .httpMessageCodecs(StrictJsonCodecs.configurer())
                .configureClient()
                .build();
    }

    @Test
    @DisplayName("POST /api/cover-letter should return the generated text")
    void generate_ShouldReturnText() {
        when(coverLetterService.generate(any(CoverLetterRequest.class))).thenReturn(Mono.just("Dear Acme team"));

        webTestClient.post().uri("/api/cover-letter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.text").isEqualTo("Dear Acme team");
    }

    @Test
    @DisplayName("POST /api/cover-letter should return 400 when no API key is configured")
    void generate_ShouldReportMissingKey() {
        when(coverLetterService.generate(any(CoverLetterRequest.class))).thenReturn(Mono.error(
                new NotConfiguredException(NotConfiguredException.Component.GENERATION_API, "OPENAI_API_KEY not set")));

        webTestClient.post().uri("/api/cover-letter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("OPENAI_API_KEY not set");
    }

    @Test
    @DisplayName("POST /api/cover-letter should return 500 on upstream failure")
    void generate_ShouldReportUpstreamError() {
        when(coverLetterService.generate(any(CoverLetterRequest.class)))
                .thenReturn(Mono.error(new UpstreamException("OpenAI error: quota exceeded")));

        webTestClient.post().uri("/api/cover-letter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(VALID_BODY)
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.code").isEqualTo("UPSTREAM_ERROR")
                .jsonPath("$.message").isEqualTo("OpenAI error: quota exceeded");
    }

    @Test
    @DisplayName("POST /api/cover-letter should require the job posting fields")
    void generate_ShouldRequireFields() {
        webTestClient.post().uri("/api/cover-letter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"company_name\":\"Acme\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.validation_errors.job_title").isEqualTo("job_title is required")
                .jsonPath("$.validation_errors.job_description").isEqualTo("job_description is required");

        verifyNoInteractions(coverLetterService);
    }
}
