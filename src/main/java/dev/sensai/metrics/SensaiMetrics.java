package dev.sensai.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Application counters. Counters are registered once up front to avoid a registry lookup per call.
 */
@Component
public class SensaiMetrics {

    private final Counter quizSubmitted;
    private final Counter resumeCreated;
    private final Counter resumeReplaced;
    private final Counter coverLetterGenerated;
    private final Counter coverLetterFailed;

    public SensaiMetrics(MeterRegistry meterRegistry) {
        this.quizSubmitted = Counter.builder("sensai.quiz.submitted")
                .description("Quiz results stored")
                .register(meterRegistry);
        this.resumeCreated = Counter.builder("sensai.resume.upserts")
                .description("Resume upserts")
                .tag("outcome", "created")
                .register(meterRegistry);
        this.resumeReplaced = Counter.builder("sensai.resume.upserts")
                .description("Resume upserts")
                .tag("outcome", "replaced")
                .register(meterRegistry);
        this.coverLetterGenerated = Counter.builder("sensai.cover_letter.requests")
                .description("Cover letter generation requests")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.coverLetterFailed = Counter.builder("sensai.cover_letter.requests")
                .description("Cover letter generation requests")
                .tag("outcome", "failure")
                .register(meterRegistry);
    }

    public void incrementQuizSubmitted() {
        quizSubmitted.increment();
    }

    public void incrementResumeUpsert(boolean created) {
        (created ? resumeCreated : resumeReplaced).increment();
    }

    public void incrementCoverLetter(boolean success) {
        (success ? coverLetterGenerated : coverLetterFailed).increment();
    }
}
