package dev.sensai.service;

import dev.sensai.dto.QuizResultRequest;
import dev.sensai.dto.QuizResultResponse;
import dev.sensai.dto.QuizStatsResponse;
import dev.sensai.entity.QuizResult;
import dev.sensai.exception.InvalidRequestException;
import dev.sensai.metrics.SensaiMetrics;
import dev.sensai.repository.QuizResultRepository;
import dev.sensai.util.QuizStatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Stores quiz results and derives per-user statistics from them.
 * <p>
 * Statistics scan the user's whole history with no cap on the number of documents read.
 * The recent list reads at most {@code limit} documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuizService {

    public static final int DEFAULT_RECENT_LIMIT = 5;

    private final QuizResultRepository quizResultRepository;
    private final DocumentStoreGuard storeGuard;
    private final SensaiMetrics metrics;

    /**
     * Appends a new quiz result. Both timestamps are set to the same instant.
     *
     * @return the store-assigned id of the new document
     */
    public Mono<String> submitResult(QuizResultRequest request) {
        QuizResult result = toEntity(request, Instant.now());
        return storeGuard.guard("quiz insert", () -> quizResultRepository.insert(result))
                .map(QuizResult::getId)
                .doOnSuccess(id -> {
                    metrics.incrementQuizSubmitted();
                    log.info("Stored quiz result id={} for userId={} (score={})", id, request.getUserId(), request.getScore());
                });
    }

    public Mono<QuizStatsResponse> getStats(String userId) {
        log.debug("Computing quiz stats for userId={}", userId);
        return storeGuard.guardMany("quiz stats", () -> quizResultRepository.findByUserId(userId))
                .collectList()
                .map(QuizStatsAggregator::aggregate);
    }

    /**
     * The most recent results of a user, newest first, as one list snapshot.
     */
    public Mono<List<QuizResultResponse>> getRecentResults(String userId, int limit) {
        if (limit < 1) {
            return Mono.error(new InvalidRequestException("limit", "limit must be at least 1"));
        }
        log.debug("Loading {} recent quiz results for userId={}", limit, userId);
        return storeGuard.guardMany("recent quiz results",
                        () -> quizResultRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit)))
                .collectList()
                .map(results -> QuizStatsAggregator.newestFirst(results).stream()
                        .map(this::toResponse)
                        .toList());
    }

    private QuizResult toEntity(QuizResultRequest request, Instant now) {
        return QuizResult.builder()
                .userId(request.getUserId())
                .score(request.getScore())
                .totalQuestions(request.getTotalQuestions())
                .correctAnswers(request.getCorrectAnswers())
                .feedback(request.getFeedback())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private QuizResultResponse toResponse(QuizResult result) {
        return QuizResultResponse.builder()
                .id(result.getId())
                .userId(result.getUserId())
                .score(result.getScore())
                .totalQuestions(result.getTotalQuestions())
                .correctAnswers(result.getCorrectAnswers())
                .feedback(result.getFeedback())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }
}
