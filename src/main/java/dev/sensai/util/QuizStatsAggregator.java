package dev.sensai.util;

import dev.sensai.dto.QuizStatsResponse;
import dev.sensai.entity.QuizResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregation rules over a user's quiz history.
 * <p>
 * Ordering rules:
 * <ul>
 *   <li>Results are ordered by {@code createdAt}; a result without one counts as the earliest possible instant</li>
 *   <li>Equal timestamps keep their store order</li>
 *   <li>The "latest" result is the last one in ascending order, so among equal timestamps the later stored one wins</li>
 * </ul>
 */
public final class QuizStatsAggregator {

    private QuizStatsAggregator() {}

    /** Sentinel: results without a timestamp sort before every real one. */
    private static final Instant EARLIEST = Instant.MIN;

    private static final int AVERAGE_SCALE = 2;

    /** Oldest first. */
    public static final Comparator<QuizResult> BY_CREATED_AT = Comparator.comparing(QuizStatsAggregator::createdAtOrEarliest);

    /** Newest first; stable, so ties keep store order. */
    public static final Comparator<QuizResult> NEWEST_FIRST = BY_CREATED_AT.reversed();

    /**
     * Statistics over all given results. An empty history yields the all-zero summary.
     * The average is rounded half-up to two decimal places.
     */
    public static QuizStatsResponse aggregate(List<QuizResult> results) {
        if (results == null || results.isEmpty()) {
            return QuizStatsResponse.empty();
        }
        long scoreSum = 0;
        long questionSum = 0;
        QuizResult latest = null;
        for (QuizResult result : results) {
            scoreSum += valueOrZero(result.getScore());
            questionSum += valueOrZero(result.getTotalQuestions());
            if (latest == null || BY_CREATED_AT.compare(result, latest) >= 0) {
                latest = result;
            }
        }
        return QuizStatsResponse.builder()
                .averageScore(average(scoreSum, results.size()))
                .totalQuestions(questionSum)
                .latestScore(valueOrZero(latest.getScore()))
                .count(results.size())
                .build();
    }

    /**
     * A sorted copy, most recent first.
     */
    public static List<QuizResult> newestFirst(List<QuizResult> results) {
        List<QuizResult> sorted = new ArrayList<>(results);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    static double average(long sum, int count) {
        return BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(count), AVERAGE_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static Instant createdAtOrEarliest(QuizResult result) {
        return result.getCreatedAt() != null ? result.getCreatedAt() : EARLIEST;
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
