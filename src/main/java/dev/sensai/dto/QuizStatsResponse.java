package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a user's quiz history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuizStatsResponse {

    @Schema(description = "Mean score, rounded half-up to 2 decimals", example = "86.67")
    private double averageScore;

    @Schema(description = "Sum of total_questions over all results")
    private long totalQuestions;

    @Schema(description = "Score of the most recently created result")
    private int latestScore;

    private long count;

    public static QuizStatsResponse empty() {
        return new QuizStatsResponse(0, 0, 0, 0);
    }
}
