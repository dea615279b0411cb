package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A quiz attempt as submitted by the client.
 * {@code correctAnswers} is not checked against {@code totalQuestions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuizResultRequest {

    @NotBlank(message = "user_id is required")
    @Schema(description = "Client-generated or provider user id", example = "user-42")
    private String userId;

    @NotNull(message = "score is required")
    @Min(value = 0, message = "score must be between 0 and 100")
    @Max(value = 100, message = "score must be between 0 and 100")
    private Integer score;

    @NotNull(message = "total_questions is required")
    @Min(value = 1, message = "total_questions must be at least 1")
    private Integer totalQuestions;

    @NotNull(message = "correct_answers is required")
    @Min(value = 0, message = "correct_answers must not be negative")
    private Integer correctAnswers;

    private String feedback;
}
