package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuizResultResponse {

    private String id;
    private String userId;
    private Integer score;
    private Integer totalQuestions;
    private Integer correctAnswers;
    private String feedback;
    private Instant createdAt;
    private Instant updatedAt;
}
