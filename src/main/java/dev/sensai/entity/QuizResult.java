package dev.sensai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One submitted quiz attempt. Documents in the {@code quiz} collection are append-only:
 * every submission is a new document and nothing updates an existing one.
 */
@Document(collection = QuizResult.COLLECTION)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizResult {

    public static final String COLLECTION = "quiz";

    @Id
    private String id;

    @Field("user_id")
    private String userId;

    private Integer score;

    @Field("total_questions")
    private Integer totalQuestions;

    @Field("correct_answers")
    private Integer correctAnswers;

    private String feedback;

    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;
}
