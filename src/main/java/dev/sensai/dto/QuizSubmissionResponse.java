package dev.sensai.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Acknowledgement of a stored quiz result")
public class QuizSubmissionResponse {

    @Schema(description = "Store-assigned record id", example = "665f1c2e9b1e8a3d4c5b6a79")
    private String id;

    private boolean ok;

    public static QuizSubmissionResponse of(String id) {
        return new QuizSubmissionResponse(id, true);
    }
}
