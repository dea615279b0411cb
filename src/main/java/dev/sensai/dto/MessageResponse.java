package dev.sensai.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Simple message response")
public class MessageResponse {

    @Schema(description = "Response message", example = "SENSAI API is running")
    private String message;

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
