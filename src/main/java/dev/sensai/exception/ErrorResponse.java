package dev.sensai.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error payload returned for every failed request")
public class ErrorResponse {

    private Instant timestamp;

    private int status;

    @Schema(description = "Stable error kind", example = "VALIDATION_ERROR")
    private ErrorCode code;

    @Schema(description = "Short error title", example = "Validation failed")
    private String error;

    private String message;

    private String path;

    @Schema(description = "Field path to violated constraint", example = "{\"experiences[0].company\": \"must not be blank\"}")
    private Map<String, String> validationErrors;
}
