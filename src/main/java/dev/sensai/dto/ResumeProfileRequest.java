package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full resume payload. The stored resume is replaced by this payload as a whole, so a field
 * left out here is cleared, not kept from the previous version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResumeProfileRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    private String email;
    private String linkedin;
    private String twitter;
    private String summary;

    private List<@NotNull(message = "skill must not be null") String> skills;

    @Valid
    private List<@NotNull(message = "experience entry must not be null") ExperienceEntry> experiences;

    @Valid
    private List<@NotNull(message = "education entry must not be null") EducationEntry> education;

    @Valid
    private List<@NotNull(message = "project entry must not be null") ProjectEntry> projects;
}
