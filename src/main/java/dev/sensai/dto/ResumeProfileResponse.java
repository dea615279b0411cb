package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Stored resume as returned to clients; the store's internal document id is not exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResumeProfileResponse {

    private String userId;
    private String email;
    private String linkedin;
    private String twitter;
    private String summary;
    private List<String> skills;
    private List<ExperienceEntry> experiences;
    private List<EducationEntry> education;
    private List<ProjectEntry> projects;
    private Instant createdAt;
    private Instant updatedAt;
}
