package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CoverLetterRequest {

    @NotBlank(message = "company_name is required")
    private String companyName;

    @NotBlank(message = "job_title is required")
    private String jobTitle;

    @NotBlank(message = "job_description is required")
    private String jobDescription;

    private String userName;
}
