package dev.sensai.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExperienceEntry {

    @NotBlank(message = "company is required")
    private String company;

    @NotBlank(message = "role is required")
    private String role;

    @NotBlank(message = "start is required")
    private String start;

    @NotBlank(message = "end is required")
    private String end;

    private String description;
}
