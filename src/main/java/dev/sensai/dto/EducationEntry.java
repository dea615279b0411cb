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
public class EducationEntry {

    @NotBlank(message = "school is required")
    private String school;

    @NotBlank(message = "degree is required")
    private String degree;

    @NotBlank(message = "start is required")
    private String start;

    @NotBlank(message = "end is required")
    private String end;

    private String details;
}
