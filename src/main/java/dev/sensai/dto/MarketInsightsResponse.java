package dev.sensai.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Market insight snapshot (static sample data)")
public class MarketInsightsResponse {

    private String marketOutlook;
    @Schema(description = "Industry growth in percent", example = "8.5")
    private double industryGrowth;
    private String demandLevel;
    private List<String> topSkills;
    private List<SalaryRange> salaryRanges;
    private List<String> trends;
    private List<String> recommendedSkills;

    /**
     * Salary band in thousands.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SalaryRange {
        private String role;
        private int min;
        private int max;
    }
}
