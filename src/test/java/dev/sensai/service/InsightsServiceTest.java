package dev.sensai.service;

import dev.sensai.dto.MarketInsightsResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class InsightsServiceTest {

    private final InsightsService insightsService = new InsightsService();

    @Test
    @DisplayName("returns the fixed market snapshot")
    void returnsSnapshot() {
        StepVerifier.create(insightsService.getMarketInsights())
                .assertNext(insights -> {
                    assertThat(insights.getMarketOutlook()).isEqualTo("Positive");
                    assertThat(insights.getIndustryGrowth()).isEqualTo(8.5);
                    assertThat(insights.getDemandLevel()).isEqualTo("High");
                    assertThat(insights.getTopSkills()).hasSize(6).contains("Python", "LLMs");
                    assertThat(insights.getSalaryRanges()).hasSize(5)
                            .first()
                            .isEqualTo(new MarketInsightsResponse.SalaryRange("Data Scientist", 110, 180));
                    assertThat(insights.getTrends()).hasSize(4);
                    assertThat(insights.getRecommendedSkills()).containsExactly(
                            "Vector databases", "Prompt engineering", "Airflow / Dagster", "dbt", "Kubernetes");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("every salary range is ordered")
    void salaryRangesAreOrdered() {
        MarketInsightsResponse insights = insightsService.getMarketInsights().block();

        assertThat(insights.getSalaryRanges())
                .allSatisfy(range -> assertThat(range.getMin()).isLessThan(range.getMax()));
    }
}
