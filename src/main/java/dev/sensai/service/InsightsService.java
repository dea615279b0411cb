package dev.sensai.service;

import dev.sensai.dto.MarketInsightsResponse;
import dev.sensai.dto.MarketInsightsResponse.SalaryRange;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Market insight snapshot. The values are fixed sample data and do not depend on any store.
 */
@Service
public class InsightsService {

    private static final MarketInsightsResponse SNAPSHOT = MarketInsightsResponse.builder()
            .marketOutlook("Positive")
            .industryGrowth(8.5)
            .demandLevel("High")
            .topSkills(List.of(
                    "Python",
                    "SQL",
                    "Machine Learning",
                    "Data Engineering",
                    "Cloud (AWS/GCP)",
                    "LLMs"))
            .salaryRanges(List.of(
                    new SalaryRange("Data Scientist", 110, 180),
                    new SalaryRange("Data Engineer", 120, 190),
                    new SalaryRange("ML Engineer", 130, 210),
                    new SalaryRange("Analytics Engineer", 105, 160),
                    new SalaryRange("AI Product Manager", 130, 200)))
            .trends(List.of(
                    "Rise of LLM applications and AI copilots",
                    "Data quality and governance as differentiators",
                    "Real-time analytics and streaming architectures",
                    "MLOps maturity: monitoring, rollback, and evaluation"))
            .recommendedSkills(List.of(
                    "Vector databases",
                    "Prompt engineering",
                    "Airflow / Dagster",
                    "dbt",
                    "Kubernetes"))
            .build();

    public Mono<MarketInsightsResponse> getMarketInsights() {
        return Mono.just(SNAPSHOT);
    }
}
