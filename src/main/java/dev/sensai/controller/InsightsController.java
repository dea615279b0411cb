package dev.sensai.controller;

import dev.sensai.dto.MarketInsightsResponse;
import dev.sensai.service.InsightsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/insights")
@RequiredArgsConstructor
@Tag(name = "Insights", description = "Market insight snapshot")
public class InsightsController {

    private final InsightsService insightsService;

    @GetMapping
    @Operation(summary = "Get the market insight snapshot")
    public Mono<MarketInsightsResponse> insights() {
        return insightsService.getMarketInsights();
    }
}
