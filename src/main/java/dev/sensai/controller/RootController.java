package dev.sensai.controller;

import dev.sensai.dto.MessageResponse;
import dev.sensai.dto.StoreDiagnosticsResponse;
import dev.sensai.service.StoreDiagnosticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
@Tag(name = "Status", description = "Liveness and store diagnostics")
public class RootController {

    static final String RUNNING_MESSAGE = "SENSAI API is running";

    private final StoreDiagnosticsService diagnosticsService;

    @GetMapping("/")
    @Operation(summary = "Liveness check")
    public Mono<MessageResponse> root() {
        return Mono.just(MessageResponse.of(RUNNING_MESSAGE));
    }

    @GetMapping("/test")
    @Operation(summary = "Document store diagnostics", description = "Reports store reachability; never fails")
    public Mono<StoreDiagnosticsResponse> testDatabase() {
        return diagnosticsService.diagnose();
    }
}
