package dev.sensai.controller;

import dev.sensai.dto.OkResponse;
import dev.sensai.dto.ResumeProfileRequest;
import dev.sensai.service.ResumeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * One resume per user. Saving replaces the stored resume as a whole.
 */
@RestController
@RequestMapping("/api/resume")
@RequiredArgsConstructor
@Tag(name = "Resume", description = "Per-user resume storage")
public class ResumeController {

    private final ResumeService resumeService;

    @PostMapping
    @Operation(summary = "Create or replace the user's resume")
    public Mono<OkResponse> save(@Valid @RequestBody ResumeProfileRequest request) {
        return resumeService.saveResume(request).thenReturn(OkResponse.ok());
    }

    /**
     * Returns the stored resume, or an empty JSON object when the user has none.
     */
    @GetMapping
    @Operation(summary = "Get the user's resume")
    public Mono<ResponseEntity<?>> get(@RequestParam("user_id") String userId) {
        return resumeService.getResume(userId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.ok(Map.of()));
    }
}
