package dev.sensai.controller;

import dev.sensai.dto.CoverLetterRequest;
import dev.sensai.dto.CoverLetterResponse;
import dev.sensai.service.CoverLetterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/cover-letter")
@RequiredArgsConstructor
@Tag(name = "Cover letter", description = "AI generated cover letters")
public class CoverLetterController {

    private final CoverLetterService coverLetterService;

    @PostMapping
    @Operation(summary = "Generate a cover letter for a job posting")
    public Mono<CoverLetterResponse> generate(@Valid @RequestBody CoverLetterRequest request) {
        return coverLetterService.generate(request).map(CoverLetterResponse::new);
    }
}
