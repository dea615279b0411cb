package dev.sensai.controller;

import dev.sensai.dto.QuizResultRequest;
import dev.sensai.dto.QuizResultResponse;
import dev.sensai.dto.QuizStatsResponse;
import dev.sensai.dto.QuizSubmissionResponse;
import dev.sensai.service.QuizService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/quiz")
@RequiredArgsConstructor
@Tag(name = "Quiz", description = "Quiz results and per-user statistics")
public class QuizController {

    private final QuizService quizService;

    @PostMapping
    @Operation(summary = "Store a quiz result")
    public Mono<QuizSubmissionResponse> submit(@Valid @RequestBody QuizResultRequest request) {
        return quizService.submitResult(request).map(QuizSubmissionResponse::of);
    }

    @GetMapping("/stats")
    @Operation(summary = "Aggregate statistics over all of a user's results")
    public Mono<QuizStatsResponse> stats(@RequestParam("user_id") String userId) {
        return quizService.getStats(userId);
    }

    @GetMapping("/recent")
    @Operation(summary = "Most recent results of a user, newest first")
    public Mono<List<QuizResultResponse>> recent(
            @RequestParam("user_id") String userId,
            @RequestParam(defaultValue = "" + QuizService.DEFAULT_RECENT_LIMIT) int limit) {
        return quizService.getRecentResults(userId, limit);
    }
}
