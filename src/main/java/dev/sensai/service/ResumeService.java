package dev.sensai.service;

import dev.sensai.dto.EducationEntry;
import dev.sensai.dto.ExperienceEntry;
import dev.sensai.dto.ProjectEntry;
import dev.sensai.dto.ResumeProfileRequest;
import dev.sensai.dto.ResumeProfileResponse;
import dev.sensai.entity.ResumeProfile;
import dev.sensai.metrics.SensaiMetrics;
import dev.sensai.repository.ResumeProfileRepository;
import dev.sensai.repository.ResumeProfileUpsertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Resume storage, one document per user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeService {

    private final ResumeProfileRepository resumeProfileRepository;
    private final ResumeProfileUpsertRepository resumeProfileUpsertRepository;
    private final DocumentStoreGuard storeGuard;
    private final SensaiMetrics metrics;

    /**
     * Creates the user's resume or replaces it as a whole. {@code created_at} is only written
     * on creation; {@code updated_at} is written every time. Concurrent writers race and the
     * last write wins.
     */
    public Mono<Void> saveResume(ResumeProfileRequest request) {
        return saveResume(request, Instant.now());
    }

    Mono<Void> saveResume(ResumeProfileRequest request, Instant now) {
        ResumeProfile profile = toEntity(request, now);
        log.info("Saving resume for userId={}", request.getUserId());
        return storeGuard.guard("resume upsert", () -> resumeProfileUpsertRepository.upsertByUserId(profile))
                .doOnNext(created -> {
                    metrics.incrementResumeUpsert(created);
                    log.info("{} resume for userId={}", created ? "Created" : "Replaced", request.getUserId());
                })
                .then();
    }

    /**
     * The user's resume, or an empty Mono when none was saved yet.
     */
    public Mono<ResumeProfileResponse> getResume(String userId) {
        log.debug("Getting resume for userId={}", userId);
        return storeGuard.guard("resume lookup", () -> resumeProfileRepository.findByUserId(userId))
                .map(this::toResponse);
    }

    // ============================================
    // MAPPING
    // ============================================

    ResumeProfile toEntity(ResumeProfileRequest request, Instant now) {
        return ResumeProfile.builder()
                .userId(request.getUserId())
                .email(request.getEmail())
                .linkedin(request.getLinkedin())
                .twitter(request.getTwitter())
                .summary(request.getSummary())
                .skills(copyOrEmpty(request.getSkills(), Function.identity()))
                .experiences(copyOrEmpty(request.getExperiences(), e -> ResumeProfile.Experience.builder()
                        .company(e.getCompany())
                        .role(e.getRole())
                        .start(e.getStart())
                        .end(e.getEnd())
                        .description(e.getDescription())
                        .build()))
                .education(copyOrEmpty(request.getEducation(), e -> ResumeProfile.Education.builder()
                        .school(e.getSchool())
                        .degree(e.getDegree())
                        .start(e.getStart())
                        .end(e.getEnd())
                        .details(e.getDetails())
                        .build()))
                .projects(copyOrEmpty(request.getProjects(), p -> ResumeProfile.Project.builder()
                        .name(p.getName())
                        .link(p.getLink())
                        .description(p.getDescription())
                        .build()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private ResumeProfileResponse toResponse(ResumeProfile profile) {
        return ResumeProfileResponse.builder()
                .userId(profile.getUserId())
                .email(profile.getEmail())
                .linkedin(profile.getLinkedin())
                .twitter(profile.getTwitter())
                .summary(profile.getSummary())
                .skills(copyOrEmpty(profile.getSkills(), Function.identity()))
                .experiences(copyOrEmpty(profile.getExperiences(), e -> new ExperienceEntry(
                        e.getCompany(), e.getRole(), e.getStart(), e.getEnd(), e.getDescription())))
                .education(copyOrEmpty(profile.getEducation(), e -> new EducationEntry(
                        e.getSchool(), e.getDegree(), e.getStart(), e.getEnd(), e.getDetails())))
                .projects(copyOrEmpty(profile.getProjects(), p -> new ProjectEntry(
                        p.getName(), p.getLink(), p.getDescription())))
                .createdAt(profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }

    private static <S, T> List<T> copyOrEmpty(List<S> source, Function<S, T> mapper) {
        if (source == null) {
            return new ArrayList<>();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (S item : source) {
            copy.add(mapper.apply(item));
        }
        return copy;
    }
}
