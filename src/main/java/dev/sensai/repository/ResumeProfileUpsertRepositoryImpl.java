package dev.sensai.repository;

import dev.sensai.entity.ResumeProfile;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * Maps a {@link ResumeProfile} onto a single {@code update(..., upsert=true)} against the
 * {@code resume} collection. Every field is listed in {@code $set}, so fields the caller left out
 * are reset to their defaults rather than merged with the stored values.
 */
@Repository
@RequiredArgsConstructor
public class ResumeProfileUpsertRepositoryImpl implements ResumeProfileUpsertRepository {

    static final String USER_ID = "user_id";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Mono<Boolean> upsertByUserId(ResumeProfile profile) {
        Query byUser = Query.query(Criteria.where(USER_ID).is(profile.getUserId()));
        return mongoTemplate.upsert(byUser, toUpdate(profile), ResumeProfile.class)
                .map(result -> result.getUpsertedId() != null);
    }

    static Update toUpdate(ResumeProfile profile) {
        return new Update()
                .set(USER_ID, profile.getUserId())
                .set("email", profile.getEmail())
                .set("linkedin", profile.getLinkedin())
                .set("twitter", profile.getTwitter())
                .set("summary", profile.getSummary())
                .set("skills", nullToEmpty(profile.getSkills()))
                .set("experiences", toDocuments(profile.getExperiences(), ResumeProfileUpsertRepositoryImpl::toDocument))
                .set("education", toDocuments(profile.getEducation(), ResumeProfileUpsertRepositoryImpl::toDocument))
                .set("projects", toDocuments(profile.getProjects(), ResumeProfileUpsertRepositoryImpl::toDocument))
                .set(UPDATED_AT, profile.getUpdatedAt())
                .setOnInsert(CREATED_AT, profile.getCreatedAt());
    }

    static Document toDocument(ResumeProfile.Experience experience) {
        return new Document()
                .append("company", experience.getCompany())
                .append("role", experience.getRole())
                .append("start", experience.getStart())
                .append("end", experience.getEnd())
                .append("description", experience.getDescription());
    }

    static Document toDocument(ResumeProfile.Education education) {
        return new Document()
                .append("school", education.getSchool())
                .append("degree", education.getDegree())
                .append("start", education.getStart())
                .append("end", education.getEnd())
                .append("details", education.getDetails());
    }

    static Document toDocument(ResumeProfile.Project project) {
        return new Document()
                .append("name", project.getName())
                .append("link", project.getLink())
                .append("description", project.getDescription());
    }

    private static <T> List<Document> toDocuments(List<T> entries, Function<T, Document> mapper) {
        return entries == null ? List.of() : entries.stream().map(mapper).toList();
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
