package dev.sensai.repository;

import com.mongodb.client.result.UpdateResult;
import dev.sensai.entity.ResumeProfile;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResumeProfileUpsertRepositoryImpl")
class ResumeProfileUpsertRepositoryImplTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    @InjectMocks
    private ResumeProfileUpsertRepositoryImpl repository;

    private static ResumeProfile profile() {
        return ResumeProfile.builder()
                .userId("u1")
                .email("a@b.c")
                .skills(List.of("SQL"))
                .experiences(List.of(ResumeProfile.Experience.builder()
                        .company("Acme").role("Engineer").start("2020").end("2023").build()))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("sets every field, and created_at only on insert")
    void buildsFullReplaceUpdate() {
        Document update = ResumeProfileUpsertRepositoryImpl.toUpdate(profile()).getUpdateObject();

        Document set = update.get("$set", Document.class);
        assertThat(set).containsKeys("user_id", "email", "linkedin", "twitter", "summary",
                "skills", "experiences", "education", "projects", "updated_at");
        assertThat(set).doesNotContainKey("created_at");
        assertThat(set.get("linkedin")).isNull();
        assertThat(set.get("education")).isEqualTo(List.of());
        assertThat(set.get("updated_at")).isEqualTo(NOW);

        Document setOnInsert = update.get("$setOnInsert", Document.class);
        assertThat(setOnInsert).containsEntry("created_at", NOW);
    }

    @Test
    @DisplayName("stores sub-records under their snake_case field names")
    void mapsExperience() {
        Document experience = ResumeProfileUpsertRepositoryImpl.toDocument(ResumeProfile.Experience.builder()
                .company("Acme").role("Engineer").start("2020").end("2023").build());

        assertThat(experience).containsEntry("company", "Acme")
                .containsEntry("role", "Engineer")
                .containsEntry("start", "2020")
                .containsEntry("end", "2023")
                .containsKey("description");
    }

    @Test
    @DisplayName("reports a created document when the upsert inserted one")
    void reportsCreated() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(ResumeProfile.class)))
                .thenReturn(Mono.just(UpdateResult.acknowledged(0, 0L, new BsonObjectId(new ObjectId()))));

        StepVerifier.create(repository.upsertByUserId(profile()))
                .expectNext(true)
                .verifyComplete();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).upsert(query.capture(), any(Update.class), eq(ResumeProfile.class));
        assertThat(query.getValue().getQueryObject()).containsEntry("user_id", "u1");
    }

    @Test
    @DisplayName("reports a replacement when an existing document matched")
    void reportsReplaced() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(ResumeProfile.class)))
                .thenReturn(Mono.just(UpdateResult.acknowledged(1, 1L, null)));

        StepVerifier.create(repository.upsertByUserId(profile()))
                .expectNext(false)
                .verifyComplete();
    }
}
