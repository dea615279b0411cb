package dev.sensai.config;

import dev.sensai.entity.QuizResult;
import dev.sensai.entity.ResumeProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import reactor.core.publisher.Flux;

/**
 * Creates the collection indexes once the application is up.
 * <p>
 * {@code quiz} gets a compound {@code (user_id, created_at desc)} index for the per-user scans,
 * {@code resume} a unique {@code user_id} index so there is at most one resume per user.
 * Index creation failures are logged and do not stop the application; the store may come up later.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MongoIndexConfig {

    static final String QUIZ_INDEX = "user_id_created_at";
    static final String RESUME_INDEX = "user_id_unique";

    private final ReactiveMongoTemplate mongoTemplate;
    private final StoreProperties storeProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!storeProperties.isConfigured()) {
            log.warn("Document store not configured (DATABASE_URL / DATABASE_NAME); skipping index creation");
            return;
        }
        ensureIndexes().subscribe(
                name -> log.info("[MongoDB] Index ready: {}", name),
                ex -> log.error("[MongoDB] Failed to create indexes: {}", ex.getMessage()));
    }

    Flux<String> ensureIndexes() {
        Index quizIndex = new Index()
                .on("user_id", Sort.Direction.ASC)
                .on("created_at", Sort.Direction.DESC)
                .named(QUIZ_INDEX);
        Index resumeIndex = new Index()
                .on("user_id", Sort.Direction.ASC)
                .unique()
                .named(RESUME_INDEX);

        return mongoTemplate.indexOps(QuizResult.class).ensureIndex(quizIndex)
                .concatWith(mongoTemplate.indexOps(ResumeProfile.class).ensureIndex(resumeIndex));
    }
}
