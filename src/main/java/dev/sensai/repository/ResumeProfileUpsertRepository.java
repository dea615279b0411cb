package dev.sensai.repository;

import dev.sensai.entity.ResumeProfile;
import reactor.core.publisher.Mono;

/**
 * Upsert of resume documents keyed by {@code user_id}.
 * Implemented with {@code ReactiveMongoTemplate} since derived repository methods cannot
 * express a set-on-insert field.
 */
public interface ResumeProfileUpsertRepository {

    /**
     * Replaces every field of the user's resume with the given profile, creating the document
     * if it does not exist. {@code createdAt} is written only when the document is created.
     *
     * @return true when a new document was inserted, false when an existing one was replaced
     */
    Mono<Boolean> upsertByUserId(ResumeProfile profile);
}
