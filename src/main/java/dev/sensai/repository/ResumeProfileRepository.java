package dev.sensai.repository;

import dev.sensai.entity.ResumeProfile;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Read side of the {@code resume} collection. Writes go through {@link ResumeProfileUpsertRepository}
 * so that creation and replacement happen in one atomic store operation.
 */
@Repository
public interface ResumeProfileRepository extends ReactiveMongoRepository<ResumeProfile, String> {

    Mono<ResumeProfile> findByUserId(String userId);
}
