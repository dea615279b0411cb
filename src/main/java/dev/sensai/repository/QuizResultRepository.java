package dev.sensai.repository;

import dev.sensai.entity.QuizResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface QuizResultRepository extends ReactiveMongoRepository<QuizResult, String> {

    /**
     * Every quiz result of a user, in store order. Unbounded: the whole history is scanned.
     */
    Flux<QuizResult> findByUserId(String userId);

    Flux<QuizResult> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
