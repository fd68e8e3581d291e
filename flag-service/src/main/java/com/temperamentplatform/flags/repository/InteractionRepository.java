package com.temperamentplatform.flags.repository;

import com.temperamentplatform.flags.model.InteractionRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface InteractionRepository extends ReactiveCrudRepository<InteractionRecord, Long> {

    /** Interactions in {@code [since, until)}, oldest first. */
    @Query("""
        SELECT * FROM interactions
        WHERE subject_id = :subjectId
          AND occurred_at >= :since
          AND occurred_at <  :until
        ORDER BY occurred_at ASC, id ASC
        """)
    Flux<InteractionRecord> findInRange(Long subjectId, LocalDateTime since, LocalDateTime until);
}
