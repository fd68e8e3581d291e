package com.temperamentplatform.flags.repository;

import com.temperamentplatform.flags.model.SubjectRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface SubjectRepository extends ReactiveCrudRepository<SubjectRecord, Long> {

    /**
     * Subjects born after {@code bornAfter} holding fewer than {@code maxFlags} flags,
     * i.e. the ones a population run can still change.
     */
    @Query("""
        SELECT id FROM subjects
        WHERE birth_date > :bornAfter
          AND flag_count < :maxFlags
        ORDER BY id
        """)
    Flux<Long> findEligibleIds(LocalDateTime bornAfter, int maxFlags);

    /**
     * Compare-and-append: replaces the flag list only if nobody changed it since
     * {@code expectedVersion} was read.
     *
     * @return number of rows updated; 0 means a concurrent writer won
     */
    @Modifying
    @Query("""
        UPDATE subjects
        SET flags         = :flags,
            flag_count    = :flagCount,
            flags_version = flags_version + 1,
            updated_at    = NOW()
        WHERE id = :id
          AND flags_version = :expectedVersion
        """)
    Mono<Integer> compareAndSetFlags(Long id, long expectedVersion, String flags, int flagCount);
}
