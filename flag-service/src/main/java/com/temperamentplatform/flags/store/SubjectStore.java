package com.temperamentplatform.flags.store;

import com.temperamentplatform.common.model.SubjectState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface SubjectStore {

    /** Empty when no subject has this id. */
    Mono<SubjectState> getSubject(long subjectId);

    /**
     * Appends {@code newFlags} to the subject's flag set, but only if the stored set still
     * equals {@code expectedFlags}.
     *
     * @return the subject as stored after the append
     * @throws com.temperamentplatform.flags.exception.FlagUpdateConflictException (as an error
     *         signal) when the stored set changed in the meantime
     * @throws com.temperamentplatform.flags.exception.SubjectNotFoundException (as an error
     *         signal) when the subject disappeared
     */
    Mono<SubjectState> appendFlags(long subjectId, Set<String> expectedFlags, List<String> newFlags);

    /**
     * Ids of subjects born after {@code bornAfter} holding fewer than {@code maxFlags} flags.
     */
    Flux<Long> findEvaluationCandidates(Instant bornAfter, int maxFlags);
}
