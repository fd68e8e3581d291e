package com.temperamentplatform.flags.store;

import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.flags.exception.FlagUpdateConflictException;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Subject store fake with the same compare-and-append contract as the R2DBC store.
 * {@link #failNextAppends(int)} simulates concurrent writers winning the race.
 */
public class InMemorySubjectStore implements SubjectStore {

    private final ConcurrentHashMap<Long, SubjectState> subjects = new ConcurrentHashMap<>();
    private final AtomicInteger appendCalls = new AtomicInteger();
    private final AtomicInteger forcedConflicts = new AtomicInteger();

    public InMemorySubjectStore put(SubjectState subject) {
        subjects.put(subject.id(), subject);
        return this;
    }

    public SubjectState stored(long subjectId) {
        return subjects.get(subjectId);
    }

    public void failNextAppends(int count) {
        forcedConflicts.set(count);
    }

    public int appendCalls() {
        return appendCalls.get();
    }

    @Override
    public Mono<SubjectState> getSubject(long subjectId) {
        return Mono.fromSupplier(() -> subjects.get(subjectId));
    }

    @Override
    public Mono<SubjectState> appendFlags(long subjectId, Set<String> expectedFlags, List<String> newFlags) {
        return Mono.defer(() -> {
            appendCalls.incrementAndGet();
            if (forcedConflicts.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new FlagUpdateConflictException(subjectId));
            }
            SubjectState[] result = new SubjectState[1];
            RuntimeException[] failure = new RuntimeException[1];
            subjects.compute(subjectId, (id, current) -> {
                if (current == null) {
                    failure[0] = new SubjectNotFoundException(subjectId);
                    return null;
                }
                if (!current.flags().equals(expectedFlags)) {
                    failure[0] = new FlagUpdateConflictException(subjectId);
                    return current;
                }
                result[0] = current.withAppendedFlags(newFlags);
                return result[0];
            });
            return failure[0] != null ? Mono.error(failure[0]) : Mono.just(result[0]);
        });
    }

    @Override
    public Flux<Long> findEvaluationCandidates(Instant bornAfter, int maxFlags) {
        return Flux.fromIterable(subjects.values())
            .filter(s -> s.birthDate().isAfter(bornAfter))
            .filter(s -> s.flags().size() < maxFlags)
            .map(SubjectState::id)
            .sort(Comparator.naturalOrder());
    }
}
