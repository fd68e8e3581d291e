package com.temperamentplatform.flags.service;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Allows at most one in-flight evaluation per subject id inside this process.
 *
 * <p>Each subject keeps a tail: a Mono that completes once every evaluation queued so far
 * has finished. A new evaluation waits on the current tail and installs its own. Tails are
 * removed when the last queued evaluation terminates, so idle subjects cost nothing.
 * Cross-process exclusion is left to the store's compare-and-append.
 */
@Component
public class SubjectEvaluationGuard {

    private final ConcurrentHashMap<Long, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> serialize(long subjectId, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            AtomicReference<Mono<Void>> predecessor = new AtomicReference<>(Mono.empty());
            Mono<Void> tail = tails.compute(subjectId, (id, previous) -> {
                if (previous != null) {
                    predecessor.set(previous.onErrorResume(e -> Mono.empty()));
                }
                return predecessor.get().then(done.asMono());
            });

            return predecessor.get()
                .then(Mono.defer(work))
                .doFinally(signal -> {
                    done.tryEmitEmpty();
                    tails.remove(subjectId, tail);
                });
        });
    }

    /** Subjects with an evaluation running or queued. */
    public int activeSubjects() {
        return tails.size();
    }
}
