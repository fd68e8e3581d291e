package com.temperamentplatform.flags.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SubjectEvaluationGuardTest {

    private final SubjectEvaluationGuard guard = new SubjectEvaluationGuard();

    @Test
    @DisplayName("second evaluation of the same subject waits for the first")
    void serializesSameSubject() {
        Sinks.One<String> gate = Sinks.one();
        AtomicInteger started = new AtomicInteger();
        List<String> completed = new ArrayList<>();

        guard.serialize(1L, () -> {
            started.incrementAndGet();
            return gate.asMono();
        }).subscribe(completed::add);
        guard.serialize(1L, () -> {
            started.incrementAndGet();
            return Mono.just("second");
        }).subscribe(completed::add);

        assertEquals(1, started.get());
        assertEquals(1, guard.activeSubjects());

        gate.tryEmitValue("first");

        assertEquals(2, started.get());
        assertEquals(List.of("first", "second"), completed);
        assertEquals(0, guard.activeSubjects());
    }

    @Test
    @DisplayName("different subjects do not wait for each other")
    void independentSubjects() {
        Sinks.One<String> gate = Sinks.one();
        AtomicInteger started = new AtomicInteger();

        guard.serialize(1L, () -> {
            started.incrementAndGet();
            return gate.asMono();
        }).subscribe();
        guard.serialize(2L, () -> {
            started.incrementAndGet();
            return Mono.just("other");
        }).subscribe();

        assertEquals(2, started.get());
        gate.tryEmitValue("done");
        assertEquals(0, guard.activeSubjects());
    }

    @Test
    @DisplayName("a failed evaluation releases the subject")
    void failureReleases() {
        List<String> completed = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();

        guard.serialize(1L, () -> Mono.<String>error(new IllegalStateException("boom")))
            .subscribe(completed::add, errors::add);
        guard.serialize(1L, () -> Mono.just("after"))
            .subscribe(completed::add);

        assertEquals(1, errors.size());
        assertEquals(List.of("after"), completed);
        assertEquals(0, guard.activeSubjects());
    }
}
