package com.temperamentplatform.flags.store;

import com.temperamentplatform.common.model.InteractionEvent;
import reactor.core.publisher.Flux;

import java.time.Instant;

public interface InteractionStore {

    /** Interactions of one subject in {@code [since, until)}, ascending by time. */
    Flux<InteractionEvent> listInteractions(long subjectId, Instant since, Instant until);
}
