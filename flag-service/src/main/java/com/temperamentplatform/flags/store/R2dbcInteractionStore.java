package com.temperamentplatform.flags.store;

import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.flags.repository.InteractionRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Instant;

@Component
public class R2dbcInteractionStore implements InteractionStore {

    private final InteractionRepository repository;
    private final SubjectRecordMapper mapper;

    public R2dbcInteractionStore(InteractionRepository repository, SubjectRecordMapper mapper) {
        this.repository = repository;
        this.mapper     = mapper;
    }

    @Override
    public Flux<InteractionEvent> listInteractions(long subjectId, Instant since, Instant until) {
        return repository.findInRange(subjectId,
                SubjectRecordMapper.toUtc(since), SubjectRecordMapper.toUtc(until))
            .map(mapper::toEvent);
    }
}
