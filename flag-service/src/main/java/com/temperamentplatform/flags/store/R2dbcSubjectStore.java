package com.temperamentplatform.flags.store;

import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.flags.exception.FlagUpdateConflictException;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import com.temperamentplatform.flags.model.SubjectRecord;
import com.temperamentplatform.flags.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Subject store over R2DBC. Appends go through a version-checked UPDATE so that two
 * writers can never both extend the same flag set.
 */
@Component
public class R2dbcSubjectStore implements SubjectStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSubjectStore.class);

    private final SubjectRepository repository;
    private final SubjectRecordMapper mapper;

    public R2dbcSubjectStore(SubjectRepository repository, SubjectRecordMapper mapper) {
        this.repository = repository;
        this.mapper     = mapper;
    }

    @Override
    public Mono<SubjectState> getSubject(long subjectId) {
        return repository.findById(subjectId).map(mapper::toSubject);
    }

    @Override
    public Mono<SubjectState> appendFlags(long subjectId, Set<String> expectedFlags, List<String> newFlags) {
        return repository.findById(subjectId)
            .switchIfEmpty(Mono.error(new SubjectNotFoundException(subjectId)))
            .flatMap(record -> {
                Set<String> stored = mapper.readFlags(record);
                if (!stored.equals(expectedFlags)) {
                    return Mono.error(new FlagUpdateConflictException(subjectId));
                }
                Set<String> merged = new LinkedHashSet<>(stored);
                merged.addAll(newFlags);
                String json = mapper.writeFlags(subjectId, merged);
                return repository.compareAndSetFlags(subjectId, record.getFlagsVersion(), json, merged.size())
                    .flatMap(updated -> {
                        if (updated == 0) {
                            log.warn("Compare-and-append lost race. subjectId={} version={}",
                                     subjectId, record.getFlagsVersion());
                            return Mono.error(new FlagUpdateConflictException(subjectId));
                        }
                        record.setFlags(json);
                        record.setFlagCount(merged.size());
                        record.setFlagsVersion(record.getFlagsVersion() + 1);
                        return Mono.just(mapper.toSubject(record));
                    });
            });
    }

    @Override
    public Flux<Long> findEvaluationCandidates(Instant bornAfter, int maxFlags) {
        return repository.findEligibleIds(SubjectRecordMapper.toUtc(bornAfter), maxFlags);
    }
}
