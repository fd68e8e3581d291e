package com.temperamentplatform.flags.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.temperamentplatform.common.exception.FlagEvaluationException;
import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.QualityGrade;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.flags.model.InteractionRecord;
import com.temperamentplatform.flags.model.SubjectRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts between R2DBC rows and the domain records used by the evaluation pipeline.
 * All timestamps are stored as UTC {@link LocalDateTime}.
 */
@Component
public class SubjectRecordMapper {

    private static final TypeReference<List<String>> FLAG_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SubjectRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SubjectState toSubject(SubjectRecord record) {
        return new SubjectState(
            record.getId(),
            record.getName(),
            toInstant(record.getBirthDate()),
            record.getBondScore(),
            record.getStressLevel(),
            readFlags(record));
    }

    public InteractionEvent toEvent(InteractionRecord record) {
        return new InteractionEvent(
            record.getSubjectId(),
            record.getCaregiverId() != null ? record.getCaregiverId() : 0L,
            record.getCaregiverPersonality(),
            toInstant(record.getOccurredAt()),
            record.getTaskCategory(),
            QualityGrade.fromString(record.getQuality()),
            record.getBondDelta(),
            record.getStressDelta(),
            record.getDurationMinutes());
    }

    public Set<String> readFlags(SubjectRecord record) {
        String json = record.getFlags();
        if (json == null || json.isBlank()) return Set.of();
        try {
            return new LinkedHashSet<>(objectMapper.readValue(json, FLAG_LIST));
        } catch (JsonProcessingException e) {
            throw new FlagEvaluationException(record.getId(), "Unreadable flags column", e);
        }
    }

    public String writeFlags(long subjectId, Collection<String> flags) {
        try {
            return objectMapper.writeValueAsString(new ArrayList<>(flags));
        } catch (JsonProcessingException e) {
            throw new FlagEvaluationException(subjectId, "Could not serialise flags", e);
        }
    }

    public static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }
}
