package com.temperamentplatform.flags.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.temperamentplatform.common.exception.FlagEvaluationException;
import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.QualityGrade;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.flags.model.InteractionRecord;
import com.temperamentplatform.flags.model.SubjectRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubjectRecordMapperTest {

    private final SubjectRecordMapper mapper = new SubjectRecordMapper(new ObjectMapper());

    private static SubjectRecord record(String flagsJson) {
        SubjectRecord record = new SubjectRecord();
        record.setId(5L);
        record.setName("Juniper");
        record.setBirthDate(LocalDateTime.of(2026, 3, 1, 12, 0));
        record.setBondScore(40);
        record.setStressLevel(20);
        record.setFlags(flagsJson);
        return record;
    }

    @Test
    @DisplayName("subject row maps to a UTC snapshot with ordered flags")
    void subject() {
        SubjectState subject = mapper.toSubject(record("[\"calm\",\"brave\"]"));

        assertEquals(5L, subject.id());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), subject.birthDate());
        assertEquals(List.of("calm", "brave"), List.copyOf(subject.flags()));
    }

    @Test
    @DisplayName("missing flags column reads as no flags")
    void emptyFlags() {
        assertTrue(mapper.toSubject(record(null)).flags().isEmpty());
    }

    @Test
    @DisplayName("corrupt flags column raises FlagEvaluationException with the subject id")
    void corruptFlags() {
        FlagEvaluationException e = assertThrows(FlagEvaluationException.class,
            () -> mapper.toSubject(record("{not json")));
        assertEquals(5L, e.getSubjectId());
    }

    @Test
    @DisplayName("interaction row maps quality and signed deltas")
    void interaction() {
        InteractionRecord record = new InteractionRecord();
        record.setId(1L);
        record.setSubjectId(5L);
        record.setCaregiverId(9L);
        record.setOccurredAt(LocalDateTime.of(2026, 3, 2, 8, 30));
        record.setTaskCategory("grooming");
        record.setQuality("EXCELLENT");
        record.setBondDelta(3);
        record.setStressDelta(-2);

        InteractionEvent event = mapper.toEvent(record);

        assertEquals(QualityGrade.EXCELLENT, event.quality());
        assertEquals(-2, event.stressDelta());
        assertEquals(Instant.parse("2026-03-02T08:30:00Z"), event.occurredAt());
    }

    @Test
    @DisplayName("lowercase or unrecognised quality values are read leniently")
    void lenientQuality() {
        InteractionRecord record = new InteractionRecord();
        record.setSubjectId(5L);
        record.setOccurredAt(LocalDateTime.of(2026, 3, 2, 8, 30));
        record.setTaskCategory("feeding");
        record.setQuality("excellent");

        assertEquals(QualityGrade.EXCELLENT, mapper.toEvent(record).quality());

        record.setQuality("stellar");
        assertEquals(QualityGrade.FAIR, mapper.toEvent(record).quality());
    }

    @Test
    @DisplayName("flags serialise back as a JSON array")
    void writeFlags() {
        assertEquals("[\"brave\",\"calm\"]", mapper.writeFlags(5L, List.of("brave", "calm")));
    }
}
