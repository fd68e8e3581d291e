package com.temperamentplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.temperamentplatform.common.Interactions.*;
import static org.junit.jupiter.api.Assertions.*;

class SubjectStateTest {

    @Test
    @DisplayName("age is whole days since birth, never negative")
    void ageInDays() {
        SubjectState subject = subject(0, 0);
        assertEquals(0, subject.ageInDays(BIRTH.minusSeconds(3600)));
        assertEquals(4, subject.ageInDays(dayAndHour(4, 23)));
    }

    @Test
    @DisplayName("appending returns a new snapshot and keeps set semantics")
    void appendFlags() {
        SubjectState subject = subject(0, 0, "calm");
        SubjectState updated = subject.withAppendedFlags(List.of("brave", "calm"));

        assertEquals(Set.of("calm"), subject.flags());
        assertEquals(Set.of("calm", "brave"), updated.flags());
        assertThrows(UnsupportedOperationException.class, () -> updated.flags().add("social"));
    }

    @Test
    @DisplayName("capacity check at five flags")
    void capacity() {
        assertFalse(subject(0, 0, "a", "b", "c", "d").atFlagCapacity());
        assertTrue(subject(0, 0, "a", "b", "c", "d", "e").atFlagCapacity());
    }

    @Test
    @DisplayName("quality grades parse leniently")
    void qualityParse() {
        assertEquals(QualityGrade.EXCELLENT, QualityGrade.fromString(" excellent "));
        assertEquals(QualityGrade.FAIR, QualityGrade.fromString("superb"));
        assertEquals(QualityGrade.FAIR, QualityGrade.fromString(null));
        assertTrue(QualityGrade.POOR.score() < QualityGrade.EXCELLENT.score());
    }
}
