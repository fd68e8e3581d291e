package com.temperamentplatform.flags.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted caregiving interaction. Rows are written by the caregiving side of the
 * platform and only ever read here.
 *
 * occurredAt is stored as UTC; quality holds the {@code QualityGrade} enum name.
 */
@Data
@NoArgsConstructor
@Table("interactions")
public class InteractionRecord {

    @Id
    private Long id;

    private Long subjectId;

    private Long caregiverId;

    private String caregiverPersonality;

    private LocalDateTime occurredAt;

    private String taskCategory;

    private String quality;

    private int bondDelta;

    private int stressDelta;

    private int durationMinutes;
}
