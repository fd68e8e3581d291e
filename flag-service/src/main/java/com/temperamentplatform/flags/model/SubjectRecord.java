package com.temperamentplatform.flags.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted subject row.
 *
 * Column mapping (R2DBC snake_case convention):
 *   birthDate    → birth_date   (UTC)
 *   bondScore    → bond_score
 *   stressLevel  → stress_level
 *   flagCount    → flag_count
 *   flagsVersion → flags_version
 *
 * flags: JSON-serialised List<String>, append-only. {@code flagCount} mirrors its size
 * so eligibility can be filtered in SQL; {@code flagsVersion} increments on every append
 * and backs the compare-and-append update.
 */
@Data
@NoArgsConstructor
@Table("subjects")
public class SubjectRecord {

    @Id
    private Long id;

    private String name;

    private LocalDateTime birthDate;

    private int bondScore;

    private int stressLevel;

    /** JSON-serialised {@code List<String>} */
    private String flags;

    private int flagCount;

    private long flagsVersion;

    private LocalDateTime updatedAt;
}
