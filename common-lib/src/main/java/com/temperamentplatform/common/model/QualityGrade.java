package com.temperamentplatform.common.model;

import java.util.Locale;

/**
 * Ordered quality grade of a single caregiving interaction.
 *
 * <p>Ordinal scores run {@code POOR=1 … EXCELLENT=4} and feed the quality trend.
 */
public enum QualityGrade {

    POOR(1),
    FAIR(2),
    GOOD(3),
    EXCELLENT(4);

    private final int score;

    QualityGrade(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    /**
     * Lenient parse used by the store adapters. Unknown or null values map to {@link #FAIR},
     * the neutral grade.
     */
    public static QualityGrade fromString(String value) {
        if (value == null) return FAIR;
        try {
            return QualityGrade.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FAIR;
        }
    }
}
