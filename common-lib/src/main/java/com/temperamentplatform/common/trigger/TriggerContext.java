package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.pattern.PatternMetrics;

/**
 * Inputs visible to a {@link TriggerPredicate}.
 */
public record TriggerContext(
    FlagDefinition definition,
    SubjectState subject,
    PatternMetrics metrics
) {}
