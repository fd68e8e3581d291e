package com.temperamentplatform.common.trigger;

/**
 * Flag-specific trigger rule.
 *
 * <p>Implementations must be pure: the same context always yields the same outcome.
 */
@FunctionalInterface
public interface TriggerPredicate {

    RuleOutcome evaluate(TriggerContext context);
}
