package com.temperamentplatform.common.assignment;

/**
 * Why the assignment engine did not append a flag.
 */
public enum SkipReason {
    ALREADY_ASSIGNED,
    CAPACITY_REACHED,
    CONFLICTS_WITH_CURRENT,
    CONFLICTS_WITH_NEW,
    NOT_TRIGGERED
}
