package com.temperamentplatform.common.model;

/**
 * Whether a flag is categorized as a positive or a negative trait.
 */
public enum FlagValence {
    POSITIVE,
    NEGATIVE
}
