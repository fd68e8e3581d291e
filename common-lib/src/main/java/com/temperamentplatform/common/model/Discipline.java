package com.temperamentplatform.common.model;

/**
 * Competition disciplines that receive per-discipline flag bonuses and penalties.
 */
public enum Discipline {
    SHOW_JUMPING,
    DRESSAGE,
    RACING,
    CROSS_COUNTRY,
    ENDURANCE
}
