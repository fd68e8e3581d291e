package com.temperamentplatform.common.pattern;

public enum CriticalPeriodType {
    STRESS_SPIKE,
    BONDING_FAILURE
}
