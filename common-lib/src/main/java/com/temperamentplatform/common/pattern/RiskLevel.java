package com.temperamentplatform.common.pattern;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}
