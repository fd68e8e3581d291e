package com.temperamentplatform.common.pattern;

public enum NeglectSeverity {
    MINIMAL,
    MODERATE,
    SEVERE
}
