package com.dcruver.clausedrift.domain;

import java.util.Locale;

/**
 * Risk bands in ascending order of severity. Ordinal is the rank.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(int score) {
        if (score >= 75) {
            return CRITICAL;
        } else if (score >= 50) {
            return HIGH;
        } else if (score >= 25) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isAtLeast(RiskLevel threshold) {
        return ordinal() >= threshold.ordinal();
    }

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
