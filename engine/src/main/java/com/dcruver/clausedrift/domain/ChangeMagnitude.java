package com.dcruver.clausedrift.domain;

public enum ChangeMagnitude {
    MINOR,
    MODERATE,
    MAJOR;

    public static ChangeMagnitude of(double similarity) {
        if (similarity >= 0.8) {
            return MINOR;
        } else if (similarity >= 0.5) {
            return MODERATE;
        }
        return MAJOR;
    }
}
