package com.skillpulse.processing.trend;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendClassification {
    RISING,
    STABLE,
    DECLINING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
