package com.vidnyan.govern.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a policy or control, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null) return null;
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL", "BLOCKER" -> CRITICAL;
            case "HIGH", "ERROR" -> HIGH;
            case "MEDIUM", "WARN", "WARNING" -> MEDIUM;
            case "LOW" -> LOW;
            case "INFO" -> INFO;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }

    /**
     * True when this severity is at least as severe as {@code threshold}.
     */
    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) <= 0;
    }
}
