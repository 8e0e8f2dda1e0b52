package com.vidnyan.govern.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ViolationStatus {
    OPEN,
    WAIVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ViolationStatus fromWire(String value) {
        if (value == null) return null;
        return ViolationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
