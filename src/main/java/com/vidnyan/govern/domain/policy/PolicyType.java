package com.vidnyan.govern.domain.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of operation a policy gates.
 */
public enum PolicyType {
    PLAN,
    ACCESS,
    APPROVAL,
    NOTIFICATION,
    DRIFT,
    COST,
    DEPLOYMENT,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyType fromWire(String value) {
        if (value == null) return null;
        return PolicyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
