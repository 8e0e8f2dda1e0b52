package com.vidnyan.govern.domain.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a fired rule contributes to its policy result.
 */
public enum RuleAction {
    DENY,
    WARN,
    REQUIRE_APPROVAL,
    NOTIFY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleAction fromWire(String value) {
        if (value == null) return null;
        return RuleAction.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
