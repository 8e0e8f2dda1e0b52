package com.vidnyan.govern.domain.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of one control within a compliance scan.
 */
public enum ControlStatus {
    PASSED,
    FAILED,
    WAIVED,
    NOT_APPLICABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
