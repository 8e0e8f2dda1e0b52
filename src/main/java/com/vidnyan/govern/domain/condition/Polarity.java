package com.vidnyan.govern.domain.condition;

/**
 * How a condition's truth value maps to a violation.
 */
public enum Polarity {
    /** Trigger mode: the condition describes the bad state. */
    VIOLATE_IF_TRUE,
    /** Assertion mode: the condition describes the required state. */
    PASS_IF_TRUE;

    public boolean violates(boolean conditionResult) {
        return this == VIOLATE_IF_TRUE ? conditionResult : !conditionResult;
    }
}
