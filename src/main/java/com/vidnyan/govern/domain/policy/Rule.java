package com.vidnyan.govern.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.condition.Condition;

/**
 * Trigger-mode rule: the condition describes the bad state, and fires when true.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rule(
    String id,
    String description,
    Condition condition,
    RuleAction action,
    String message
) {}
