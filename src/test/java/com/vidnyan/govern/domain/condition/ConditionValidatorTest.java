package com.vidnyan.govern.domain.condition;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.vidnyan.govern.domain.condition.Condition.*;
import static org.junit.jupiter.api.Assertions.*;

class ConditionValidatorTest {

    @Test
    void validate_ShouldAcceptWellFormedTree() {
        Condition condition = allOf(
                fieldMatches("resource.name", "^prod-"),
                anyOf(tagMissing("owner"), not(fieldGt("cost.delta", 10))));

        assertTrue(ConditionValidator.validate(condition, "rule").isEmpty());
    }

    @Test
    void validate_ShouldRejectInvalidRegex() {
        List<String> problems = ConditionValidator.validate(fieldMatches("resource.name", "([bad"), "rule");

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("invalid pattern"));
    }

    @Test
    void validate_ShouldReportPathOfNestedProblems() {
        Condition condition = allOf(fieldEquals("resource.id", "x"), anyOf(fieldExists(" ")));

        List<String> problems = ConditionValidator.validate(condition, "rules[0].condition");

        assertEquals(List.of("rules[0].condition.and[1].or[0]: 'field' is required"), problems);
    }

    @Test
    void validate_ShouldRejectEmptyCombinatorsAndNullChildren() {
        assertFalse(ConditionValidator.validate(new Condition.Or(List.of()), "c").isEmpty());
        assertFalse(ConditionValidator.validate(new Condition.And(Arrays.asList((Condition) null)), "c").isEmpty());
        assertFalse(ConditionValidator.validate(null, "c").isEmpty());
        assertFalse(ConditionValidator.validate(custom(" ", null), "c").isEmpty());
    }
}
