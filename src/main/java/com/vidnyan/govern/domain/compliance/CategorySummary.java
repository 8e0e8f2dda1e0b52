package com.vidnyan.govern.domain.compliance;

/**
 * Per-category control counts; waived controls count as passed.
 */
public record CategorySummary(int total, int passed, int failed) {

    CategorySummary add(boolean pass) {
        return new CategorySummary(total + 1, pass ? passed + 1 : passed, pass ? failed : failed + 1);
    }

    static CategorySummary empty() {
        return new CategorySummary(0, 0, 0);
    }
}
