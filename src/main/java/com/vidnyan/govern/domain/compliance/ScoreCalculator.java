package com.vidnyan.govern.domain.compliance;

import java.util.List;

/**
 * Score and grade arithmetic for compliance reports.
 */
public final class ScoreCalculator {

    private ScoreCalculator() {
    }

    /**
     * {@code round(passed / applicable * 100)}, half up; 100 when nothing applies.
     * Waived controls are reported separately and do not raise the score.
     */
    public static int score(int passed, int applicable) {
        if (applicable <= 0) {
            return 100;
        }
        return (int) Math.round(passed * 100.0 / applicable);
    }

    public static Grade grade(int score) {
        return Grade.fromScore(score);
    }

    /**
     * Trend points in the order the reports are given.
     */
    public static List<TrendPoint> trend(List<ComplianceReport> reports) {
        return reports.stream()
                .map(r -> new TrendPoint(r.generatedAt(), r.score(), (int) r.openViolations()))
                .toList();
    }
}
