package com.vidnyan.govern.domain.compliance;

/**
 * Letter grade for a 0-100 compliance score.
 */
public enum Grade {
    A(90),
    B(80),
    C(70),
    D(60),
    F(0);

    private final int minimumScore;

    Grade(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    public int minimumScore() {
        return minimumScore;
    }

    public static Grade fromScore(int score) {
        for (Grade grade : values()) {
            if (score >= grade.minimumScore) {
                return grade;
            }
        }
        return F;
    }
}
