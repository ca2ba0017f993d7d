package com.solsec.scanner.models;

/**
 * Буквенная оценка риска по шкале 0-100 и рекомендация по деплою
 */
public enum Grade {
    A(0, "Low risk. Review findings before deployment."),
    B(10, "Minor issues found. Address before mainnet deployment."),
    C(25, "Moderate risk. Fix all Medium+ findings before deployment."),
    D(50, "High risk. Do not deploy until Critical/High findings are resolved."),
    F(75, "Critical risk. This contract must not be deployed.");

    private final int minScore;
    private final String verdict;

    Grade(int minScore, String verdict) {
        this.minScore = minScore;
        this.verdict = verdict;
    }

    /**
     * Нижняя граница диапазона (включительно)
     */
    public int getMinScore() {
        return minScore;
    }

    public String getVerdict() {
        return verdict;
    }
}
