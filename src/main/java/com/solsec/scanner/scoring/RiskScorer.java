package com.solsec.scanner.scoring;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Grade;
import com.solsec.scanner.models.Severity;
import com.solsec.scanner.models.Summary;
import lombok.extern.slf4j.Slf4j;

/**
 * Итоговая оценка риска 0 (чисто) .. 100 (критично).
 *
 * Веса по умолчанию: Critical 40, High 20, Medium 10, Low 3, Informational/Optimization 0.
 * Сумма ограничивается сверху maxScore, но не больше 100. Все методы чистые.
 */
@Slf4j
public class RiskScorer {

    private final ScannerConfig.Scoring scoring;

    public RiskScorer() {
        this(ScannerConfig.load());
    }

    public RiskScorer(ScannerConfig config) {
        this.scoring = config.getScoring();
    }

    public int score(Summary summary) {
        if (summary == null) {
            return 0;
        }
        long total = 0;
        for (Severity severity : Severity.values()) {
            total += (long) summary.countOf(severity) * scoring.weightOf(severity);
        }
        int max = Math.min(scoring.getMaxScore(), ScannerConfig.MAX_SCORE);
        return (int) Math.min(total, max);
    }

    /**
     * A:[0,10) B:[10,25) C:[25,50) D:[50,75) F:[75,100]
     */
    public Grade grade(int score) {
        Grade result = Grade.A;
        for (Grade grade : Grade.values()) {
            if (score >= grade.getMinScore()) {
                result = grade;
            }
        }
        return result;
    }

    public String verdict(Grade grade) {
        return grade != null ? grade.getVerdict() : Grade.F.getVerdict();
    }

    /**
     * Прикрепить оценку к отчету (возвращает новый отчет)
     */
    public AnalysisReport assess(AnalysisReport report) {
        int score = score(report.getSummary());
        Grade grade = grade(score);
        log.info("Оценка риска: {}/100, grade {}", score, grade);
        return report.withAssessment(score, grade, verdict(grade));
    }
}
