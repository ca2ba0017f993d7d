package com.solsec.scanner.core;

import com.solsec.scanner.models.AnalysisReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Отчет плюс результаты отдельных детекторов
 */
@Value
@Builder
public class ConsolidationResult {
    AnalysisReport report;
    List<DetectorOutcome> outcomes;
    int duplicatesRemoved;

    public List<DetectorOutcome> getFailedDetectors() {
        return outcomes.stream()
            .filter(outcome -> !outcome.isSuccess())
            .collect(Collectors.toList());
    }

    /**
     * Предупреждения для пользователя о пропущенных детекторах
     */
    public List<String> getWarnings() {
        return getFailedDetectors().stream()
            .map(DetectorOutcome::describeError)
            .collect(Collectors.toList());
    }

    public boolean isPartial() {
        return !getFailedDetectors().isEmpty();
    }
}
