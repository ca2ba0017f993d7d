package com.solsec.scanner.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Итоговый отчет анализа. Строится один раз, далее не изменяется.
 * Оценка риска (score/grade/verdict) прикрепляется через {@link #withAssessment}, которая возвращает новый экземпляр.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"target", "generated_at", "summary", "risk_score", "grade", "verdict", "findings"})
public class AnalysisReport {

    String target;

    @JsonProperty("generated_at")
    Instant generatedAt;   // UTC, с точностью до секунды

    Summary summary;

    List<Finding> findings;

    @JsonProperty("risk_score")
    Integer riskScore;

    Grade grade;

    String verdict;

    public AnalysisReport withAssessment(int score, Grade grade, String verdict) {
        return toBuilder()
            .riskScore(score)
            .grade(grade)
            .verdict(verdict)
            .build();
    }

    @JsonIgnore
    public boolean isAssessed() {
        return riskScore != null;
    }
}
