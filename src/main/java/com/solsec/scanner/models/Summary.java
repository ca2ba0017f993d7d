package com.solsec.scanner.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Сводка по критичности. total всегда равен сумме шести счетчиков.
 */
@Value
@Builder
@Jacksonized
public class Summary {
    int total;
    int critical;
    int high;
    int medium;
    int low;
    int informational;
    int optimization;

    public static Summary empty() {
        return Summary.builder().build();
    }

    /**
     * Подсчет за один проход. Находки с нераспознанной критичностью не попадают ни в одну корзину.
     */
    public static Summary of(List<Finding> findings) {
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        int informational = 0;
        int optimization = 0;

        if (findings != null) {
            for (Finding finding : findings) {
                if (finding == null || finding.getSeverity() == null) {
                    continue;
                }
                switch (finding.getSeverity()) {
                    case CRITICAL -> critical++;
                    case HIGH -> high++;
                    case MEDIUM -> medium++;
                    case LOW -> low++;
                    case INFORMATIONAL -> informational++;
                    case OPTIMIZATION -> optimization++;
                }
            }
        }

        return Summary.builder()
            .total(critical + high + medium + low + informational + optimization)
            .critical(critical)
            .high(high)
            .medium(medium)
            .low(low)
            .informational(informational)
            .optimization(optimization)
            .build();
    }

    /**
     * Количество находок заданной критичности
     */
    public int countOf(Severity severity) {
        if (severity == null) {
            return 0;
        }
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case INFORMATIONAL -> informational;
            case OPTIMIZATION -> optimization;
        };
    }
}
