package com.solsec.scanner.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности находок.
 * Порядок объявления = ранг: CRITICAL самый критичный (0), OPTIMIZATION наименее (5).
 */
public enum Severity {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    INFORMATIONAL("Informational"),
    OPTIMIZATION("Optimization");

    /**
     * Ранг для нераспознанной (или отсутствующей) критичности
     */
    public static final int UNRECOGNIZED_RANK = 6;

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return ordinal();
    }

    /**
     * Ранг критичности с учетом null: нераспознанное значение всегда последнее,
     * поэтому оно не может замаскировать распознанную критичность при сравнении с порогом.
     */
    public static int rankOf(Severity severity) {
        return severity != null ? severity.getRank() : UNRECOGNIZED_RANK;
    }

    /**
     * true если severity на уровне порога или выше (rank <= rank порога)
     */
    public static boolean isAtOrAbove(Severity severity, Severity threshold) {
        return rankOf(severity) <= rankOf(threshold);
    }

    /**
     * Разбор строки без учета регистра ("high", "High", "HIGH").
     * Для неизвестных значений возвращает null (ранг 6).
     */
    @JsonCreator
    public static Severity fromLabel(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return severity;
            }
        }
        // Сокращения, которые встречаются во внешних инструментах
        if (normalized.equals("info")) {
            return INFORMATIONAL;
        }
        return null;
    }
}
