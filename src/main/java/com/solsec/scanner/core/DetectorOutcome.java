package com.solsec.scanner.core;

import com.solsec.scanner.models.Finding;

import java.util.List;

/**
 * Результат одного детектора: либо находки, либо ошибка
 */
public record DetectorOutcome(String detectorName, List<Finding> findings, Exception error) {

    public static DetectorOutcome success(String detectorName, List<Finding> findings) {
        return new DetectorOutcome(detectorName, List.copyOf(findings), null);
    }

    public static DetectorOutcome failure(String detectorName, Exception error) {
        return new DetectorOutcome(detectorName, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Текст предупреждения для пользователя
     */
    public String describeError() {
        if (error == null) {
            return "";
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return String.format("Детектор '%s' пропущен: %s", detectorName, message);
    }
}
