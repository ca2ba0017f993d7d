package com.solsec.scanner.core;

/**
 * Цель анализа отсутствует, недоступна или имеет неверный тип. Фатальна для всего анализа.
 */
public class TargetValidationException extends RuntimeException {

    public TargetValidationException(String message) {
        super(message);
    }

    public TargetValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
