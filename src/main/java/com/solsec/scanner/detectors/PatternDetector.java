package com.solsec.scanner.detectors;

import com.solsec.scanner.models.Finding;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Интерфейс эвристического детектора
 */
public interface PatternDetector {

    /**
     * Короткое имя детектора (для логов и отчета об ошибках)
     */
    String getName();

    /**
     * Просканировать файл или директорию
     *
     * @param target исходный файл или директория
     * @return найденные проблемы в порядке обнаружения
     * @throws IOException если цель недоступна или файл не читается
     */
    List<Finding> scan(Path target) throws IOException;
}
