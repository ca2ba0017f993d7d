package com.solsec.scanner.core;

import com.solsec.scanner.util.SourceFiles;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Проверка цели анализа до запуска детекторов
 */
@Slf4j
public class TargetValidator {

    private final String sourceExtension;

    public TargetValidator(String sourceExtension) {
        this.sourceExtension = sourceExtension;
    }

    /**
     * Директория принимается всегда, обычный файл - только с исходным расширением.
     *
     * @throws TargetValidationException если цель не существует, не читается или неверного типа
     */
    public void validate(Path target) {
        if (target == null) {
            throw new TargetValidationException("Цель анализа не указана");
        }
        if (!Files.exists(target)) {
            throw new TargetValidationException("Цель не найдена: " + target);
        }
        if (!Files.isReadable(target)) {
            throw new TargetValidationException("Нет доступа к цели: " + target);
        }
        if (Files.isDirectory(target)) {
            return;
        }
        if (!Files.isRegularFile(target)) {
            throw new TargetValidationException("Цель должна быть файлом или директорией: " + target);
        }
        if (!SourceFiles.hasExtension(target, sourceExtension)) {
            throw new TargetValidationException(String.format(
                "Цель должна быть файлом %s или директорией, получено: %s", sourceExtension, target));
        }
        log.debug("Цель {} прошла проверку", target);
    }
}
