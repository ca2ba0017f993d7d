package com.solsec.scanner.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Перечисление исходных файлов цели анализа
 */
@Slf4j
public final class SourceFiles {

    private SourceFiles() {
    }

    /**
     * Если target - файл, возвращает его; если директория - рекурсивно все файлы с расширением extension.
     * Порядок детерминирован (лексикографический по пути).
     *
     * @throws NoSuchFileException если target не существует
     * @throws IOException при ошибке обхода директории
     */
    public static List<Path> list(Path target, String extension) throws IOException {
        if (target == null) {
            throw new IllegalArgumentException("target не может быть null");
        }
        if (!Files.exists(target)) {
            throw new NoSuchFileException(target.toString());
        }
        if (!Files.isDirectory(target)) {
            return List.of(target);
        }

        try (Stream<Path> stream = Files.walk(target)) {
            List<Path> files = stream
                .filter(Files::isRegularFile)
                .filter(path -> hasExtension(path, extension))
                .sorted()
                .collect(Collectors.toList());
            log.debug("В {} найдено {} исходных файлов", target, files.size());
            return files;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public static boolean hasExtension(Path path, String extension) {
        if (path == null || path.getFileName() == null || extension == null) {
            return false;
        }
        return path.getFileName().toString().toLowerCase(Locale.ROOT)
            .endsWith(extension.toLowerCase(Locale.ROOT));
    }
}
