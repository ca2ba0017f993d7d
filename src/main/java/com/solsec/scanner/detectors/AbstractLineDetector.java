package com.solsec.scanner.detectors;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.util.SourceFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Базовый построчный детектор: один проход по каждому файлу, без возвратов.
 * Состояние прохода живет в {@link FileScan} и не разделяется между файлами.
 */
@Slf4j
public abstract class AbstractLineDetector implements PatternDetector {

    /** UTF-8 BOM: trim() его не убирает */
    private static final String BOM = "\uFEFF";

    protected final ScannerConfig config;

    protected AbstractLineDetector(ScannerConfig config) {
        this.config = config != null ? config : ScannerConfig.load();
    }

    @Override
    public List<Finding> scan(Path target) throws IOException {
        List<Path> files = SourceFiles.list(target, config.getSourceExtension());
        log.debug("Запуск детектора {} ({} файлов)", getName(), files.size());

        IdSequence ids = new IdSequence(idPrefix());
        List<Finding> findings = new ArrayList<>();
        for (Path file : files) {
            findings.addAll(scanFile(file, ids));
        }

        log.debug("Детектор {} завершен. Найдено: {}", getName(), findings.size());
        return findings;
    }

    /**
     * Просканировать один файл. Некорректный текст (в т.ч. битая кодировка) не является ошибкой.
     */
    protected List<Finding> scanFile(Path file, IdSequence ids) throws IOException {
        FileScan scan = newFileScan(file.toString(), ids);
        // InputStreamReader заменяет некорректные байты, а не бросает исключение
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith(BOM)) {
                    line = line.substring(1);
                }
                scan.onLine(lineNumber, line.trim());
            }
        }
        return scan.getFindings();
    }

    /**
     * Префикс идентификаторов находок, например "HEURISTIC-ACCESS"
     */
    protected abstract String idPrefix();

    protected abstract FileScan newFileScan(String file, IdSequence ids);

    /**
     * Состояние прохода по одному файлу
     */
    protected abstract static class FileScan {

        protected final String file;
        protected final IdSequence ids;
        private final List<Finding> findings = new ArrayList<>();

        protected FileScan(String file, IdSequence ids) {
            this.file = file;
            this.ids = ids;
        }

        /**
         * @param lineNumber номер строки (с 1)
         * @param trimmed строка без ведущих и хвостовых пробелов
         */
        protected abstract void onLine(int lineNumber, String trimmed);

        protected void report(Finding finding) {
            findings.add(finding);
        }

        List<Finding> getFindings() {
            return findings;
        }
    }

    /**
     * Нумерация находок в пределах одного запуска детектора
     */
    protected static final class IdSequence {
        private final String defaultPrefix;
        private final Map<String, Integer> counters = new HashMap<>();

        IdSequence(String defaultPrefix) {
            this.defaultPrefix = defaultPrefix;
        }

        public String next() {
            return next(defaultPrefix);
        }

        public String next(String prefix) {
            int value = counters.merge(prefix, 1, Integer::sum);
            return prefix + "-" + value;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Общие текстовые признаки
    // ═══════════════════════════════════════════════════════════════

    static boolean isComment(String trimmed) {
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }

    /**
     * Граница конструкции: строка, состоящая только из закрывающей скобки.
     * Вложенность не учитывается.
     */
    static boolean isClosingBrace(String trimmed) {
        return trimmed.equals("}");
    }

    static boolean containsAny(String line, List<String> patterns) {
        return firstMatch(line, patterns) != null;
    }

    static String firstMatch(String line, List<String> patterns) {
        for (String pattern : patterns) {
            if (line.contains(pattern)) {
                return pattern;
            }
        }
        return null;
    }

    /**
     * "function transfer(address to, uint256 amount)" → "transfer"
     */
    static String extractFunctionName(String line) {
        int idx = line.indexOf("function ");
        if (idx < 0) {
            return "";
        }
        String rest = line.substring(idx + "function ".length()).trim();
        int end = 0;
        while (end < rest.length() && rest.charAt(end) != '(' && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        return rest.substring(0, end);
    }
}
