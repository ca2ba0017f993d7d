package com.solsec.scanner.integration;

import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Severity;
import com.solsec.scanner.models.Summary;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {

    public static final String THRESHOLD_NONE = "none";

    private CICDIntegration() {
    }

    /**
     * Разобрать порог --fail-on. "none" и null означают "без порога" (null).
     *
     * @throws IllegalArgumentException для неизвестного уровня
     */
    public static Severity parseThreshold(String failOn) {
        if (failOn == null || failOn.isBlank() || failOn.trim().equalsIgnoreCase(THRESHOLD_NONE)) {
            return null;
        }
        Severity threshold = Severity.fromLabel(failOn);
        if (threshold == null) {
            throw new IllegalArgumentException("Неизвестный уровень --fail-on: " + failOn
                + " (ожидается critical|high|medium|low|informational|optimization|none)");
        }
        return threshold;
    }

    /**
     * Количество находок на уровне порога или выше
     */
    public static int countAtOrAbove(List<Finding> findings, Severity threshold) {
        if (findings == null || threshold == null) {
            return 0;
        }
        return (int) findings.stream()
            .filter(f -> f != null && Severity.isAtOrAbove(f.getSeverity(), threshold))
            .count();
    }

    /**
     * Определить exit code на основе результатов анализа
     *
     * @param report результат анализа
     * @param threshold порог критичности, null = не проваливать сборку
     * @return exit code (0 = успех, 1 = провал)
     */
    public static int getExitCode(AnalysisReport report, Severity threshold) {
        if (report == null) {
            log.warn("Отчет null, возвращаем код успеха");
            return 0;
        }
        if (threshold == null) {
            return 0;
        }

        int count = countAtOrAbove(report.getFindings(), threshold);
        if (count > 0) {
            log.error("Обнаружено {} находок уровня {} и выше. Сборка провалена.", count, threshold.getLabel());
            return 1;
        }

        log.info("Находок уровня {} и выше не обнаружено", threshold.getLabel());
        return 0;
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(AnalysisReport report, Severity threshold, PrintStream out) {
        if (report == null) {
            log.warn("Отчет null, пропускаем вывод");
            return;
        }

        Summary summary = report.getSummary() != null ? report.getSummary() : Summary.empty();
        out.println("\n=== Smart Contract Security Summary ===");
        out.println("Target: " + report.getTarget());
        out.println("Generated: " + report.getGeneratedAt());
        if (report.isAssessed()) {
            out.println("Grade: " + report.getGrade() + "   Score: " + report.getRiskScore() + "/100");
        }
        out.println("\nFindings:");
        for (Severity severity : Severity.values()) {
            out.printf("  %-14s %d%n", severity.getLabel().toUpperCase(Locale.ROOT) + ":", summary.countOf(severity));
        }
        out.println("\nTotal: " + summary.getTotal() + " findings");

        if (threshold != null) {
            int failing = countAtOrAbove(report.getFindings(), threshold);
            if (failing > 0) {
                out.printf("FAIL: %d finding(s) at %s severity or above%n", failing, threshold.getLabel());
            }
        }
        out.println("=======================================\n");
    }

    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(AnalysisReport report, PrintStream out) {
        if (report == null || report.getFindings() == null) {
            return;
        }

        for (Finding finding : report.getFindings()) {
            if (finding == null) continue;

            String level = switch (finding.getSeverity() != null ? finding.getSeverity() : Severity.INFORMATIONAL) {
                case CRITICAL, HIGH -> "error";
                case MEDIUM -> "warning";
                default -> "notice";
            };

            String file = finding.getFile() != null ? finding.getFile() : "N/A";
            Integer line = finding.getFirstLine();
            String location = line != null ? "file=" + file + ",line=" + line : "file=" + file;
            String title = finding.getTitle() != null ? finding.getTitle() : "Finding";

            out.printf("::%s %s,title=%s::%s%n", level, location, finding.getCheck(), title);
        }
    }
}
