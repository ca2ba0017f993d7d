package com.solsec.scanner.core;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.detectors.AccessControlDetector;
import com.solsec.scanner.detectors.IntegerOverflowDetector;
import com.solsec.scanner.detectors.PatternDetector;
import com.solsec.scanner.detectors.ReentrancyDetector;
import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Summary;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Главный движок анализа.
 * Запускает эвристические детекторы, объединяет их находки с внешними,
 * удаляет дубликаты, сортирует и строит отчет.
 */
@Slf4j
public class FindingConsolidator {

    /**
     * Порядок сортировки: ранг критичности по возрастанию, затем путь файла.
     * Сортировка стабильна, остальной порядок сохраняется после дедупликации.
     */
    public static final Comparator<Finding> SEVERITY_THEN_FILE = Comparator
        .comparingInt(Finding::getSeverityRank)
        .thenComparing(finding -> finding.getFile() != null ? finding.getFile() : "");

    private final List<PatternDetector> detectors;
    private final TargetValidator targetValidator;
    private final Clock clock;

    public FindingConsolidator() {
        this(ScannerConfig.load());
    }

    public FindingConsolidator(ScannerConfig config) {
        this(defaultDetectors(config), new TargetValidator(config.getSourceExtension()), Clock.systemUTC());
    }

    public FindingConsolidator(List<PatternDetector> detectors, TargetValidator targetValidator, Clock clock) {
        this.detectors = List.copyOf(detectors);
        this.targetValidator = targetValidator;
        this.clock = clock;
    }

    /**
     * Детекторы в фиксированном порядке: reentrancy, access-control, integer-overflow
     */
    public static List<PatternDetector> defaultDetectors(ScannerConfig config) {
        List<PatternDetector> list = new ArrayList<>();
        list.add(new ReentrancyDetector(config));
        list.add(new AccessControlDetector(config));
        list.add(new IntegerOverflowDetector(config));
        return list;
    }

    public List<PatternDetector> getDetectors() {
        return detectors;
    }

    /**
     * Запустить анализ цели
     *
     * @param target файл или директория с исходниками
     * @param externalFindings находки внешнего анализатора (уже в едином формате), могут быть null
     * @throws TargetValidationException если цель недоступна; частичный отчет не строится
     */
    public ConsolidationResult consolidate(Path target, List<Finding> externalFindings) {
        targetValidator.validate(target);

        log.info("=== Начало анализа: {} ===", target);
        long startTime = System.currentTimeMillis();

        List<Finding> allFindings = new ArrayList<>();
        if (externalFindings != null) {
            for (Finding finding : externalFindings) {
                if (finding != null) {
                    allFindings.add(finding);
                }
            }
        }
        log.debug("Внешних находок: {}", allFindings.size());

        List<DetectorOutcome> outcomes = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            DetectorOutcome outcome = runDetector(detector, target);
            outcomes.add(outcome);
            allFindings.addAll(outcome.findings());
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        if (failed > 0) {
            log.warn("Количество упавших детекторов: {}", failed);
        }

        List<Finding> deduplicated = deduplicate(allFindings);
        int duplicatesRemoved = allFindings.size() - deduplicated.size();
        if (duplicatesRemoved > 0) {
            log.info("Удалено {} дубликатов. Было: {}, стало: {}",
                duplicatesRemoved, allFindings.size(), deduplicated.size());
        }

        List<Finding> sorted = sort(deduplicated);

        AnalysisReport report = AnalysisReport.builder()
            .target(target.toString())
            .generatedAt(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS))
            .summary(Summary.of(sorted))
            .findings(Collections.unmodifiableList(sorted))
            .build();

        log.info("=== Анализ завершен за {} мс. Всего находок: {} ===",
            System.currentTimeMillis() - startTime, report.getSummary().getTotal());

        return ConsolidationResult.builder()
            .report(report)
            .outcomes(List.copyOf(outcomes))
            .duplicatesRemoved(duplicatesRemoved)
            .build();
    }

    private DetectorOutcome runDetector(PatternDetector detector, Path target) {
        String name = detector.getName();
        try {
            log.debug("Запуск детектора: {}", name);
            List<Finding> findings = detector.scan(target);
            if (findings == null) {
                log.warn("{} вернул null вместо списка находок!", name);
                return DetectorOutcome.success(name, List.of());
            }
            log.debug("{} завершен. Найдено: {}", name, findings.size());
            return DetectorOutcome.success(name, findings);
        } catch (Exception e) {
            // Ошибка детектора не фатальна: анализ продолжается без его вклада
            DetectorOutcome outcome = DetectorOutcome.failure(name, e);
            log.warn("{}", outcome.describeError(), e);
            return outcome;
        }
    }

    /**
     * Дедупликация по ключу swcRef + file + первая строка.
     * Побеждает первая находка с данным ключом (внешние идут раньше эвристических).
     * Пустой swcRef тоже образует ключ.
     */
    public static List<Finding> deduplicate(List<Finding> findings) {
        Set<String> seen = new HashSet<>();
        List<Finding> result = new ArrayList<>();
        if (findings == null) {
            return result;
        }
        for (Finding finding : findings) {
            if (finding == null) {
                continue;
            }
            if (seen.add(deduplicationKey(finding))) {
                result.add(finding);
            }
        }
        return result;
    }

    public static String deduplicationKey(Finding finding) {
        String swcRef = finding.getSwcRef() != null ? finding.getSwcRef() : "";
        String file = finding.getFile() != null ? finding.getFile() : "";
        String key = swcRef + "|" + file;
        Integer firstLine = finding.getFirstLine();
        if (firstLine != null) {
            key += "|" + firstLine;
        }
        return key;
    }

    /**
     * Стабильная сортировка: самые критичные первыми, при равенстве - по пути файла
     */
    public static List<Finding> sort(List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(SEVERITY_THEN_FILE);
        return sorted;
    }
}
