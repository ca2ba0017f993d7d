package com.solsec.scanner.cli;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.core.ConsolidationResult;
import com.solsec.scanner.core.ExternalFindingsLoader;
import com.solsec.scanner.core.FindingConsolidator;
import com.solsec.scanner.core.TargetValidationException;
import com.solsec.scanner.integration.CICDIntegration;
import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Severity;
import com.solsec.scanner.models.Summary;
import com.solsec.scanner.reports.JsonReportGenerator;
import com.solsec.scanner.scoring.RiskScorer;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Анализ контракта или директории: эвристики + внешние находки → отчет с оценкой риска
 */
@Slf4j
@Command(
    name = "analyze",
    mixinStandardHelpOptions = true,
    description = """
        Анализ Solidity файла или директории.

        Примеры:
          solsec analyze ./contracts/Token.sol
          solsec analyze ./contracts --findings slither-findings.json --output report.json
          solsec analyze ./contracts --fail-on high --ci
        """
)
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        description = "Путь к .sol файлу или директории"
    )
    private Path target;

    @Option(
        names = {"-f", "--findings"},
        description = "JSON файл с находками внешнего анализатора (в едином формате)"
    )
    private Path findingsFile;

    @Option(
        names = {"-o", "--output"},
        description = "Путь JSON отчета (по умолчанию: solsec-report.json)"
    )
    private Path output = Path.of("solsec-report.json");

    @Option(
        names = {"--fail-on"},
        description = "Exit code 1 при находках этого уровня и выше: critical | high | medium | low | none (по умолчанию: high)"
    )
    private String failOn = "high";

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    @Option(
        names = {"--github-annotations"},
        description = "Вывести аннотации GitHub Actions для каждой находки"
    )
    private boolean githubAnnotations = false;

    @Override
    public Integer call() {
        Severity threshold;
        try {
            threshold = CICDIntegration.parseThreshold(failOn);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return MainCommand.EXIT_INPUT_ERROR;
        }

        try {
            ScannerConfig config = ScannerConfig.load();

            List<Finding> external = List.of();
            if (findingsFile != null) {
                external = new ExternalFindingsLoader().load(findingsFile);
            }

            if (!ciMode) {
                System.out.println("Анализ: " + target);
            }

            FindingConsolidator consolidator = new FindingConsolidator(config);
            ConsolidationResult result = consolidator.consolidate(target, external);

            // Упавший детектор не останавливает анализ, но пользователь должен об этом знать
            for (String warning : result.getWarnings()) {
                System.err.println("WARNING: " + warning);
            }

            AnalysisReport report = new RiskScorer(config).assess(result.getReport());

            new JsonReportGenerator().generate(report, output);

            if (ciMode) {
                CICDIntegration.printCISummary(report, threshold, System.out);
            } else {
                printSummary(report);
            }
            if (githubAnnotations) {
                CICDIntegration.printGitHubAnnotations(report, System.out);
            }

            return CICDIntegration.getExitCode(report, threshold) == 0
                ? MainCommand.EXIT_OK
                : MainCommand.EXIT_FINDINGS;

        } catch (TargetValidationException e) {
            log.error("Ошибка цели анализа: {}", e.getMessage());
            return MainCommand.EXIT_INPUT_ERROR;
        } catch (IOException e) {
            log.error("Ошибка ввода-вывода: {}", e.getMessage(), e);
            return MainCommand.EXIT_INPUT_ERROR;
        }
    }

    private void printSummary(AnalysisReport report) {
        Summary summary = report.getSummary();
        String rule = "─".repeat(60);
        System.out.println();
        System.out.println(rule);
        System.out.printf("  Grade: %s   Score: %d/100%n", report.getGrade(), report.getRiskScore());
        System.out.println("  " + report.getVerdict());
        System.out.printf("  Findings: %d total (%d critical, %d high, %d medium, %d low)%n",
            summary.getTotal(),
            summary.getCritical(),
            summary.getHigh(),
            summary.getMedium(),
            summary.getLow());
        System.out.println("  Report: " + output);
        System.out.println(rule);
        System.out.println();
    }
}
