package com.solsec.scanner.integration;

import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Grade;
import com.solsec.scanner.models.Severity;
import com.solsec.scanner.models.Summary;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для CICDIntegration
 */
class CICDIntegrationTest {

    private static Finding finding(Severity severity, String title, Integer... lines) {
        return Finding.builder()
            .id("F-" + title)
            .check("test-check")
            .title(title)
            .severity(severity)
            .file("contracts/Token.sol")
            .lines(Arrays.asList(lines))
            .build();
    }

    private static AnalysisReport report(Finding... findings) {
        List<Finding> list = List.of(findings);
        return AnalysisReport.builder()
            .target("contracts")
            .generatedAt(Instant.parse("2026-01-01T00:00:00Z"))
            .summary(Summary.of(list))
            .findings(list)
            .build()
            .withAssessment(23, Grade.B, Grade.B.getVerdict());
    }

    private static String capture(java.util.function.Consumer<PrintStream> action) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        action.accept(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testParseThreshold() {
        assertEquals(Severity.HIGH, CICDIntegration.parseThreshold("high"));
        assertEquals(Severity.CRITICAL, CICDIntegration.parseThreshold("CRITICAL"));
        assertNull(CICDIntegration.parseThreshold("none"));
        assertNull(CICDIntegration.parseThreshold(null));
        assertThrows(IllegalArgumentException.class, () -> CICDIntegration.parseThreshold("severe"));
    }

    @Test
    void testExitCodeRespectsThreshold() {
        AnalysisReport report = report(finding(Severity.MEDIUM, "m", 3), finding(Severity.LOW, "l", 4));

        assertEquals(0, CICDIntegration.getExitCode(report, Severity.HIGH));
        assertEquals(1, CICDIntegration.getExitCode(report, Severity.MEDIUM));
        assertEquals(0, CICDIntegration.getExitCode(report, null));
        assertEquals(0, CICDIntegration.getExitCode(null, Severity.LOW));
    }

    @Test
    void testUnrecognizedSeverityNeverFailsBuild() {
        AnalysisReport report = report(finding(null, "unknown", 1));

        assertEquals(0, CICDIntegration.getExitCode(report, Severity.OPTIMIZATION));
        assertEquals(0, report.getSummary().getTotal());
    }

    @Test
    void testCISummaryReportsFailures() {
        AnalysisReport report = report(finding(Severity.HIGH, "h", 7), finding(Severity.CRITICAL, "c", 2));

        String output = capture(out -> CICDIntegration.printCISummary(report, Severity.HIGH, out));

        assertTrue(output.contains("Grade: B   Score: 23/100"));
        assertTrue(output.contains("Total: 2 findings"));
        assertTrue(output.contains("FAIL: 2 finding(s) at High severity or above"));
    }

    @Test
    void testGitHubAnnotations() {
        AnalysisReport report = report(
            finding(Severity.CRITICAL, "Missing Access Control on mint()", 12),
            finding(Severity.MEDIUM, "medium"),
            finding(Severity.LOW, "low", 30, 31));

        String[] lines = capture(out -> CICDIntegration.printGitHubAnnotations(report, out)).split("\\R");

        assertEquals(3, lines.length);
        assertEquals("::error file=contracts/Token.sol,line=12,title=test-check::Missing Access Control on mint()", lines[0]);
        assertEquals("::warning file=contracts/Token.sol,title=test-check::medium", lines[1]);
        assertTrue(lines[2].startsWith("::notice file=contracts/Token.sol,line=30"));
    }
}
