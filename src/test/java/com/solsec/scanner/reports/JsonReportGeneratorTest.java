package com.solsec.scanner.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solsec.scanner.models.AnalysisReport;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Grade;
import com.solsec.scanner.models.Severity;
import com.solsec.scanner.models.Summary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для JsonReportGenerator
 */
class JsonReportGeneratorTest {

    @TempDir
    Path tempDir;

    private final JsonReportGenerator generator = new JsonReportGenerator();

    private static AnalysisReport sampleReport() {
        Finding finding = Finding.builder()
            .id("HEURISTIC-ACCESS-1")
            .source(Finding.SOURCE_HEURISTIC)
            .check("missing-access-control")
            .title("Missing Access Control on mint()")
            .severity(Severity.CRITICAL)
            .file("contracts/Token.sol")
            .lines(List.of(12))
            .swcRef("SWC-105")
            .build();
        List<Finding> findings = List.of(finding);
        return AnalysisReport.builder()
            .target("contracts")
            .generatedAt(Instant.parse("2026-02-03T04:05:06Z"))
            .summary(Summary.of(findings))
            .findings(findings)
            .build()
            .withAssessment(40, Grade.C, Grade.C.getVerdict());
    }

    @Test
    void testGenerateWritesReportFile() throws IOException {
        Path output = tempDir.resolve("out/nested/report.json");

        generator.generate(sampleReport(), output);

        assertTrue(Files.exists(output), "родительские директории создаются");
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("contracts", root.get("target").asText());
        assertEquals("2026-02-03T04:05:06Z", root.get("generated_at").asText());
        assertEquals(40, root.get("risk_score").asInt());
        assertEquals("C", root.get("grade").asText());
        assertEquals(1, root.get("summary").get("total").asInt());
        assertEquals(1, root.get("summary").get("critical").asInt());
        assertEquals("SWC-105", root.get("findings").get(0).get("swc_ref").asText());
        assertEquals("Critical", root.get("findings").get(0).get("severity").asText());
        assertFalse(root.get("findings").get(0).has("firstLine"));
    }

    @Test
    void testUnassessedReportOmitsScore() throws IOException {
        AnalysisReport report = AnalysisReport.builder()
            .target("a.sol")
            .generatedAt(Instant.parse("2026-02-03T04:05:06Z"))
            .summary(Summary.empty())
            .findings(List.of())
            .build();

        JsonNode root = new ObjectMapper().readTree(generator.toJson(report));

        assertFalse(root.has("risk_score"));
        assertFalse(root.has("assessed"));
        assertEquals(0, root.get("findings").size());
    }

    @Test
    void testNullReportRejected() {
        assertThrows(IllegalArgumentException.class, () -> generator.toJson(null));
        assertEquals("json", generator.getFileExtension());
    }
}
