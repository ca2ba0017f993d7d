package com.solsec.scanner.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.solsec.scanner.models.AnalysisReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        // generated_at в ISO-8601 (2024-01-01T00:00:00Z), а не числом
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(AnalysisReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        String json = toJson(report);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    public String toJson(AnalysisReport report) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }
        return objectMapper.writeValueAsString(report);
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
