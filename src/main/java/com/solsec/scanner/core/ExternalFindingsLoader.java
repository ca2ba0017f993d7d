package com.solsec.scanner.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solsec.scanner.models.Finding;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка находок внешнего анализатора, уже приведенных к единому формату (JSON массив).
 * Находки не валидируются и не исправляются; пустой source помечается как "external".
 */
@Slf4j
public class ExternalFindingsLoader {

    private final ObjectMapper objectMapper;

    public ExternalFindingsLoader() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    public List<Finding> load(Path path) throws IOException {
        log.info("Загрузка внешних находок: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            List<Finding> findings = load(is);
            log.info("Загружено {} внешних находок", findings.size());
            return findings;
        }
    }

    public List<Finding> load(InputStream is) throws IOException {
        List<Finding> raw = objectMapper.readValue(is, new TypeReference<List<Finding>>() {});
        List<Finding> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        for (Finding finding : raw) {
            if (finding == null) {
                continue;
            }
            if (finding.getSource() == null || finding.getSource().isBlank()) {
                finding = finding.toBuilder().source(Finding.SOURCE_EXTERNAL).build();
            }
            result.add(finding);
        }
        return result;
    }
}
