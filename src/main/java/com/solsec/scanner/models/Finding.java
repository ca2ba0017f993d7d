package com.solsec.scanner.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Единая находка: результат эвристического детектора или внешнего анализатора.
 * Создается один раз и больше не меняется.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Finding {

    public static final String SOURCE_HEURISTIC = "heuristic";
    public static final String SOURCE_EXTERNAL = "external";

    String id;
    String source;      // "external" или "heuristic", только для отчета
    String check;       // идентификатор правила
    String title;
    String description;
    Severity severity;  // null = нераспознанная критичность
    String confidence;  // High/Medium/Low, справочно
    String file;

    List<Integer> lines;      // всегда неизменяемый, null → пустой

    String remediation;

    @JsonProperty("swc_ref")
    String swcRef;      // SWC registry, например "SWC-107"

    List<String> references;

    /**
     * Первая строка находки или null, если строки неизвестны
     */
    @JsonIgnore
    public Integer getFirstLine() {
        return lines != null && !lines.isEmpty() ? lines.get(0) : null;
    }

    @JsonIgnore
    public int getSeverityRank() {
        return Severity.rankOf(severity);
    }

    private static <T> List<T> frozen(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Списки копируются при сборке: ключ дедупликации (первая строка) не может измениться после создания
     */
    public static class FindingBuilder {
        public Finding build() {
            return new Finding(id, source, check, title, description, severity, confidence, file,
                frozen(lines), remediation, swcRef, frozen(references));
        }
    }
}
