package com.solsec.scanner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.solsec.scanner.models.Severity;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация эвристик из YAML файла.
 * Каталоги ключевых слов загружаются один раз при старте и дальше только читаются.
 */
@Slf4j
@Getter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerConfig {

    public static final String RESOURCE_NAME = "solsec-config.yaml";

    /** Верхняя граница оценки риска, от нее зависят диапазоны grade */
    public static final int MAX_SCORE = 100;

    private String sourceExtension;
    private Reentrancy reentrancy;
    private AccessControl accessControl;
    private IntegerOverflow integerOverflow;
    private Scoring scoring;

    private static volatile ScannerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static ScannerConfig load() {
        ScannerConfig local = instance;
        if (local == null) {
            synchronized (ScannerConfig.class) {
                local = instance;
                if (local == null) {
                    local = loadFromClasspath();
                    instance = local;
                }
            }
        }
        return local;
    }

    private static ScannerConfig loadFromClasspath() {
        try (InputStream is = ScannerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (is == null) {
                throw new IllegalStateException(RESOURCE_NAME + " не найден в classpath");
            }
            ScannerConfig config = fromYaml(is);
            log.debug("Конфигурация эвристик загружена из {}", RESOURCE_NAME);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Прочитать конфигурацию из YAML потока; отсутствующие секции заполняются значениями по умолчанию
     */
    public static ScannerConfig fromYaml(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ScannerConfig config = mapper.readValue(is, ScannerConfig.class);
        if (config == null) {
            config = new ScannerConfig();
        }
        config.ensureDefaults();
        return config;
    }

    /**
     * Конфигурация только из встроенных значений (без файла)
     */
    public static ScannerConfig defaults() {
        ScannerConfig config = new ScannerConfig();
        config.ensureDefaults();
        return config;
    }

    private void ensureDefaults() {
        if (sourceExtension == null || sourceExtension.isBlank()) {
            sourceExtension = ".sol";
        }
        if (reentrancy == null) {
            reentrancy = new Reentrancy();
        }
        reentrancy.ensureDefaults();
        if (accessControl == null) {
            accessControl = new AccessControl();
        }
        accessControl.ensureDefaults();
        if (integerOverflow == null) {
            integerOverflow = new IntegerOverflow();
        }
        integerOverflow.ensureDefaults();
        if (scoring == null) {
            scoring = new Scoring();
        }
        scoring.ensureDefaults();
    }

    private static <T> List<T> frozen(List<T> values, List<T> fallback) {
        return Collections.unmodifiableList(new ArrayList<>(values == null || values.isEmpty() ? fallback : values));
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class Reentrancy {
        private List<String> externalCallPatterns;
        private List<String> stateChangePatterns;
        private List<String> guardKeywords;

        private void ensureDefaults() {
            externalCallPatterns = frozen(externalCallPatterns,
                List.of(".call{", ".call(", ".delegatecall(", ".transfer(", ".send("));
            stateChangePatterns = frozen(stateChangePatterns,
                List.of("balances[", "balanceOf[", "= 0;", "-= ", "+= "));
            guardKeywords = frozen(guardKeywords,
                List.of("nonReentrant", "ReentrancyGuard", "mutex"));
        }
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class AccessControl {
        private List<SensitiveFunction> sensitiveFunctions;
        private List<String> accessModifiers;
        private List<String> restrictedVisibility;

        private void ensureDefaults() {
            sensitiveFunctions = frozen(sensitiveFunctions, List.of(
                new SensitiveFunction("mint", Severity.CRITICAL,
                    "Unrestricted minting allows anyone to inflate token supply to infinity."),
                new SensitiveFunction("burn", Severity.HIGH,
                    "Unrestricted burning allows anyone to destroy any holder's tokens."),
                new SensitiveFunction("pause", Severity.HIGH,
                    "Unrestricted pause allows any caller to halt all transfers (griefing attack)."),
                new SensitiveFunction("unpause", Severity.HIGH,
                    "Unrestricted unpause can bypass emergency stops."),
                new SensitiveFunction("upgradeTo", Severity.CRITICAL,
                    "Unrestricted upgrades allow full contract takeover."),
                new SensitiveFunction("upgradeToAndCall", Severity.CRITICAL,
                    "Unrestricted upgrades allow full contract takeover."),
                new SensitiveFunction("setOwner", Severity.CRITICAL,
                    "Unrestricted owner changes allow full protocol takeover."),
                new SensitiveFunction("transferOwnership", Severity.HIGH,
                    "Should be guarded: accidental calls transfer admin rights."),
                new SensitiveFunction("withdraw", Severity.HIGH,
                    "Unrestricted withdrawals allow draining of contract funds."),
                new SensitiveFunction("selfdestruct", Severity.CRITICAL,
                    "Unrestricted selfdestruct permanently destroys the contract.")));
            accessModifiers = frozen(accessModifiers, List.of(
                "onlyOwner", "onlyRole", "onlyAdmin", "onlyMinter", "onlyPauser",
                "requiresAuth", "restricted", "auth", "isOwner"));
            restrictedVisibility = frozen(restrictedVisibility, List.of("internal", "private"));
        }
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SensitiveFunction {
        private String keyword;
        private Severity severity;
        private String note;
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class IntegerOverflow {
        private List<String> arithmeticOperators;
        private String safeMathHelper;
        /** Версия компилятора, начиная с которой переполнение проверяется по умолчанию */
        private String checkedArithmeticSince;
        /** Версия, предполагаемая при отсутствии или нечитаемой pragma */
        private String defaultVersion;

        private void ensureDefaults() {
            arithmeticOperators = frozen(arithmeticOperators, List.of(
                " + ", " - ", " * ", " / ", " % ", "++", "--", "+=", "-=", "*=", "/=", "%="));
            if (safeMathHelper == null || safeMathHelper.isBlank()) {
                safeMathHelper = "SafeMath";
            }
            if (checkedArithmeticSince == null || checkedArithmeticSince.isBlank()) {
                checkedArithmeticSince = "0.8";
            }
            if (defaultVersion == null || defaultVersion.isBlank()) {
                defaultVersion = checkedArithmeticSince;
            }
        }
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class Scoring {
        private Map<Severity, Integer> weights;
        private Integer maxScore;

        private void ensureDefaults() {
            Map<Severity, Integer> merged = new EnumMap<>(Severity.class);
            merged.put(Severity.CRITICAL, 40);
            merged.put(Severity.HIGH, 20);
            merged.put(Severity.MEDIUM, 10);
            merged.put(Severity.LOW, 3);
            merged.put(Severity.INFORMATIONAL, 0);
            merged.put(Severity.OPTIMIZATION, 0);
            if (weights != null) {
                weights.forEach((severity, weight) -> {
                    if (severity != null && weight != null && weight >= 0) {
                        merged.put(severity, weight);
                    }
                });
            }
            weights = Collections.unmodifiableMap(merged);
            if (maxScore == null || maxScore <= 0) {
                maxScore = MAX_SCORE;
            } else if (maxScore > MAX_SCORE) {
                log.warn("scoring.maxScore={} больше {}, используется {}", maxScore, MAX_SCORE, MAX_SCORE);
                maxScore = MAX_SCORE;
            }
        }

        public int weightOf(Severity severity) {
            return weights.getOrDefault(severity, 0);
        }
    }
}
