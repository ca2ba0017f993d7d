package com.solsec.scanner.detectors;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.models.Finding;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Детектор чувствительных функций (mint, burn, pause, upgrade...) без модификатора доступа.
 * Проверяется только строка объявления функции.
 */
public class AccessControlDetector extends AbstractLineDetector {

    public static final String CHECK_ID = "missing-access-control";
    public static final String SWC_REF = "SWC-105";

    private static final String FUNCTION_KEYWORD = "function ";

    private final List<ScannerConfig.SensitiveFunction> sensitiveFunctions;
    private final List<String> accessModifiers;
    private final Pattern restrictedVisibility;

    public AccessControlDetector() {
        this(ScannerConfig.load());
    }

    public AccessControlDetector(ScannerConfig config) {
        super(config);
        ScannerConfig.AccessControl settings = this.config.getAccessControl();
        this.sensitiveFunctions = settings.getSensitiveFunctions();
        this.accessModifiers = settings.getAccessModifiers().stream()
            .map(modifier -> modifier.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
        this.restrictedVisibility = Pattern.compile("\\b(" + settings.getRestrictedVisibility().stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|")) + ")\\b");
    }

    @Override
    public String getName() {
        return "access-control";
    }

    @Override
    protected String idPrefix() {
        return "HEURISTIC-ACCESS";
    }

    @Override
    protected FileScan newFileScan(String file, IdSequence ids) {
        return new AccessControlScan(file, ids);
    }

    /**
     * Имя функции начинается с keyword (без учета регистра), а следующий символ - "(" или заглавная буква.
     * "mint(" и "mintTokens(" совпадают, "minter(" нет.
     */
    static boolean declaresFunctionNamed(String line, String keyword) {
        int from = 0;
        while (true) {
            int idx = line.indexOf(FUNCTION_KEYWORD, from);
            if (idx < 0) {
                return false;
            }
            int nameStart = idx + FUNCTION_KEYWORD.length();
            int afterKeyword = nameStart + keyword.length();
            if (afterKeyword < line.length()
                    && line.regionMatches(true, nameStart, keyword, 0, keyword.length())) {
                char next = line.charAt(afterKeyword);
                if (next == '(' || Character.isUpperCase(next)) {
                    return true;
                }
            }
            from = nameStart;
        }
    }

    boolean hasAccessModifier(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String modifier : accessModifiers) {
            if (lower.contains(modifier)) {
                return true;
            }
        }
        return false;
    }

    boolean hasRestrictedVisibility(String line) {
        return restrictedVisibility.matcher(line).find();
    }

    private final class AccessControlScan extends FileScan {

        AccessControlScan(String file, IdSequence ids) {
            super(file, ids);
        }

        @Override
        protected void onLine(int lineNumber, String trimmed) {
            if (isComment(trimmed) || !trimmed.contains(FUNCTION_KEYWORD)) {
                return;
            }

            for (ScannerConfig.SensitiveFunction sensitive : sensitiveFunctions) {
                if (!declaresFunctionNamed(trimmed, sensitive.getKeyword())) {
                    continue;
                }
                // Модификатор или видимость ищутся только в этой строке объявления
                if (hasAccessModifier(trimmed) || hasRestrictedVisibility(trimmed)) {
                    continue;
                }
                report(buildFinding(lineNumber, trimmed, sensitive));
            }
        }

        private Finding buildFinding(int lineNumber, String declaration, ScannerConfig.SensitiveFunction sensitive) {
            String functionName = extractFunctionName(declaration);
            return Finding.builder()
                .id(ids.next())
                .source(Finding.SOURCE_HEURISTIC)
                .check(CHECK_ID)
                .title(String.format("Missing Access Control on %s()", functionName))
                .description(String.format(
                    "%s:%d: Function '%s' appears to be missing an access control modifier. %s",
                    file, lineNumber, functionName, sensitive.getNote()))
                .severity(sensitive.getSeverity())
                .confidence("Medium")
                .file(file)
                .lines(List.of(lineNumber))
                .remediation(String.format(
                    "Add an access control modifier to '%s()'. Use onlyOwner (OpenZeppelin Ownable) "
                        + "or onlyRole(ROLE) (OpenZeppelin AccessControl) depending on your access model.",
                    functionName))
                .swcRef(SWC_REF)
                .references(List.of(
                    "https://swcregistry.io/docs/SWC-105",
                    "https://docs.openzeppelin.com/contracts/4.x/access-control"))
                .build();
        }
    }
}
