package com.solsec.scanner.detectors;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Severity;

import java.util.List;

/**
 * Детектор переполнения целых:
 * - до 0.8 любая арифметика без SafeMath (переполнение молча заворачивается);
 * - с 0.8 арифметика внутри блоков unchecked { }.
 */
public class IntegerOverflowDetector extends AbstractLineDetector {

    public static final String OVERFLOW_CHECK_ID = "integer-overflow";
    public static final String UNCHECKED_CHECK_ID = "unchecked-arithmetic";
    public static final String SWC_REF = "SWC-101";

    private final List<String> arithmeticOperators;
    private final String safeMathHelper;
    private final SolidityVersion checkedSince;
    private final SolidityVersion defaultVersion;

    public IntegerOverflowDetector() {
        this(ScannerConfig.load());
    }

    public IntegerOverflowDetector(ScannerConfig config) {
        super(config);
        ScannerConfig.IntegerOverflow settings = this.config.getIntegerOverflow();
        this.arithmeticOperators = settings.getArithmeticOperators();
        this.safeMathHelper = settings.getSafeMathHelper();
        this.checkedSince = versionOrDefault(settings.getCheckedArithmeticSince(), new SolidityVersion(0, 8));
        this.defaultVersion = versionOrDefault(settings.getDefaultVersion(), checkedSince);
    }

    private static SolidityVersion versionOrDefault(String text, SolidityVersion fallback) {
        SolidityVersion parsed = SolidityVersion.parse(text);
        return parsed != null ? parsed : fallback;
    }

    @Override
    public String getName() {
        return "integer-overflow";
    }

    @Override
    protected String idPrefix() {
        return "HEURISTIC-OVERFLOW";
    }

    @Override
    protected FileScan newFileScan(String file, IdSequence ids) {
        return new OverflowScan(file, ids);
    }

    boolean containsArithmetic(String line) {
        return containsAny(line, arithmeticOperators);
    }

    private final class OverflowScan extends FileScan {

        private SolidityVersion version = defaultVersion;
        private boolean uncheckedPending;   // строка "unchecked" без скобки, ждем "{" на следующей
        private boolean inUnchecked;
        private int uncheckedLine;

        OverflowScan(String file, IdSequence ids) {
            super(file, ids);
        }

        @Override
        protected void onLine(int lineNumber, String trimmed) {
            if (SolidityVersion.isPragma(trimmed)) {
                SolidityVersion declared = SolidityVersion.fromPragma(trimmed);
                version = declared != null ? declared : defaultVersion;
            }

            trackUncheckedBlock(lineNumber, trimmed);

            if (isComment(trimmed) || !containsArithmetic(trimmed)) {
                return;
            }

            if (version.isBefore(checkedSince)) {
                if (!trimmed.contains(safeMathHelper)) {
                    report(overflowFinding(lineNumber));
                }
            } else if (inUnchecked) {
                report(uncheckedFinding(lineNumber));
            }
        }

        private void trackUncheckedBlock(int lineNumber, String trimmed) {
            if (uncheckedPending) {
                uncheckedPending = false;
                if (trimmed.equals("{")) {
                    openUnchecked(lineNumber);
                    return;
                }
            }
            if (trimmed.equals("unchecked {") || trimmed.equals("unchecked{")) {
                openUnchecked(lineNumber);
            } else if (trimmed.equals("unchecked")) {
                uncheckedPending = true;
            } else if (inUnchecked && isClosingBrace(trimmed)) {
                inUnchecked = false;
            }
        }

        private void openUnchecked(int lineNumber) {
            inUnchecked = true;
            uncheckedLine = lineNumber;
        }

        private Finding overflowFinding(int lineNumber) {
            return Finding.builder()
                .id(ids.next())
                .source(Finding.SOURCE_HEURISTIC)
                .check(OVERFLOW_CHECK_ID)
                .title("Potential Integer Overflow (Solidity < " + checkedSince + ")")
                .description(String.format(
                    "%s:%d: Arithmetic operation in Solidity %s.x without %s. "
                        + "Integer overflow/underflow silently wraps in versions before %s.0.",
                    file, lineNumber, version, safeMathHelper, checkedSince))
                .severity(Severity.HIGH)
                .confidence("Medium")
                .file(file)
                .lines(List.of(lineNumber))
                .remediation("Upgrade to Solidity ^" + checkedSince + ".0 where overflow/underflow revert by default. "
                    + "If upgrading is not possible, use OpenZeppelin " + safeMathHelper + " for all arithmetic.")
                .swcRef(SWC_REF)
                .references(List.of(
                    "https://swcregistry.io/docs/SWC-101",
                    "https://docs.openzeppelin.com/contracts/4.x/api/utils#SafeMath"))
                .build();
        }

        private Finding uncheckedFinding(int lineNumber) {
            return Finding.builder()
                .id(ids.next("HEURISTIC-UNCHECKED"))
                .source(Finding.SOURCE_HEURISTIC)
                .check(UNCHECKED_CHECK_ID)
                .title("Arithmetic Inside unchecked{} Block")
                .description(String.format(
                    "%s:%d: Arithmetic operation inside an unchecked{} block (started line %d). "
                        + "Overflow protection is deliberately disabled here. Verify this is intentional.",
                    file, lineNumber, uncheckedLine))
                .severity(Severity.LOW)
                .confidence("High")
                .file(file)
                .lines(List.of(uncheckedLine, lineNumber))
                .remediation("Only use unchecked{} when overflow is mathematically impossible "
                    + "(e.g. loop counter bounded by array length). Add a comment explaining why it is safe.")
                .swcRef(SWC_REF)
                .references(List.of(
                    "https://docs.soliditylang.org/en/latest/control-structures.html#checked-or-unchecked-arithmetic"))
                .build();
        }
    }
}
