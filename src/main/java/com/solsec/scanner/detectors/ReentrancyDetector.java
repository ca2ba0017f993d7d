package com.solsec.scanner.detectors;

import com.solsec.scanner.config.ScannerConfig;
import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Severity;

import java.util.List;

/**
 * Детектор нарушения порядка checks-effects-interactions:
 * внешний вызов, после которого в той же функции меняется состояние, без reentrancy guard.
 */
public class ReentrancyDetector extends AbstractLineDetector {

    public static final String CHECK_ID = "reentrancy-ordering";
    public static final String SWC_REF = "SWC-107";

    private final List<String> externalCallPatterns;
    private final List<String> stateChangePatterns;
    private final List<String> guardKeywords;

    public ReentrancyDetector() {
        this(ScannerConfig.load());
    }

    public ReentrancyDetector(ScannerConfig config) {
        super(config);
        ScannerConfig.Reentrancy settings = this.config.getReentrancy();
        this.externalCallPatterns = settings.getExternalCallPatterns();
        this.stateChangePatterns = settings.getStateChangePatterns();
        this.guardKeywords = settings.getGuardKeywords();
    }

    @Override
    public String getName() {
        return "reentrancy";
    }

    @Override
    protected String idPrefix() {
        return "HEURISTIC-REENTRANT";
    }

    @Override
    protected FileScan newFileScan(String file, IdSequence ids) {
        return new ReentrancyScan(file, ids);
    }

    /**
     * Контекст текущей функции. Сбрасывается на объявлении функции и на строке "}".
     */
    private static final class FunctionContext {
        boolean inFunction;
        String functionName = "";
        boolean guardSeen;
        int callLine;   // 0 = внешнего вызова еще не было

        void enter(String name) {
            inFunction = true;
            functionName = name;
            guardSeen = false;
            callLine = 0;
        }

        void exit() {
            inFunction = false;
            callLine = 0;
        }

        boolean callSeen() {
            return callLine > 0;
        }
    }

    private final class ReentrancyScan extends FileScan {

        private final FunctionContext context = new FunctionContext();

        ReentrancyScan(String file, IdSequence ids) {
            super(file, ids);
        }

        @Override
        protected void onLine(int lineNumber, String trimmed) {
            if (trimmed.contains("function ") && trimmed.contains("(")) {
                context.enter(extractFunctionName(trimmed));
            }

            if (!context.inFunction) {
                return;
            }

            if (containsAny(trimmed, guardKeywords)) {
                context.guardSeen = true;
            }

            boolean comment = isComment(trimmed);

            // Изменение состояния учитывается только на строках после вызова
            if (!comment && context.callSeen() && !context.guardSeen
                    && containsAny(trimmed, stateChangePatterns)) {
                report(buildFinding(lineNumber));
            }

            if (!comment && containsAny(trimmed, externalCallPatterns)) {
                context.callLine = lineNumber;
            }

            if (isClosingBrace(trimmed)) {
                context.exit();
            }
        }

        private Finding buildFinding(int mutationLine) {
            return Finding.builder()
                .id(ids.next())
                .source(Finding.SOURCE_HEURISTIC)
                .check(CHECK_ID)
                .title("State Change After External Call (Reentrancy Risk)")
                .description(String.format(
                    "In function '%s' (%s line %d): state variable modified after external call on line %d. "
                        + "If the callee re-enters this function before the state update, it can exploit the stale state.",
                    context.functionName, file, mutationLine, context.callLine))
                .severity(Severity.HIGH)
                .confidence("Medium")
                .file(file)
                .lines(List.of(context.callLine, mutationLine))
                .remediation("Move all state changes BEFORE the external call (checks-effects-interactions). "
                    + "Alternatively, add OpenZeppelin's nonReentrant modifier.")
                .swcRef(SWC_REF)
                .references(List.of(
                    "https://swcregistry.io/docs/SWC-107",
                    "https://docs.openzeppelin.com/contracts/4.x/api/security#ReentrancyGuard"))
                .build();
        }
    }
}
