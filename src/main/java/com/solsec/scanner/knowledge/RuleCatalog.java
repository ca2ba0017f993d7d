package com.solsec.scanner.knowledge;

import com.solsec.scanner.detectors.AccessControlDetector;
import com.solsec.scanner.detectors.IntegerOverflowDetector;
import com.solsec.scanner.detectors.ReentrancyDetector;

import java.util.List;

/**
 * Справочник встроенных эвристических правил (для команды rules и отчетов)
 */
public final class RuleCatalog {

    private static final List<RuleInfo> RULES = List.of(
        RuleInfo.builder()
            .check(ReentrancyDetector.CHECK_ID)
            .severity("High")
            .description("State change after external call without reentrancy guard")
            .swcRef(ReentrancyDetector.SWC_REF)
            .reference("https://swcregistry.io/docs/SWC-107")
            .build(),
        RuleInfo.builder()
            .check(AccessControlDetector.CHECK_ID)
            .severity("Critical/High")
            .description("Sensitive functions (mint, burn, pause, upgrade) without access modifiers")
            .swcRef(AccessControlDetector.SWC_REF)
            .reference("https://swcregistry.io/docs/SWC-105")
            .build(),
        RuleInfo.builder()
            .check(IntegerOverflowDetector.OVERFLOW_CHECK_ID)
            .severity("High")
            .description("Arithmetic without SafeMath in Solidity <0.8")
            .swcRef(IntegerOverflowDetector.SWC_REF)
            .reference("https://swcregistry.io/docs/SWC-101")
            .build(),
        RuleInfo.builder()
            .check(IntegerOverflowDetector.UNCHECKED_CHECK_ID)
            .severity("Low")
            .description("Arithmetic inside unchecked{} blocks")
            .swcRef(IntegerOverflowDetector.SWC_REF)
            .reference("https://docs.soliditylang.org/en/latest/control-structures.html#checked-or-unchecked-arithmetic")
            .build()
    );

    private RuleCatalog() {
    }

    public static List<RuleInfo> getRules() {
        return RULES;
    }

    public static RuleInfo find(String check) {
        return RULES.stream()
            .filter(rule -> rule.getCheck().equals(check))
            .findFirst()
            .orElse(null);
    }

    @lombok.Value
    @lombok.Builder
    public static class RuleInfo {
        String check;
        String severity;
        String description;
        String swcRef;
        String reference;
    }
}
