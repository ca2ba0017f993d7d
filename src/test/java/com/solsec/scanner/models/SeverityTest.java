package com.solsec.scanner.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityTest {

    @Test
    void testRanksFollowDeclarationOrder() {
        assertEquals(0, Severity.CRITICAL.getRank());
        assertEquals(1, Severity.HIGH.getRank());
        assertEquals(2, Severity.MEDIUM.getRank());
        assertEquals(3, Severity.LOW.getRank());
        assertEquals(4, Severity.INFORMATIONAL.getRank());
        assertEquals(5, Severity.OPTIMIZATION.getRank());
    }

    @Test
    void testUnrecognizedRanksLast() {
        assertEquals(6, Severity.rankOf(null));
        assertEquals(Severity.UNRECOGNIZED_RANK, Severity.rankOf(Severity.fromLabel("Severe")));
    }

    @Test
    void testUnrecognizedNeverMeetsThreshold() {
        assertFalse(Severity.isAtOrAbove(null, Severity.OPTIMIZATION),
            "Нераспознанная критичность не должна проходить даже самый низкий порог");
        assertTrue(Severity.isAtOrAbove(Severity.CRITICAL, Severity.HIGH));
        assertTrue(Severity.isAtOrAbove(Severity.HIGH, Severity.HIGH));
        assertFalse(Severity.isAtOrAbove(Severity.MEDIUM, Severity.HIGH));
    }

    @Test
    void testFromLabelIsCaseInsensitive() {
        assertEquals(Severity.HIGH, Severity.fromLabel("high"));
        assertEquals(Severity.HIGH, Severity.fromLabel("HIGH"));
        assertEquals(Severity.INFORMATIONAL, Severity.fromLabel("Informational"));
        assertEquals(Severity.INFORMATIONAL, Severity.fromLabel("info"));
        assertEquals(Severity.OPTIMIZATION, Severity.fromLabel(" Optimization "));
        assertNull(Severity.fromLabel(null));
        assertNull(Severity.fromLabel(""));
    }
}
