package com.solsec.scanner.detectors;

import com.solsec.scanner.models.Finding;
import com.solsec.scanner.models.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для IntegerOverflowDetector
 */
class IntegerOverflowDetectorTest {

    @TempDir
    Path tempDir;

    private IntegerOverflowDetector detector;

    @BeforeEach
    void setUp() {
        detector = new IntegerOverflowDetector();
    }

    private List<Finding> scan(String content) throws IOException {
        Path file = tempDir.resolve("Math.sol");
        Files.writeString(file, content);
        return detector.scan(file);
    }

    @Test
    void testLegacyArithmeticWithoutSafeMath() throws IOException {
        List<Finding> findings = scan("""
            pragma solidity ^0.7.0;

            contract Legacy {
                function add(uint256 a, uint256 b) public pure returns (uint256) {
                    return a + b;
                }
            }
            """);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("integer-overflow", finding.getCheck());
        assertEquals(Severity.HIGH, finding.getSeverity());
        assertEquals(List.of(5), finding.getLines());
        assertEquals("SWC-101", finding.getSwcRef());
        assertEquals("HEURISTIC-OVERFLOW-1", finding.getId());
        assertTrue(finding.getDescription().contains("0.7"));
    }

    @Test
    void testSafeMathLineIsSkipped() throws IOException {
        assertTrue(scan("""
            pragma solidity 0.6.12;

            contract Legacy {
                function add(uint256 a, uint256 b) public pure returns (uint256) {
                    return SafeMath.add(a, b) + 0;
                }
            }
            """).isEmpty());
    }

    @Test
    void testCheckedArithmeticOutsideUncheckedIsSafe() throws IOException {
        assertTrue(scan("""
            pragma solidity ^0.8.0;

            contract Modern {
                function add(uint256 a, uint256 b) public pure returns (uint256) {
                    return a + b;
                }
            }
            """).isEmpty());
    }

    @Test
    void testArithmeticInsideUncheckedBlock() throws IOException {
        List<Finding> findings = scan("""
            pragma solidity ^0.8.20;

            contract Loop {
                function sum(uint256[] memory xs) public pure returns (uint256 total) {
                    for (uint256 i = 0; i < xs.length;) {
                        total += xs[i];
                        unchecked {
                            i++;
                        }
                    }
                }
            }
            """);

        assertEquals(1, findings.size(), "арифметика вне unchecked в 0.8 не сообщается");
        Finding finding = findings.get(0);
        assertEquals("unchecked-arithmetic", finding.getCheck());
        assertEquals(Severity.LOW, finding.getSeverity());
        assertEquals(List.of(7, 8), finding.getLines());
        assertEquals("HEURISTIC-UNCHECKED-1", finding.getId());
    }

    @Test
    void testUncheckedKeywordOnSeparateLine() throws IOException {
        List<Finding> findings = scan("""
            pragma solidity ^0.8.20;

            contract Split {
                function dec(uint256 x) public pure returns (uint256) {
                    unchecked
                    {
                        return x - 1;
                    }
                }
            }
            """);

        assertEquals(1, findings.size());
        assertEquals(List.of(6, 7), findings.get(0).getLines());
    }

    @Test
    void testUncheckedBlockClosesOnBrace() throws IOException {
        List<Finding> findings = scan("""
            pragma solidity ^0.8.20;

            contract Closed {
                function f(uint256 x) public pure returns (uint256 y) {
                    unchecked {
                        y = x * 2;
                    }
                    y = y + 1;
                }
            }
            """);

        assertEquals(1, findings.size());
        assertEquals(List.of(5, 6), findings.get(0).getLines());
    }

    @Test
    void testMissingPragmaDefaultsToCheckedArithmetic() throws IOException {
        assertTrue(scan("""
            contract NoPragma {
                function add(uint256 a, uint256 b) public pure returns (uint256) {
                    return a + b;
                }
            }
            """).isEmpty());
    }

    @Test
    void testCommentedArithmeticIsIgnored() throws IOException {
        assertTrue(scan("""
            pragma solidity ^0.7.6;

            contract Docs {
                // return a + b;
                /* a - b */
            }
            """).isEmpty());
    }

    @Test
    void testVersionIsTrackedPerFile() throws IOException {
        Files.writeString(tempDir.resolve("A.sol"), """
            pragma solidity ^0.7.0;
            contract A { uint x = y + 1; }
            """);
        Files.writeString(tempDir.resolve("B.sol"), """
            contract B { uint x = y + 1; }
            """);

        List<Finding> findings = detector.scan(tempDir);

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getFile().endsWith("A.sol"));
    }

    @Test
    void testPragmaAfterByteOrderMark() throws IOException {
        List<Finding> findings = scan("\uFEFFpragma solidity ^0.7.0;\n"
            + "contract Bom {\n"
            + "    function add(uint256 a, uint256 b) public pure returns (uint256) { return a + b; }\n"
            + "}\n");

        assertEquals(1, findings.size(), "BOM в начале файла не скрывает pragma");
        assertEquals(Severity.HIGH, findings.get(0).getSeverity());
        assertEquals(List.of(3), findings.get(0).getLines());
    }
}
