package com.solsec.scanner.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TargetValidatorTest {

    @TempDir
    Path tempDir;

    private final TargetValidator validator = new TargetValidator(".sol");

    @Test
    void testAcceptsSolidityFileAndDirectory() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Token.SOL"), "contract Token {}");

        assertDoesNotThrow(() -> validator.validate(file));
        assertDoesNotThrow(() -> validator.validate(tempDir));
    }

    @Test
    void testRejectsMissingTarget() {
        TargetValidationException e = assertThrows(TargetValidationException.class,
            () -> validator.validate(tempDir.resolve("missing.sol")));

        assertTrue(e.getMessage().contains("missing.sol"));
    }

    @Test
    void testRejectsNullTarget() {
        assertThrows(TargetValidationException.class, () -> validator.validate(null));
    }

    @Test
    void testRejectsWrongExtension() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Token.vy"), "# vyper");

        TargetValidationException e = assertThrows(TargetValidationException.class, () -> validator.validate(file));
        assertTrue(e.getMessage().contains(".sol"));
    }
}
