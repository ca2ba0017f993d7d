package com.solsec.scanner.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class RulesCommandTest {

    @Test
    void testRulesListsHeuristicChecks() {
        StringWriter buffer = new StringWriter();
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setOut(new PrintWriter(buffer));

        int exitCode = commandLine.execute("rules");

        assertEquals(MainCommand.EXIT_OK, exitCode);
        String output = buffer.toString();
        assertTrue(output.contains("reentrancy-ordering"));
        assertTrue(output.contains("missing-access-control"));
        assertTrue(output.contains("integer-overflow"));
        assertTrue(output.contains("unchecked-arithmetic"));
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        StringWriter buffer = new StringWriter();
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setOut(new PrintWriter(buffer));

        assertEquals(MainCommand.EXIT_OK, commandLine.execute());
        assertTrue(buffer.toString().contains("analyze"));
    }
}
