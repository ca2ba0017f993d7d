package com.solsec.scanner.cli;

import com.solsec.scanner.knowledge.RuleCatalog;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Список встроенных эвристических правил
 */
@Command(
    name = "rules",
    mixinStandardHelpOptions = true,
    description = "Показать встроенные эвристические проверки"
)
public class RulesCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println();
        out.println("solsec built-in heuristic checks");
        for (RuleCatalog.RuleInfo rule : RuleCatalog.getRules()) {
            out.printf("  %-28s [%s] %s%n    %s%n%n",
                rule.getCheck(), rule.getSeverity(), rule.getSwcRef(), rule.getDescription());
        }
        out.println("  External analyzer findings are merged as supplied (see analyze --findings).");
        out.flush();
        return MainCommand.EXIT_OK;
    }
}
