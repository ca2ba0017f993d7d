package com.solsec.scanner.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Главная CLI команда solsec
 */
@Command(
    name = "solsec",
    mixinStandardHelpOptions = true,
    version = "solsec 1.0.0",
    description = """

        solsec - эвристический анализ безопасности Solidity контрактов

        Возможности:
          • Поиск reentrancy (изменение состояния после внешнего вызова)
          • Чувствительные функции без контроля доступа
          • Переполнение целых (< 0.8) и блоки unchecked { }
          • Объединение с находками внешнего анализатора
          • Оценка риска 0-100 и буквенный grade
        """,
    subcommands = {
        AnalyzeCommand.class,
        RulesCommand.class
    }
)
public class MainCommand implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_INPUT_ERROR = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Без подкоманды показываем справку
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
