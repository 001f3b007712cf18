package org.quoin.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for quoin.
 * Quotes SQL table and column identifiers for a target database dialect.
 */
@CommandLine.Command(
        name = "quoin",
        mixinStandardHelpOptions = true,
        version = "quoin 0.1.0",
        description = "SQL 식별자(테이블/컬럼 이름)를 Dialect 규칙에 맞게 quote 합니다.",
        subcommands = {
                QuoteCommand.class,
                ColumnsCommand.class,
                UnquoteCommand.class
        }
)
public class QuoinCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new QuoinCli()).execute(args);
        System.exit(exitCode);
    }
}
