package org.quoin.cli;

import org.quoin.quote.QuotingEngine;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "columns",
        mixinStandardHelpOptions = true,
        description = "콤마로 구분된 컬럼 목록(a,b,c)의 각 컬럼을 quote 합니다."
)
public class ColumnsCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private QuotingOptions options;
    @CommandLine.Parameters(index = "0", paramLabel = "COLUMNS", description = "콤마로 구분된 컬럼 목록")
    private String columns;

    @Override
    public Integer call() {
        try {
            QuotingEngine engine = options.createEngine();
            System.out.println(engine.quoteColumns(columns));
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
