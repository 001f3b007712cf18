package org.quoin.cli;

import org.quoin.quote.QuotingEngine;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Quotes table or column identifiers, one result per line.
 */
@CommandLine.Command(
        name = "quote",
        mixinStandardHelpOptions = true,
        description = "식별자를 quote 합니다. 점(.)으로 구분된 이름과 이미 quote 된 이름도 처리합니다."
)
public class QuoteCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private QuotingOptions options;
    @CommandLine.Option(names = {"-t", "--table"}, description = "컬럼 대신 테이블 식별자로 취급합니다.")
    private boolean table;
    @CommandLine.Parameters(arity = "1..*", paramLabel = "IDENTIFIER", description = "quote 할 식별자")
    private List<String> identifiers;

    @Override
    public Integer call() {
        try {
            QuotingEngine engine = options.createEngine();
            for (String identifier : identifiers) {
                System.out.println(engine.quote(identifier, !table));
            }
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
