package org.quoin.cli;

import org.quoin.quote.QuotingEngine;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "unquote",
        mixinStandardHelpOptions = true,
        description = "식별자 양 끝의 따옴표를 제거합니다."
)
public class UnquoteCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private QuotingOptions options;
    @CommandLine.Parameters(arity = "1..*", paramLabel = "IDENTIFIER")
    private List<String> identifiers;

    @Override
    public Integer call() {
        try {
            QuotingEngine engine = options.createEngine();
            identifiers.forEach(id -> System.out.println(engine.unquote(id)));
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
