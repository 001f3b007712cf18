package org.quoin.cli;

import org.quoin.config.ConfigurationLoader;
import org.quoin.dialect.mssql.MsSqlDialect;
import org.quoin.dialect.mysql.MySqlDialect;
import org.quoin.dialect.postgresql.PostgreSqlDialect;
import org.quoin.options.QuoinOptions;
import org.quoin.quote.QuoteMode;
import org.quoin.quote.QuotePolicy;
import org.quoin.quote.QuotingEngine;
import org.quoin.spi.dialect.Dialect;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Options shared by every quoting command.
 * Values given on the command line override the configuration file, which overrides the defaults.
 */
public class QuotingOptions {

    @CommandLine.Option(names = {"-d", "--dialect"}, description = "사용할 DB 방언 (mysql, postgres, mssql)")
    String dialectName;
    @CommandLine.Option(names = "--mode", description = "quote 적용 대상 (table-and-columns, table-only, columns-only)")
    String mode;
    @CommandLine.Option(names = "--policy", description = "quote 적용 시점 (add-always, no-add, add-reserved)")
    String policy;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    String profile;
    @CommandLine.Option(names = "--config-dir", description = "quoin.yaml 탐색을 시작할 디렉터리 (기본: 현재 디렉터리)")
    Path configDir;

    /**
     * Loads configuration, applies command line overrides and builds the engine.
     *
     * @throws IllegalArgumentException for an unsupported dialect or an invalid mode/policy
     */
    QuotingEngine createEngine() {
        Map<String, String> config = new HashMap<>(loadConfiguration());
        override(config, QuoinOptions.Quote.DIALECT_KEY, dialectName);
        override(config, QuoinOptions.Quote.MODE_KEY, mode);
        override(config, QuoinOptions.Quote.POLICY_KEY, policy);

        Dialect dialect = resolveDialect(config.get(QuoinOptions.Quote.DIALECT_KEY));
        return QuotingEngine.builder()
                .dialect(dialect)
                .quoteMode(QuoteMode.from(config.get(QuoinOptions.Quote.MODE_KEY)))
                .quotePolicy(QuotePolicy.from(config.get(QuoinOptions.Quote.POLICY_KEY)))
                .build();
    }

    private Map<String, String> loadConfiguration() {
        ConfigurationLoader loader = configDir == null
                ? new ConfigurationLoader()
                : new ConfigurationLoader(configDir.toAbsolutePath());
        return loader.loadConfiguration(profile);
    }

    private static void override(Map<String, String> config, String key, String value) {
        if (value != null && !value.isBlank()) {
            config.put(key, value);
        }
    }

    static Dialect resolveDialect(String name) {
        return switch (name.trim().toLowerCase()) {
            case "mysql" -> new MySqlDialect();
            case "postgres", "postgresql" -> new PostgreSqlDialect();
            case "mssql", "sqlserver" -> new MsSqlDialect();
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }
}
