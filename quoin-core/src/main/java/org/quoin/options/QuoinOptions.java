package org.quoin.options;

/**
 * Defines configuration option constants used throughout quoin.
 * The CLI and the configuration loader share the same keys.
 */
public final class QuoinOptions {

    private QuoinOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "QUOIN_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "quoin.yaml";
    }

    /**
     * Identifier quoting settings.
     */
    public static final class Quote {
        private Quote() {}

        public static final String DIALECT_KEY = "quoin.quote.dialect";
        public static final String DIALECT_DEFAULT = "mysql";

        /**
         * Which identifiers the quoting rules apply to.
         * Values: table-and-columns, table-only, columns-only
         */
        public static final String MODE_KEY = "quoin.quote.mode";
        public static final String MODE_DEFAULT = "table-and-columns";

        /**
         * When quotes are added.
         * Values: add-always, no-add, add-reserved
         */
        public static final String POLICY_KEY = "quoin.quote.policy";
        public static final String POLICY_DEFAULT = "add-always";
    }
}
