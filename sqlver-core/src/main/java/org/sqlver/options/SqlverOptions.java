package org.sqlver.options;

/**
 * Configuration option keys shared by the CLI and anything embedding the core.
 */
public final class SqlverOptions {

    private SqlverOptions() {
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
        public static final String ENV_VAR = "SQLVER_PROFILE";

        /**
         * Configuration file name, searched from the working directory upward.
         */
        public static final String CONFIG_FILE = "sqlver.yaml";
    }

    /**
     * Upgrade plan settings.
     */
    public static final class Plan {
        private Plan() {}

        /**
         * Platform the SQL of raw changes is picked for.
         * Default: universal statements only
         */
        public static final String PLATFORM_KEY = "sqlver.plan.platform";
        public static final String PLATFORM_DEFAULT = "all";

        /**
         * Whether warnings block the plan like errors do.
         */
        public static final String FAIL_ON_WARNINGS_KEY = "sqlver.plan.failOnWarnings";
        public static final boolean FAIL_ON_WARNINGS_DEFAULT = false;
    }
}
