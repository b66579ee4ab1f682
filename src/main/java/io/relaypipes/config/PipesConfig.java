package io.relaypipes.config;

import java.util.Map;

public final class PipesConfig {
    public static final String DEFAULT_CONTEXT_ENV_VAR = "DAGSTER_PIPES_CONTEXT";
    public static final String DEFAULT_MESSAGES_ENV_VAR = "DAGSTER_PIPES_MESSAGES";
    public static final String CONTEXT_CLI_FLAG = "--dagster-pipes-context";
    public static final String MESSAGES_CLI_FLAG = "--dagster-pipes-messages";

    public static final String PATH_KEY = "path";
    public static final String CONTEXT_KEY = "context";
    public static final String STDIO_KEY = "stdio";
    public static final String WRITE_MODE_KEY = "write_mode";
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";
    public static final String WRITE_MODE_APPEND = "append";
    public static final String WRITE_MODE_ATOMIC_REPLACE = "atomic_replace";

    private final String contextEnvVar;
    private final String messagesEnvVar;
    private final Map<String, String> environment;

    public PipesConfig(String contextEnvVar, String messagesEnvVar, Map<String, String> environment) {
        this.contextEnvVar = contextEnvVar;
        this.messagesEnvVar = messagesEnvVar;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static PipesConfig defaults() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Config over the given environment using the protocol's fixed variable names.
     */
    public static PipesConfig fromEnvironment(Map<String, String> environment) {
        return new PipesConfig(DEFAULT_CONTEXT_ENV_VAR, DEFAULT_MESSAGES_ENV_VAR, environment);
    }

    public String contextEnvVar() {
        return contextEnvVar;
    }

    public String messagesEnvVar() {
        return messagesEnvVar;
    }

    public Map<String, String> environment() {
        return environment;
    }

    public String contextBlob() {
        return environment.get(contextEnvVar);
    }

    public String messagesBlob() {
        return environment.get(messagesEnvVar);
    }
}
