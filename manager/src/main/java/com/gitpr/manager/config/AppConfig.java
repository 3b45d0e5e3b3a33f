package com.gitpr.manager.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Process-level settings read from environment variables and an optional
 * {@code .env} file using dotenv-java. The environment always wins over
 * {@code .env}. Also serves as the variable source for {@code ${VAR}}
 * placeholders in the YAML configuration.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String CONFIG_PATH_VAR = "GITPR_CONFIG";
    static final String GITHUB_TOKEN_VAR = "GITHUB_TOKEN";
    static final String DEFAULT_CONFIG_PATH = "config.yaml";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public AppConfig() {
        this(System.getenv(), Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    /**
     * Constructor for testing: values are looked up in {@code environment} only.
     */
    public AppConfig(Map<String, String> environment) {
        this(environment, null);
    }

    private AppConfig(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(environment);
        this.dotenv = dotenv;
    }

    /**
     * Resolves {@code key} from the environment, then from {@code .env}.
     *
     * @return the value, or {@code null} when neither source defines it
     */
    public String resolve(String key) {
        String envValue = environment.get(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        if (dotenv == null) {
            return null;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null && !dotenvValue.isBlank() ? dotenvValue : null;
    }

    public String getConfigPath() {
        String path = resolve(CONFIG_PATH_VAR);
        if (path == null) {
            logger.debug("{} not set, using {}", CONFIG_PATH_VAR, DEFAULT_CONFIG_PATH);
            return DEFAULT_CONFIG_PATH;
        }
        return path;
    }

    public String getGithubToken() {
        return resolve(GITHUB_TOKEN_VAR);
    }
}
