package com.gitpr.manager.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the YAML configuration, substitutes {@code ${VAR}} placeholders from
 * {@link AppConfig}, fills in the GitHub token from {@code GITHUB_TOKEN} when the
 * file leaves it empty, and validates the result.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final AppConfig appConfig;
    private final ObjectMapper yamlMapper;
    private final ConfigValidator validator;

    public ConfigLoader(AppConfig appConfig) {
        this.appConfig = appConfig;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = new ConfigValidator();
    }

    public ManagerConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Configuration file not found: " + path.toAbsolutePath(), null);
        }
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8);
            ManagerConfig config = parse(raw);
            logger.info("Configuration loaded from {}: {} repositories across {} providers",
                    path, config.repositoryCount(), config.repositories().size());
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses and validates configuration text.
     */
    public ManagerConfig parse(String yaml) {
        ManagerConfig config;
        try {
            config = yamlMapper.readValue(substitute(yaml), ManagerConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to parse configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Configuration is empty", null);
        }
        config = withTokenFallback(config);
        validator.validate(config);
        return config;
    }

    String substitute(String text) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = appConfig.resolve(matcher.group(1));
            if (value == null) {
                logger.warn("Configuration references undefined variable {}", matcher.group(1));
                value = "";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private ManagerConfig withTokenFallback(ManagerConfig config) {
        AuthConfig.GitHubAuth github = config.auth().github();
        if (github.hasToken()) {
            return config;
        }
        String token = appConfig.getGithubToken();
        if (token == null) {
            return config;
        }
        AuthConfig auth = new AuthConfig(new AuthConfig.GitHubAuth(token, github.baseUrl()));
        return new ManagerConfig(config.prFilters(), config.repositories(), auth, config.behavior());
    }
}
