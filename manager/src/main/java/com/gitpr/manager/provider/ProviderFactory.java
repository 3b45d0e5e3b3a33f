package com.gitpr.manager.provider;

import com.gitpr.manager.config.AuthConfig;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.provider.github.GitHubProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one {@link Provider} per provider key that has repositories configured.
 * Keys this build has no client for are logged and left out.
 */
public class ProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(ProviderFactory.class);

    public Map<String, Provider> createProviders(ManagerConfig config) {
        Map<String, Provider> providers = new LinkedHashMap<>();
        for (String name : config.repositories().keySet()) {
            Provider provider = create(name, config.auth());
            if (provider != null) {
                providers.put(name, provider);
            }
        }
        logger.info("Initialized {} provider(s): {}", providers.size(), providers.keySet());
        return Collections.unmodifiableMap(providers);
    }

    Provider create(String name, AuthConfig auth) {
        if (GitHubProvider.NAME.equals(name)) {
            return new GitHubProvider(auth.github().token(), auth.github().baseUrl());
        }
        logger.warn("Provider '{}' is not supported by this build; its repositories will be reported as failed", name);
        return null;
    }
}
