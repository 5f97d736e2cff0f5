package com.adforge.core.config;

import com.adforge.core.error.ConfigException;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Checks that required settings and credentials are present before any remote call is made.
 * Names are resolved through Spring's {@link Environment}, so both environment variables
 * ({@code KIE_API_KEY}) and properties ({@code adforge.provider.api-key}) work.
 */
@Component
public class ConfigGuard {

    private final Environment environment;

    public ConfigGuard(Environment environment) {
        this.environment = environment;
    }

    public Optional<String> env(String name) {
        String value = environment.getProperty(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    /**
     * @throws ConfigException naming every missing setting, e.g. {@code "KIE: KIE_API_KEY must be set"}
     */
    public void requireEnv(Collection<String> names, String scope) {
        List<String> missing = names.stream()
                .filter(name -> env(name).isEmpty())
                .toList();
        if (!missing.isEmpty()) {
            throw new ConfigException(scope + ": " + String.join(", ", missing) + " must be set");
        }
    }

    public String require(String name, String scope) {
        requireEnv(List.of(name), scope);
        return env(name).orElseThrow();
    }
}
