package com.atlas.api.config;

import jakarta.validation.constraints.NotBlank;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code atlas.service.*}.
 *
 * @param name        service name used in logs, metrics and the health response
 * @param environment deployment environment; defaults to {@code development}
 * @param description free text shown by {@code /actuator/info}
 */
@ConfigurationProperties(prefix = "atlas.service")
@Validated
public record AtlasServiceProperties(@NotBlank String name, String environment, String description) {

    private static final Set<String> DEVELOPMENT_ENVIRONMENTS = Set.of("development", "local", "test");

    public AtlasServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }

    /** True for environments where insecure development defaults are acceptable. */
    public boolean isDevelopment() {
        return DEVELOPMENT_ENVIRONMENTS.contains(environment.toLowerCase(Locale.ROOT));
    }
}
