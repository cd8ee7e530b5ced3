package com.atlas.api.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Browser origins allowed to call the API, bound from {@code atlas.cors.allowed-origins}.
 */
@ConfigurationProperties(prefix = "atlas.cors")
public record CorsProperties(List<String> allowedOrigins) {

    public CorsProperties {
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("http://localhost:3000")
                : List.copyOf(allowedOrigins);
    }
}
