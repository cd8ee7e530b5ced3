package com.atlas.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing and API-key bootstrap settings, bound from {@code atlas.auth.*}.
 *
 * <pre>
 * atlas:
 *   auth:
 *     jwt-secret: ${ATLAS_JWT_SECRET:}
 *     token-ttl: 1h
 *     bootstrap-api-keys:
 *       - key: ${ATLAS_CI_KEY}
 *         id: ci
 *         username: ci-bot
 *         role: viewer
 *         tenant-id: acme
 * </pre>
 *
 * @param jwtSecret        HMAC key for bearer tokens; blank falls back to a development secret
 *                         outside production
 * @param tokenTtl         lifetime of issued tokens, default 1 hour
 * @param bootstrapApiKeys keys registered at startup
 */
@ConfigurationProperties(prefix = "atlas.auth")
@Validated
public record AuthProperties(String jwtSecret, Duration tokenTtl, @Valid List<BootstrapKey> bootstrapApiKeys) {

    public AuthProperties {
        if (jwtSecret == null) {
            jwtSecret = "";
        }
        if (tokenTtl == null || tokenTtl.isZero() || tokenTtl.isNegative()) {
            tokenTtl = Duration.ofHours(1);
        }
        bootstrapApiKeys = bootstrapApiKeys == null ? List.of() : List.copyOf(bootstrapApiKeys);
    }

    /** One API key provisioned from configuration. */
    public record BootstrapKey(
            @NotBlank String key,
            @NotBlank String id,
            @NotBlank String username,
            String role,
            String email,
            String tenantId
    ) {
    }
}
