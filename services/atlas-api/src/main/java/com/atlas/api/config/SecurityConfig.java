package com.atlas.api.config;

import com.atlas.observability.SensitiveDataRedactor;
import com.atlas.security.ApiKeyRegistry;
import com.atlas.security.CredentialResolver;
import com.atlas.security.Identity;
import com.atlas.security.TokenCodec;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Authentication beans: token codec, credential resolver and API-key bootstrap.
 */
@Configuration
public class SecurityConfig {

    /** Signing secret used only when none is configured in a development environment. */
    static final String DEVELOPMENT_SECRET = "atlas-development-secret-do-not-use-in-production";

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(AuthProperties auth, AtlasServiceProperties service, Clock clock) {
        return new TokenCodec(signingSecret(auth, service), clock);
    }

    @Bean
    public CredentialResolver credentialResolver(TokenCodec tokenCodec, ApiKeyRegistry apiKeyRegistry) {
        return new CredentialResolver(tokenCodec, apiKeyRegistry);
    }

    @Bean
    public ApplicationRunner bootstrapApiKeys(AuthProperties auth, ApiKeyRegistry registry) {
        return args -> {
            for (AuthProperties.BootstrapKey key : auth.bootstrapApiKeys()) {
                Map<String, String> metadata = key.tenantId() == null || key.tenantId().isBlank()
                        ? Map.of()
                        : Map.of(Identity.TENANT_ID, key.tenantId());
                registry.register(key.key(),
                        new Identity(key.id(), key.username(), key.role(), key.email(), metadata));
                log.info("Registered bootstrap API key {} for {} ({})",
                        SensitiveDataRedactor.mask(key.key()), key.username(), key.role());
            }
        };
    }

    /**
     * Picks the token signing secret.
     *
     * @throws IllegalStateException when no secret is configured outside development
     */
    static String signingSecret(AuthProperties auth, AtlasServiceProperties service) {
        if (!auth.jwtSecret().isBlank()) {
            return auth.jwtSecret();
        }
        if (!service.isDevelopment()) {
            throw new IllegalStateException(
                    "atlas.auth.jwt-secret must be set in environment '" + service.environment() + "'");
        }
        log.warn("atlas.auth.jwt-secret is not set; using the development signing secret ({} environment)",
                service.environment());
        return DEVELOPMENT_SECRET;
    }
}
