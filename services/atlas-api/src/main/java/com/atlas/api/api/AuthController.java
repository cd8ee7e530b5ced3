package com.atlas.api.api;

import com.atlas.api.config.AuthProperties;
import com.atlas.api.infrastructure.web.CurrentIdentity;
import com.atlas.api.infrastructure.web.RequiresRole;
import com.atlas.security.AuthException;
import com.atlas.security.AuthFailure;
import com.atlas.security.Identity;
import com.atlas.security.Role;
import com.atlas.security.TokenCodec;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Caller introspection and token exchange.
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiresRole(Role.VIEWER)
public class AuthController {

    private final TokenCodec tokenCodec;
    private final AuthProperties auth;

    public AuthController(TokenCodec tokenCodec, AuthProperties auth) {
        this.tokenCodec = tokenCodec;
        this.auth = auth;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IdentityResponse(
            String id,
            String username,
            String role,
            String email,
            @JsonProperty("tenant_id") String tenantId) {

        static IdentityResponse from(Identity identity) {
            return new IdentityResponse(identity.id(), identity.username(), identity.role(), identity.email(),
                    identity.tenantId().orElse(null));
        }
    }

    public record TokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("token_type") String tokenType,
            @JsonProperty("expires_in") long expiresIn) {
    }

    @GetMapping("/me")
    public IdentityResponse me(@CurrentIdentity Identity identity) {
        return IdentityResponse.from(identity);
    }

    /**
     * Issues a bearer token for the caller, e.g. a CI job trading its API key for a short-lived
     * token. Tokens do not carry tenant pinning, so tenant-pinned callers are refused.
     */
    @PostMapping("/token")
    public TokenResponse token(@CurrentIdentity Identity identity) {
        if (identity.tenantId().isPresent()) {
            throw new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                    "Tenant-scoped credentials cannot be exchanged for tokens");
        }
        String token = tokenCodec.issue(identity, auth.tokenTtl());
        return new TokenResponse(token, "bearer", auth.tokenTtl().toSeconds());
    }
}
