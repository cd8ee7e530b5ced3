package com.atlas.security;

import java.util.Locale;

/**
 * Single authentication entry point: turns an {@code Authorization} header into an
 * {@link Identity}.
 * <p>
 * Accepted forms (scheme is case-insensitive):
 * <ul>
 *   <li>{@code Bearer <token>} verified by the {@link TokenCodec}</li>
 *   <li>{@code ApiKey <key>} looked up in the {@link ApiKeyRegistry}</li>
 * </ul>
 * The header is split on the first space only, so the credential itself may contain spaces.
 */
public final class CredentialResolver {

    static final String BEARER = "bearer";
    static final String API_KEY = "apikey";

    private final TokenCodec tokenCodec;
    private final ApiKeyRegistry apiKeys;

    public CredentialResolver(TokenCodec tokenCodec, ApiKeyRegistry apiKeys) {
        this.tokenCodec = tokenCodec;
        this.apiKeys = apiKeys;
    }

    /**
     * Resolves the caller.
     *
     * @param authorizationHeader raw header value (may be null)
     * @return the authenticated identity
     * @throws AuthException for any of the credential failures in {@link AuthFailure}
     */
    public Identity resolve(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new AuthException(AuthFailure.MISSING_CREDENTIAL);
        }

        String[] parts = authorizationHeader.split(" ", 2);
        if (parts.length != 2) {
            throw new AuthException(AuthFailure.MALFORMED_CREDENTIAL);
        }

        String scheme = parts[0].toLowerCase(Locale.ROOT);
        String credential = parts[1];
        return switch (scheme) {
            case BEARER -> tokenCodec.verify(credential);
            case API_KEY -> apiKeys.find(credential)
                    .orElseThrow(() -> new AuthException(AuthFailure.UNKNOWN_KEY));
            default -> throw new AuthException(AuthFailure.UNSUPPORTED_SCHEME);
        };
    }
}
