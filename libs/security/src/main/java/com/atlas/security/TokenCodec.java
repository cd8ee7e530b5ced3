package com.atlas.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues and verifies compact HS256-signed bearer tokens.
 * <p>
 * Wire format: {@code base64url(header) "." base64url(payload) "." base64url(hmac)}, all without
 * padding. The header is {@code {"alg":"HS256","typ":"JWT"}}; the payload carries {@code sub},
 * {@code username}, {@code role}, {@code iat} and {@code exp} as epoch seconds.
 * <p>
 * Verification order is fixed: segment count, then signature (constant-time), and only then is
 * anything decoded. A forged token therefore never reaches the JSON parser, and parse errors
 * cannot be used to probe the signing key.
 * <p>
 * Tokens are stateless; there is no revocation. Time comes from the injected {@link Clock}.
 */
public final class TokenCodec {

    /** Lifetime applied when the caller does not ask for one. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    static final String ALGORITHM = "HS256";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Clock clock;

    /**
     * @param secret signing key; must not be blank
     * @param clock  time source for {@code iat}, {@code exp} and expiry checks
     */
    public TokenCodec(String secret, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    public TokenCodec(String secret) {
        this(secret, Clock.systemUTC());
    }

    /** Issues a token valid for {@link #DEFAULT_TTL}. */
    public String issue(Identity identity) {
        return issue(identity, DEFAULT_TTL);
    }

    /**
     * Issues a token for {@code identity}.
     *
     * @param identity the subject
     * @param ttl      lifetime; zero or negative yields a token that is already expired
     * @return the signed token
     */
    public String issue(Identity identity, Duration ttl) {
        long now = clock.instant().getEpochSecond();

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sub", identity.id());
        payload.put("username", identity.username());
        payload.put("role", identity.role());
        payload.put("iat", now);
        payload.put("exp", now + ttl.toSeconds());

        String signingInput = encodeJson(header) + "." + encodeJson(payload);
        return signingInput + "." + sign(signingInput);
    }

    /**
     * Verifies a token and reconstructs the identity it was issued for.
     *
     * @param token the compact token
     * @return the identity from the payload; role defaults to "viewer" when absent
     * @throws AuthException with {@link AuthFailure#MALFORMED_TOKEN}, {@link AuthFailure#BAD_SIGNATURE}
     *                       or {@link AuthFailure#EXPIRED}
     */
    public Identity verify(String token) {
        if (token == null) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN);
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN);
        }

        String expected = sign(parts[0] + "." + parts[1]);
        if (!Hmac.constantTimeEquals(expected, parts[2])) {
            throw new AuthException(AuthFailure.BAD_SIGNATURE);
        }

        JsonNode header = decodeJson(parts[0]);
        if (!ALGORITHM.equals(header.path("alg").asText())) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN, "Unsupported token algorithm");
        }

        JsonNode payload = decodeJson(parts[1]);
        JsonNode sub = payload.get("sub");
        JsonNode username = payload.get("username");
        if (sub == null || !sub.isTextual() || username == null || !username.isTextual()) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN, "Token payload lacks sub or username");
        }

        JsonNode exp = payload.get("exp");
        if (exp != null && !exp.isNumber()) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN, "Token exp is not numeric");
        }
        // A token without exp is treated as expired.
        long expiresAt = exp == null ? 0 : exp.asLong();
        if (expiresAt < clock.instant().getEpochSecond()) {
            throw new AuthException(AuthFailure.EXPIRED);
        }

        JsonNode role = payload.get("role");
        String roleName = role != null && role.isTextual() ? role.asText() : Role.VIEWER.value();
        return Identity.of(sub.asText(), username.asText(), roleName);
    }

    private String sign(String signingInput) {
        return ENCODER.encodeToString(
                Hmac.sha256(secret, signingInput.getBytes(StandardCharsets.UTF_8)));
    }

    private static String encodeJson(Map<String, Object> value) {
        try {
            return ENCODER.encodeToString(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode token segment", e);
        }
    }

    private static JsonNode decodeJson(String segment) {
        try {
            JsonNode node = MAPPER.readTree(DECODER.decode(segment));
            if (node == null || !node.isObject()) {
                throw new AuthException(AuthFailure.MALFORMED_TOKEN, "Token segment is not a JSON object");
            }
            return node;
        } catch (IllegalArgumentException | IOException e) {
            throw new AuthException(AuthFailure.MALFORMED_TOKEN, "Invalid token payload", e);
        }
    }
}
