package com.atlas.security;

import java.util.Optional;

/**
 * Registry mapping opaque API keys to the identity they authenticate.
 * <p>
 * Keys are created by explicit registration (for example when onboarding a CI system) and live
 * until removed; there is no expiry. Implementations are shared by every request thread and the
 * administrative endpoints, so they must tolerate concurrent reads and writes.
 */
public interface ApiKeyRegistry {

    /**
     * Looks up the identity registered for a key.
     *
     * @param apiKey the opaque key as presented by the caller
     * @return the identity, or empty if the key is unknown
     */
    Optional<Identity> find(String apiKey);

    /**
     * Registers (or replaces) the identity for a key.
     */
    void register(String apiKey, Identity identity);

    /**
     * Removes a key.
     *
     * @return true if the key existed
     */
    boolean remove(String apiKey);
}
