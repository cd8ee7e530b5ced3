package com.atlas.security;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ApiKeyRegistry} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Used in tests and in deployments without a relational store. Contents are lost on restart.
 */
public final class InMemoryApiKeyRegistry implements ApiKeyRegistry {

    private final Map<String, Identity> keys = new ConcurrentHashMap<>();

    @Override
    public Optional<Identity> find(String apiKey) {
        if (apiKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(apiKey));
    }

    @Override
    public void register(String apiKey, Identity identity) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be null or blank");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        keys.put(apiKey, identity);
    }

    @Override
    public boolean remove(String apiKey) {
        return apiKey != null && keys.remove(apiKey) != null;
    }

    /** Number of registered keys. */
    public int size() {
        return keys.size();
    }
}
