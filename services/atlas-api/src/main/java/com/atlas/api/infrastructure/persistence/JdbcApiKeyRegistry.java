package com.atlas.api.infrastructure.persistence;

import com.atlas.security.ApiKeyRegistry;
import com.atlas.security.Identity;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link ApiKeyRegistry} persisted in {@code api_keys}.
 * <p>
 * Only the SHA-256 hex digest of a key is stored, so a leaked table does not leak usable keys.
 * A {@code tenant_id} column pins the identity to one tenant.
 */
public class JdbcApiKeyRegistry implements ApiKeyRegistry {

    private static final String SELECT =
            "SELECT id, username, role, email, tenant_id FROM api_keys WHERE key_hash = ?";
    private static final String DELETE = "DELETE FROM api_keys WHERE key_hash = ?";
    private static final String INSERT =
            "INSERT INTO api_keys (key_hash, id, username, role, email, tenant_id) VALUES (?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcApiKeyRegistry(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public Optional<Identity> find(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return Optional.empty();
        }
        return jdbc.query(SELECT, JdbcApiKeyRegistry::mapIdentity, hash(apiKey)).stream().findFirst();
    }

    @Override
    public void register(String apiKey, Identity identity) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be null or blank");
        }
        String keyHash = hash(apiKey);
        transactions.executeWithoutResult(status -> {
            jdbc.update(DELETE, keyHash);
            jdbc.update(INSERT, keyHash, identity.id(), identity.username(), identity.role(), identity.email(),
                    identity.tenantId().orElse(null));
        });
    }

    @Override
    public boolean remove(String apiKey) {
        return apiKey != null && jdbc.update(DELETE, hash(apiKey)) > 0;
    }

    static String hash(String apiKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static Identity mapIdentity(ResultSet rs, int row) throws SQLException {
        Map<String, String> metadata = new HashMap<>();
        String tenantId = rs.getString("tenant_id");
        if (tenantId != null) {
            metadata.put(Identity.TENANT_ID, tenantId);
        }
        return new Identity(rs.getString("id"), rs.getString("username"), rs.getString("role"),
                rs.getString("email"), metadata);
    }
}
