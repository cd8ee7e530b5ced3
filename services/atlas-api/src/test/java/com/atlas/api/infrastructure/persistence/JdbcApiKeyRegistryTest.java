package com.atlas.api.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atlas.security.Identity;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcApiKeyRegistry")
class JdbcApiKeyRegistryTest {

    private H2Database db;
    private JdbcApiKeyRegistry registry;

    @BeforeEach
    void setUp() {
        db = H2Database.migrated();
        registry = new JdbcApiKeyRegistry(db.jdbc, db.transactions);
    }

    @Test
    @DisplayName("registered keys resolve to their identity, including tenant pinning")
    void findsRegistered() {
        registry.register("ci-key", new Identity("ci", "ci-bot", "viewer", "ci@acme.dev",
                Map.of(Identity.TENANT_ID, "acme")));

        var identity = registry.find("ci-key").orElseThrow();

        assertThat(identity.username()).isEqualTo("ci-bot");
        assertThat(identity.role()).isEqualTo("viewer");
        assertThat(identity.email()).isEqualTo("ci@acme.dev");
        assertThat(identity.tenantId()).contains("acme");
    }

    @Test
    @DisplayName("stores only the SHA-256 digest of the key")
    void storesHashOnly() {
        registry.register("plain-secret", Identity.of("u1", "user", "admin"));

        String stored = db.jdbc.queryForObject("SELECT key_hash FROM api_keys", String.class);

        assertThat(stored).isNotEqualTo("plain-secret").hasSize(64).isEqualTo(JdbcApiKeyRegistry.hash("plain-secret"));
    }

    @Test
    @DisplayName("re-registering a key replaces its identity")
    void replaces() {
        registry.register("k", Identity.of("u1", "first", "viewer"));
        registry.register("k", Identity.of("u2", "second", "auditor"));

        assertThat(registry.find("k")).map(Identity::username).contains("second");
        assertThat(db.jdbc.queryForObject("SELECT COUNT(*) FROM api_keys", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("remove reports whether the key existed")
    void remove() {
        registry.register("k", Identity.of("u1", "user", "viewer"));

        assertThat(registry.remove("k")).isTrue();
        assertThat(registry.remove("k")).isFalse();
        assertThat(registry.find("k")).isEmpty();
    }

    @Test
    @DisplayName("unknown, empty and blank keys")
    void edgeCases() {
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find("")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.register(" ", Identity.of("u", "u", "viewer")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
