package com.atlas.api.infrastructure.persistence;

import com.atlas.api.domain.usage.TenantUsageView;
import com.atlas.api.domain.usage.UsageBatch;
import com.atlas.api.domain.usage.UsageStore;
import com.atlas.eventmodel.Tenant;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UsageStore} over {@code tenants} and {@code tenant_usage}.
 * <p>
 * Inserts use {@code ON CONFLICT DO NOTHING} so concurrent first sightings of a tenant never fail
 * on the primary key; counters are bumped in place with {@code x = x + ?}.
 */
public class JdbcUsageStore implements UsageStore {

    private static final String INSERT_TENANT =
            "INSERT INTO tenants (id, name, plan_tier) VALUES (?, ?, ?) ON CONFLICT DO NOTHING";
    private static final String INSERT_USAGE =
            "INSERT INTO tenant_usage (tenant_id, scans_count, token_count) VALUES (?, 0, 0) ON CONFLICT DO NOTHING";
    private static final String ADD_TOKENS =
            "UPDATE tenant_usage SET token_count = token_count + ?, last_updated = CURRENT_TIMESTAMP WHERE tenant_id = ?";
    private static final String ADD_SCANS =
            "UPDATE tenant_usage SET scans_count = scans_count + ?, last_updated = CURRENT_TIMESTAMP WHERE tenant_id = ?";
    private static final String SELECT_VIEW =
            "SELECT t.id, t.name, t.plan_tier,"
                    + " COALESCE(tu.scans_count, 0) AS scans_count,"
                    + " COALESCE(tu.token_count, 0) AS token_count"
                    + " FROM tenants t LEFT JOIN tenant_usage tu ON t.id = tu.tenant_id";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcUsageStore(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public void inTransaction(Consumer<UsageBatch> work) {
        transactions.executeWithoutResult(status -> work.accept(new Batch(status)));
    }

    @Override
    public Optional<TenantUsageView> findUsage(String tenantId) {
        return jdbc.query(SELECT_VIEW + " WHERE t.id = ?", JdbcUsageStore::mapView, tenantId)
                .stream()
                .findFirst();
    }

    @Override
    public List<TenantUsageView> topByScans(int limit) {
        return jdbc.query(SELECT_VIEW + " ORDER BY tu.scans_count DESC NULLS LAST, t.id LIMIT ?",
                JdbcUsageStore::mapView, limit);
    }

    private static TenantUsageView mapView(ResultSet rs, int row) throws SQLException {
        return new TenantUsageView(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("plan_tier"),
                rs.getLong("scans_count"),
                rs.getLong("token_count"));
    }

    private final class Batch implements UsageBatch {

        private final TransactionStatus status;

        private Batch(TransactionStatus status) {
            this.status = status;
        }

        @Override
        public void ensureTenant(Tenant tenant) {
            jdbc.update(INSERT_TENANT, tenant.id(), tenant.name(), tenant.planTier());
            jdbc.update(INSERT_USAGE, tenant.id());
        }

        @Override
        public void addTokens(String tenantId, long tokens) {
            jdbc.update(ADD_TOKENS, tokens, tenantId);
        }

        @Override
        public void addScans(String tenantId, long scans) {
            jdbc.update(ADD_SCANS, scans, tenantId);
        }

        @Override
        public void isolated(Runnable work) {
            Object savepoint = status.createSavepoint();
            try {
                work.run();
            } catch (RuntimeException e) {
                status.rollbackToSavepoint(savepoint);
                throw e;
            }
            status.releaseSavepoint(savepoint);
        }
    }
}
